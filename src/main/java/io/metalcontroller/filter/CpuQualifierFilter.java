package io.metalcontroller.filter;

import io.metalcontroller.models.CPUInformation;
import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;

/**
 * Keeps servers whose CPU partially matches at least one CPU qualifier.
 * Servers that report no CPU never match a restricting qualifier list.
 */
public class CpuQualifierFilter implements QualifierFilter {

    @Override
    public boolean isRestricting(Qualifiers qualifiers) {
        return qualifiers.getCpu() != null && !qualifiers.getCpu().isEmpty();
    }

    @Override
    public boolean matches(Server server, Qualifiers qualifiers) {
        if (server.getCpu() == null) {
            return false;
        }
        for (CPUInformation cpu : qualifiers.getCpu()) {
            if (cpu != null && cpu.partialEqual(server.getCpu())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getName() { return "CpuQualifierFilter"; }
}
