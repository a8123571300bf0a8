package io.metalcontroller.filter;

import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;
import io.metalcontroller.models.SystemInformation;

/**
 * Keeps servers whose system information partially matches at least one qualifier.
 */
public class SystemInformationQualifierFilter implements QualifierFilter {

    @Override
    public boolean isRestricting(Qualifiers qualifiers) {
        return qualifiers.getSystemInformation() != null && !qualifiers.getSystemInformation().isEmpty();
    }

    @Override
    public boolean matches(Server server, Qualifiers qualifiers) {
        if (server.getSystemInformation() == null) {
            return false;
        }
        for (SystemInformation sysInfo : qualifiers.getSystemInformation()) {
            if (sysInfo != null && sysInfo.partialEqual(server.getSystemInformation())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getName() { return "SystemInformationQualifierFilter"; }
}
