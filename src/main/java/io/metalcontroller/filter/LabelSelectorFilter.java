package io.metalcontroller.filter;

import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;

import java.util.Map;
import java.util.Objects;

/**
 * Keeps servers that carry at least one label of at least one selector with an equal value.
 *
 * Keys within one selector are OR-ed, not AND-ed: {@code {role: worker, zone: a}} matches a server
 * labelled only {@code role=worker}.
 */
public class LabelSelectorFilter implements QualifierFilter {

    @Override
    public boolean isRestricting(Qualifiers qualifiers) {
        return qualifiers.getLabelSelectors() != null && !qualifiers.getLabelSelectors().isEmpty();
    }

    @Override
    public boolean matches(Server server, Qualifiers qualifiers) {
        Map<String, String> labels = server.getLabels();
        if (labels == null || labels.isEmpty()) {
            return false;
        }
        for (Map<String, String> selector : qualifiers.getLabelSelectors()) {
            if (selector == null) {
                continue;
            }
            for (Map.Entry<String, String> entry : selector.entrySet()) {
                if (labels.containsKey(entry.getKey()) && Objects.equals(labels.get(entry.getKey()), entry.getValue())) {
                    return true;
                }
            }
        }
        return false;
    }

    @Override
    public String getName() { return "LabelSelectorFilter"; }
}
