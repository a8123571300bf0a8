package io.metalcontroller.filter;

import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.SortedMap;

/**
 * Applies the CPU, system information and label stages in sequence.
 *
 * Each stage only sees what the previous one kept, so the result is the set of candidates
 * that satisfy every non-empty qualifier kind.
 */
@Slf4j
public class QualifierFilterChain {

    private final List<QualifierFilter> filters;

    public QualifierFilterChain() {
        this(List.of(
                new CpuQualifierFilter(),
                new SystemInformationQualifierFilter(),
                new LabelSelectorFilter()));
    }

    public QualifierFilterChain(List<QualifierFilter> filters) {
        this.filters = List.copyOf(filters);
    }

    public SortedMap<String, Server> apply(SortedMap<String, Server> candidates, Qualifiers qualifiers) {
        Qualifiers effective = qualifiers != null ? qualifiers : new Qualifiers();
        SortedMap<String, Server> result = candidates;

        for (QualifierFilter filter : filters) {
            int before = result.size();
            result = filter.filter(result, effective);
            log.debug("Filter - {} kept {} of {} servers", filter.getName(), result.size(), before);
            if (result.isEmpty()) {
                break;
            }
        }

        return result;
    }

    public List<QualifierFilter> getFilters() {
        return filters;
    }
}
