package io.metalcontroller.filter;

import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;

import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One stage of the qualifier filter chain.
 *
 * A stage never modifies its input: it returns either the input itself (when the class has no
 * qualifier of this kind) or a new unmodifiable map holding the servers that match.
 */
public interface QualifierFilter {

    /**
     * Whether the class carries qualifiers of this kind. A stage without qualifiers lets every server pass.
     */
    boolean isRestricting(Qualifiers qualifiers);

    /**
     * Whether a single server satisfies this kind of qualifier.
     */
    boolean matches(Server server, Qualifiers qualifiers);

    /**
     * Get the name of this filter.
     */
    String getName();

    default SortedMap<String, Server> filter(SortedMap<String, Server> candidates, Qualifiers qualifiers) {
        if (!isRestricting(qualifiers)) {
            return candidates;
        }
        SortedMap<String, Server> retained = new TreeMap<>();
        candidates.forEach((name, server) -> {
            if (matches(server, qualifiers)) {
                retained.put(name, server);
            }
        });
        return Collections.unmodifiableSortedMap(retained);
    }
}
