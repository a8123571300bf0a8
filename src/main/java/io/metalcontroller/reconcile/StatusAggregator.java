package io.metalcontroller.reconcile;

import io.metalcontroller.models.Server;
import io.metalcontroller.models.ServerClassStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Splits matched servers into available and in-use lists.
 */
public class StatusAggregator {

    /**
     * Both lists are sorted ascending regardless of the iteration order of {@code matched},
     * so an unchanged set always produces an equal status.
     */
    public ServerClassStatus aggregate(Map<String, Server> matched) {
        List<String> available = new ArrayList<>();
        List<String> inUse = new ArrayList<>();

        for (Map.Entry<String, Server> entry : matched.entrySet()) {
            if (entry.getValue().isInUse()) {
                inUse.add(entry.getKey());
            } else {
                available.add(entry.getKey());
            }
        }

        Collections.sort(available);
        Collections.sort(inUse);

        return new ServerClassStatus(available, inUse);
    }
}
