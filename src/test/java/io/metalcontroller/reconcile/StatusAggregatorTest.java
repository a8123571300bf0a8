package io.metalcontroller.reconcile;

import io.metalcontroller.models.Server;
import io.metalcontroller.models.ServerClassStatus;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

import static io.metalcontroller.TestFixtures.server;
import static org.assertj.core.api.Assertions.assertThat;

class StatusAggregatorTest {

    private final StatusAggregator aggregator = new StatusAggregator();

    @Test
    void testSplitsByUsageAndSorts() {
        Map<String, Server> matched = new LinkedHashMap<>();
        matched.put("m9", server("m9", true, false));
        matched.put("m10", server("m10", true, true));
        matched.put("m2", server("m2", true, false));
        matched.put("m1", server("m1", true, true));

        ServerClassStatus status = aggregator.aggregate(matched);

        assertThat(status.getServersAvailable()).containsExactly("m2", "m9");
        assertThat(status.getServersInUse()).containsExactly("m1", "m10");
    }

    @Test
    void testListsAreDisjointAndCoverEveryMatch() {
        Map<String, Server> matched = new HashMap<>();
        for (int i = 0; i < 20; i++) {
            matched.put("server-" + i, server("server-" + i, true, i % 3 == 0));
        }

        ServerClassStatus status = aggregator.aggregate(matched);

        assertThat(status.getServersAvailable()).doesNotContainAnyElementsOf(status.getServersInUse());
        assertThat(status.getServersAvailable().size() + status.getServersInUse().size()).isEqualTo(20);
        assertThat(status.getServersAvailable()).isSorted();
        assertThat(status.getServersInUse()).isSorted();
    }

    @Test
    void testNoMatches() {
        ServerClassStatus status = aggregator.aggregate(Map.of());

        assertThat(status).isEqualTo(new ServerClassStatus());
    }
}
