package io.metalcontroller.filter;

import io.metalcontroller.models.Qualifiers;
import io.metalcontroller.models.Server;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import static io.metalcontroller.TestFixtures.server;
import static io.metalcontroller.TestFixtures.serverWithLabels;
import static org.assertj.core.api.Assertions.assertThat;

class LabelSelectorFilterTest {

    private final LabelSelectorFilter filter = new LabelSelectorFilter();

    private SortedMap<String, Server> candidates(Server... servers) {
        SortedMap<String, Server> map = new TreeMap<>();
        for (Server s : servers) {
            map.put(s.getName(), s);
        }
        return map;
    }

    private Qualifiers selectors(List<Map<String, String>> labelSelectors) {
        Qualifiers qualifiers = new Qualifiers();
        qualifiers.setLabelSelectors(labelSelectors);
        return qualifiers;
    }

    @Test
    void testMatchesKeyWithEqualValue() {
        SortedMap<String, Server> input = candidates(
                serverWithLabels("m4", Map.of("role", "worker", "zone", "a")),
                serverWithLabels("m5", Map.of("role", "controlplane")));

        SortedMap<String, Server> result = filter.filter(input, selectors(List.of(Map.of("role", "worker"))));

        assertThat(result).containsOnlyKeys("m4");
    }

    @Test
    void testAnyKeyWithinSelectorIsEnough() {
        Map<String, String> selector = new LinkedHashMap<>();
        selector.put("role", "worker");
        selector.put("zone", "b");
        SortedMap<String, Server> input = candidates(
                serverWithLabels("only-role", Map.of("role", "worker", "zone", "a")),
                serverWithLabels("only-zone", Map.of("role", "storage", "zone", "b")),
                serverWithLabels("neither", Map.of("role", "storage", "zone", "c")));

        SortedMap<String, Server> result = filter.filter(input, selectors(List.of(selector)));

        assertThat(result).containsOnlyKeys("only-role", "only-zone");
    }

    @Test
    void testAnySelectorIsEnough() {
        SortedMap<String, Server> input = candidates(
                serverWithLabels("a", Map.of("rack", "r1")),
                serverWithLabels("b", Map.of("rack", "r2")),
                serverWithLabels("c", Map.of("rack", "r3")));

        SortedMap<String, Server> result = filter.filter(input,
                selectors(List.of(Map.of("rack", "r1"), Map.of("rack", "r3"))));

        assertThat(result).containsOnlyKeys("a", "c");
    }

    @Test
    void testKeyPresentWithDifferentValueDoesNotMatch() {
        SortedMap<String, Server> input = candidates(serverWithLabels("m1", Map.of("role", "worker")));

        assertThat(filter.filter(input, selectors(List.of(Map.of("role", "Worker"))))).isEmpty();
    }

    @Test
    void testUnlabelledServerIsRemovedByRestrictingSelectors() {
        SortedMap<String, Server> input = candidates(server("bare", true, false));

        assertThat(filter.filter(input, selectors(List.of(Map.of("role", "worker"))))).isEmpty();
    }

    @Test
    void testEmptySelectorListIsNoOp() {
        SortedMap<String, Server> input = candidates(server("bare", true, false));

        assertThat(filter.filter(input, selectors(List.of()))).isSameAs(input);
    }
}
