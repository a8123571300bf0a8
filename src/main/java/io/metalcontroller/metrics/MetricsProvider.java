package io.metalcontroller.metrics;

import com.google.common.util.concurrent.AtomicDouble;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/*
 * MetricsProvider creates and caches counters, gauges and timers tagged with the controller id.
 */
@Component
@Slf4j
public class MetricsProvider {
    private static final double[] TIMER_PERCENTILES = {0.5, 0.9, 0.99};
    private static final String HOST_NAME_TAG = "hostname";

    private final MeterRegistry registry;
    private final String hostname;
    // a registered gauge keeps reading the holder it was registered with
    private final ConcurrentMap<String, AtomicDouble> gaugeValues = new ConcurrentHashMap<>();

    @Autowired
    public MetricsProvider(
        MeterRegistry registry,
        @Value("${controller.id}") String controllerId) {
        this.registry = registry;
        this.hostname = controllerId;
        log.info("MetricsProvider initialized for the controller: {}", hostname);
    }

    /**
     * Create or retrieve a Counter metric with the given name and tags.
     */
    public Counter counter(String name, Map<String, String> tags) {
        return Counter.builder(name).tags(mapToTagArray(tags)).register(registry);
    }

    /**
     * Create or retrieve a Gauge metric with the given name and tags.
     *
     * @return the value holder backing the gauge; the same holder is returned for the same name and tags
     */
    public AtomicDouble gauge(String name, Map<String, String> tags) {
        String gaugeId = name + new TreeMap<>(tags);
        return gaugeValues.computeIfAbsent(gaugeId, id -> {
            AtomicDouble value = new AtomicDouble(0);
            Gauge.builder(name, value::get).tags(mapToTagArray(tags)).register(registry);
            return value;
        });
    }

    /**
     * Unregister a gauge created by {@link #gauge}. A later call to {@link #gauge} registers a fresh one.
     */
    public void removeGauge(String name, Map<String, String> tags) {
        if (gaugeValues.remove(name + new TreeMap<>(tags)) == null) {
            return;
        }
        Gauge gauge = registry.find(name).tags(mapToTagArray(tags)).gauge();
        if (gauge != null) {
            registry.remove(gauge);
        }
    }

    /**
     * Create or retrieve a Timer metric with the given name and tags.
     */
    public Timer timer(String name, Map<String, String> tags) {
        return Timer.builder(name)
            .tags(mapToTagArray(tags))
            .publishPercentileHistogram()
            .publishPercentiles(TIMER_PERCENTILES)
            .register(registry);
    }

    private String[] mapToTagArray(Map<String, String> tags) {
        String[] tagArray = new String[(tags.size() + 1) * 2];
        int index = 0;
        for (Map.Entry<String, String> entry : tags.entrySet()) {
            tagArray[index++] = entry.getKey();
            tagArray[index++] = entry.getValue();
        }
        tagArray[index++] = HOST_NAME_TAG;
        tagArray[index] = hostname;
        return tagArray;
    }
}
