package com.ryuqq.relay.adapter.inmemory.sink;

import com.ryuqq.relay.core.spi.TelemetrySink;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Telemetry sink that records every counter increment and histogram sample.
 *
 * <p>Intended for assertions in tests; nothing is aggregated or exported.</p>
 *
 * @author Relay Team
 * @since 1.0.0
 */
public class InMemoryTelemetrySink implements TelemetrySink {

    private final List<Sample> samples = new CopyOnWriteArrayList<>();

    @Override
    public void counter(String name, Map<String, String> tags) {
        samples.add(new Sample(Kind.COUNTER, name, 1.0, copy(tags)));
    }

    @Override
    public void histogram(String name, double value, Map<String, String> tags) {
        samples.add(new Sample(Kind.HISTOGRAM, name, value, copy(tags)));
    }

    /**
     * Total increments recorded for a counter.
     *
     * @param name counter name
     * @return count
     */
    public long count(String name) {
        return samples.stream()
            .filter(sample -> sample.kind() == Kind.COUNTER && sample.name().equals(name))
            .count();
    }

    /**
     * Increments recorded for a counter whose tags contain the given entry.
     */
    public long count(String name, String tagKey, String tagValue) {
        return samples.stream()
            .filter(sample -> sample.kind() == Kind.COUNTER && sample.name().equals(name))
            .filter(sample -> tagValue.equals(sample.tags().get(tagKey)))
            .count();
    }

    public List<Double> histogramValues(String name) {
        return samples.stream()
            .filter(sample -> sample.kind() == Kind.HISTOGRAM && sample.name().equals(name))
            .map(Sample::value)
            .collect(Collectors.toUnmodifiableList());
    }

    public List<Sample> samples() {
        return List.copyOf(samples);
    }

    public void clear() {
        samples.clear();
    }

    private static Map<String, String> copy(Map<String, String> tags) {
        return tags == null ? Map.of() : Map.copyOf(tags);
    }

    public enum Kind {
        COUNTER,
        HISTOGRAM
    }

    /**
     * One recorded metric event.
     */
    public record Sample(Kind kind, String name, double value, Map<String, String> tags) {
    }
}
