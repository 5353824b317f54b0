package com.hellblazer.luciferase.pool.health;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable metric snapshot attached to a health sample. Every metric is optional; an absent metric
 * never crosses a bound and is skipped by comparisons.
 */
public final class HealthMetrics {

    private static final HealthMetrics EMPTY = new HealthMetrics(new EnumMap<>(HealthMetric.class));

    private final Map<HealthMetric, Double> values;

    private HealthMetrics(EnumMap<HealthMetric, Double> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static HealthMetrics empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public OptionalDouble get(HealthMetric metric) {
        var value = values.get(metric);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public boolean has(HealthMetric metric) {
        return values.containsKey(metric);
    }

    public Set<HealthMetric> present() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public OptionalDouble responseTime() {
        return get(HealthMetric.RESPONSE_TIME);
    }

    public OptionalDouble throughput() {
        return get(HealthMetric.THROUGHPUT);
    }

    public OptionalDouble errorRate() {
        return get(HealthMetric.ERROR_RATE);
    }

    public OptionalDouble utilization() {
        return get(HealthMetric.UTILIZATION);
    }

    public static class Builder {
        private final EnumMap<HealthMetric, Double> values = new EnumMap<>(HealthMetric.class);

        public Builder responseTime(double millis) {
            return with(HealthMetric.RESPONSE_TIME, millis);
        }

        public Builder throughput(double opsPerSecond) {
            return with(HealthMetric.THROUGHPUT, opsPerSecond);
        }

        public Builder errorRate(double rate) {
            return with(HealthMetric.ERROR_RATE, rate);
        }

        public Builder utilization(double fraction) {
            return with(HealthMetric.UTILIZATION, fraction);
        }

        public Builder with(HealthMetric metric, double value) {
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException(metric.getLabel() + " must be finite, got " + value);
            }
            values.put(metric, value);
            return this;
        }

        public HealthMetrics build() {
            return values.isEmpty() ? EMPTY : new HealthMetrics(new EnumMap<>(values));
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof HealthMetrics other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.entrySet()
                     .stream()
                     .map(e -> e.getKey().getLabel() + "=" + e.getValue())
                     .collect(Collectors.joining(", ", "{", "}"));
    }
}
