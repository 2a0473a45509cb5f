package xyz.firestige.release.util;

import xyz.firestige.release.infrastructure.metrics.MetricsRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 记录计数器取值，便于断言
 */
public class CountingMetricsRegistry implements MetricsRegistry {

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();
    private final Map<String, Double> gauges = new ConcurrentHashMap<>();

    @Override
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, n -> new AtomicLong()).incrementAndGet();
    }

    @Override
    public void setGauge(String name, double value) {
        gauges.put(name, value);
    }

    public long count(String name) {
        AtomicLong counter = counters.get(name);
        return counter == null ? 0 : counter.get();
    }

    public double gauge(String name) {
        return gauges.getOrDefault(name, 0d);
    }
}
