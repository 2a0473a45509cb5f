package xyz.firestige.release.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer 实现：计数器按名称缓存，仪表值保存在 AtomicLong（double 位模式）中供 Gauge 读取
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    private static final String COMPONENT_TAG = "component";
    private static final String COMPONENT = "release-orchestrator";

    private final MeterRegistry registry;
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name) {
        counters.computeIfAbsent(name, n -> Counter.builder(n)
                        .tag(COMPONENT_TAG, COMPONENT)
                        .register(registry))
                .increment();
    }

    @Override
    public void setGauge(String name, double value) {
        AtomicLong bits = gaugeValues.computeIfAbsent(name, n -> {
            AtomicLong holder = new AtomicLong(Double.doubleToLongBits(0d));
            Gauge.builder(n, holder, h -> Double.longBitsToDouble(h.get()))
                    .tag(COMPONENT_TAG, COMPONENT)
                    .strongReference(true)
                    .register(registry);
            return holder;
        });
        bits.set(Double.doubleToLongBits(value));
    }
}
