package xyz.firestige.release.infrastructure.metrics;

/**
 * 未引入 Micrometer 时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name) {
    }

    @Override
    public void setGauge(String name, double value) {
    }
}
