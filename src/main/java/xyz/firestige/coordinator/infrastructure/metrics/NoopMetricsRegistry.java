package xyz.firestige.coordinator.infrastructure.metrics;

import java.time.Duration;

/**
 * 未接入 Micrometer 时使用，丢弃所有指标
 */
public class NoopMetricsRegistry implements MetricsRegistry {
    @Override public void incrementCounter(String name) { }
    @Override public void setGauge(String name, double value) { }
    @Override public void recordDuration(String name, Duration duration) { }
}
