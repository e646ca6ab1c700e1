package xyz.firestige.coordinator.infrastructure.metrics;

import java.time.Duration;

/**
 * 指标注册表抽象，隔离 Micrometer
 */
public interface MetricsRegistry {
    void incrementCounter(String name);
    void setGauge(String name, double value);
    void recordDuration(String name, Duration duration);
}
