package xyz.firestige.coordinator.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 基于 Micrometer 的实现
 * <p>
 * 所有指标带 component 标签；gauge 以持有器方式注册一次，后续 set 只更新持有值
 */
public class MicrometerMetricsRegistry implements MetricsRegistry {

    public static final String TAG_COMPONENT = "component";
    public static final String COMPONENT = "deploy-coordinator";

    private final MeterRegistry registry;
    private final Tags tags;
    private final ConcurrentMap<String, GaugeValue> gauges = new ConcurrentHashMap<>();

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this(registry, COMPONENT);
    }

    public MicrometerMetricsRegistry(MeterRegistry registry, String component) {
        this.registry = registry;
        this.tags = Tags.of(TAG_COMPONENT, component);
    }

    @Override
    public void incrementCounter(String name) {
        Counter.builder(name).tags(tags).register(registry).increment();
    }

    @Override
    public void setGauge(String name, double value) {
        GaugeValue holder = gauges.computeIfAbsent(name, n -> {
            GaugeValue h = new GaugeValue();
            Gauge.builder(n, h, GaugeValue::get).tags(tags).strongReference(true).register(registry);
            return h;
        });
        holder.set(value);
    }

    @Override
    public void recordDuration(String name, Duration duration) {
        Timer.builder(name).tags(tags).register(registry).record(duration);
    }

    static class GaugeValue {
        private volatile double v;
        double get() { return v; }
        void set(double v) { this.v = v; }
    }
}
