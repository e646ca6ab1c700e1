package xyz.firestige.coordinator.infrastructure.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class MicrometerMetricsRegistryTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MicrometerMetricsRegistry metrics = new MicrometerMetricsRegistry(meterRegistry);

    @Test
    void gauge_registeredOnce_valueUpdated() {
        metrics.setGauge("deployment_progress_percent", 25.0);
        metrics.setGauge("deployment_progress_percent", 75.0);

        assertThat(meterRegistry.find("deployment_progress_percent").gauges()).hasSize(1);
        assertThat(meterRegistry.get("deployment_progress_percent").gauge().value()).isEqualTo(75.0);
    }

    @Test
    void meters_taggedWithComponent() {
        metrics.incrementCounter("deployment_attempt_failed");
        metrics.recordDuration("deployment_duration", Duration.ofSeconds(2));

        assertThat(meterRegistry.get("deployment_attempt_failed")
            .tag(MicrometerMetricsRegistry.TAG_COMPONENT, MicrometerMetricsRegistry.COMPONENT)
            .counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("deployment_duration").timer().count()).isEqualTo(1L);
    }
}
