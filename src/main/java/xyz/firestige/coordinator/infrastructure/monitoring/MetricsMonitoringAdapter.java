package xyz.firestige.coordinator.infrastructure.monitoring;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.coordinator.domain.port.DeploymentAlert;
import xyz.firestige.coordinator.domain.port.DeploymentMetrics;
import xyz.firestige.coordinator.domain.port.MonitoringPort;
import xyz.firestige.coordinator.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.coordinator.infrastructure.metrics.NoopMetricsRegistry;

import java.util.Locale;

/**
 * MonitoringPort 默认实现
 * <p>
 * 指标写入 {@link MetricsRegistry}，告警写日志（CRITICAL 为 ERROR，其余为 WARN），
 * 同时按级别计数，便于外部告警系统基于指标触发。
 */
public class MetricsMonitoringAdapter implements MonitoringPort {

    private static final Logger log = LoggerFactory.getLogger(MetricsMonitoringAdapter.class);

    public static final String METRIC_DEPLOYMENTS_SUCCEEDED = "deployment_succeeded";
    public static final String METRIC_DEPLOYMENT_ATTEMPTS = "deployment_last_attempts";
    public static final String METRIC_DEPLOYMENT_DURATION = "deployment_duration";
    public static final String METRIC_ALERT_PREFIX = "deployment_alert_";

    private final MetricsRegistry metrics;

    public MetricsMonitoringAdapter(MetricsRegistry metrics) {
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
    }

    @Override
    public void recordDeploymentMetrics(DeploymentMetrics snapshot) {
        metrics.incrementCounter(METRIC_DEPLOYMENTS_SUCCEEDED);
        metrics.setGauge(METRIC_DEPLOYMENT_ATTEMPTS, snapshot.attempts());
        if (snapshot.duration() != null) {
            metrics.recordDuration(METRIC_DEPLOYMENT_DURATION, snapshot.duration());
        }
        log.info("部署指标: deploymentId={}, attempts={}, duration={}ms, services={}",
                snapshot.deploymentId(), snapshot.attempts(),
                snapshot.duration() == null ? -1 : snapshot.duration().toMillis(), snapshot.services());
    }

    @Override
    public void sendAlert(DeploymentAlert alert) {
        metrics.incrementCounter(METRIC_ALERT_PREFIX + alert.severity().name().toLowerCase(Locale.ROOT));
        switch (alert.severity()) {
            case CRITICAL:
                log.error("[ALERT][{}] deploymentId={}: {}", alert.severity(), alert.deploymentId(), alert.message());
                break;
            case WARNING:
            case INFO:
            default:
                log.warn("[ALERT][{}] deploymentId={}: {}", alert.severity(), alert.deploymentId(), alert.message());
                break;
        }
    }
}
