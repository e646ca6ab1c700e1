package xyz.firestige.coordinator.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.coordinator.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.coordinator.infrastructure.metrics.NoopMetricsRegistry;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 部署进度监控：与部署任务并行，定期发布进度
 * <p>
 * 特点：
 * <ul>
 *   <li>只读取 {@link DeploymentProgress}，不影响部署结果</li>
 *   <li>更新 gauge 并输出 debug 日志</li>
 *   <li>{@link #stop()} 不抛异常、不阻塞</li>
 * </ul>
 */
public class DeploymentProgressMonitor {

    private static final Logger log = LoggerFactory.getLogger(DeploymentProgressMonitor.class);

    static final String GAUGE_PROGRESS = "deployment_progress_percent";

    private final String deploymentId;
    private final DeploymentProgress progress;
    private final MetricsRegistry metrics;
    private final long intervalMillis;
    private final AtomicInteger ticks = new AtomicInteger();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> future;
    private volatile boolean stopped;

    public DeploymentProgressMonitor(String deploymentId, DeploymentProgress progress,
                                     MetricsRegistry metrics, long intervalMillis) {
        this.deploymentId = deploymentId;
        this.progress = progress;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
        this.intervalMillis = intervalMillis <= 0 ? 1000L : intervalMillis;
    }

    public synchronized void start() {
        if (future != null && !stopped) return;
        stopped = false;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "deploy-monitor-" + deploymentId);
            t.setDaemon(true);
            return t;
        });
        future = scheduler.scheduleAtFixedRate(this::report, 0, intervalMillis, TimeUnit.MILLISECONDS);
    }

    private void report() {
        if (stopped) return;
        try {
            ticks.incrementAndGet();
            metrics.setGauge(GAUGE_PROGRESS, progress.getPercentage());
            log.debug("部署进度: deploymentId={}, {}/{}, current={}", deploymentId,
                    progress.getDeployedCount(), progress.getTotalServices(), progress.getCurrentService());
        } catch (RuntimeException e) {
            // 监控失败不影响主流程
            log.debug("进度上报失败, deploymentId={}: {}", deploymentId, e.getMessage());
        }
    }

    public synchronized void stop() {
        stopped = true;
        if (future != null) future.cancel(true);
        if (scheduler != null) scheduler.shutdownNow();
    }

    public boolean isRunning() { return future != null && !stopped; }

    int getTicks() { return ticks.get(); }
}
