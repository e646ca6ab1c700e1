package xyz.firestige.coordinator.orchestration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.domain.deployment.DeploymentId;
import xyz.firestige.coordinator.domain.deployment.DeploymentRecord;
import xyz.firestige.coordinator.domain.deployment.DeploymentSettings;
import xyz.firestige.coordinator.domain.deployment.DeploymentStatus;
import xyz.firestige.coordinator.domain.port.AlertSeverity;
import xyz.firestige.coordinator.domain.port.DeploymentAlert;
import xyz.firestige.coordinator.domain.port.DeploymentMetrics;
import xyz.firestige.coordinator.domain.port.EnvironmentValidatorPort;
import xyz.firestige.coordinator.domain.port.MonitoringPort;
import xyz.firestige.coordinator.domain.port.ServiceManagerPort;
import xyz.firestige.coordinator.domain.port.ServiceOperationResult;
import xyz.firestige.coordinator.domain.port.ServiceStatus;
import xyz.firestige.coordinator.domain.shared.exception.DeploymentException;
import xyz.firestige.coordinator.domain.shared.exception.ErrorType;
import xyz.firestige.coordinator.domain.shared.exception.HealthCheckException;
import xyz.firestige.coordinator.domain.shared.exception.RollbackException;
import xyz.firestige.coordinator.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.coordinator.infrastructure.metrics.NoopMetricsRegistry;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 部署编排器
 * <p>
 * 职责：
 * 1. 部署前环境校验
 * 2. 按配置顺序逐个部署服务，单次尝试受 deployment.timeout 约束
 * 3. 失败重试（最多 deployment.max_retries 次），每次失败后清理资源
 * 4. 可选健康检查，首个不健康服务即失败
 * 5. 显式回滚（不自动触发），成功与失败都发送告警
 * <p>
 * 一个实例同一时刻只处理一次部署，并发调用 {@link #deploy()} 不受支持。
 * 所有越过端口的异常都会被包装为 {@link DeploymentException}、{@link RollbackException}
 * 或 {@link HealthCheckException}。
 */
public class DeploymentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DeploymentOrchestrator.class);

    public static final String MDC_DEPLOYMENT_ID = "deploymentId";
    static final String METRIC_ATTEMPT_FAILED = "deployment_attempt_failed";
    static final String METRIC_CLEANUP_FAILED = "deployment_cleanup_failed";

    private final ConfigStore config;
    private final ServiceManagerPort serviceManager;
    private final EnvironmentValidatorPort environmentValidator;
    private final MonitoringPort monitoring;
    private final MetricsRegistry metrics;

    private volatile DeploymentSettings settings;
    private volatile DeploymentRecord record;
    private volatile LocalDateTime startedAt;

    /**
     * @throws DeploymentException 配置缺少非空的 deployment section
     */
    public DeploymentOrchestrator(ConfigStore config,
                                  ServiceManagerPort serviceManager,
                                  EnvironmentValidatorPort environmentValidator,
                                  MonitoringPort monitoring,
                                  MetricsRegistry metrics) {
        this.config = config;
        this.settings = DeploymentSettings.from(config);
        this.serviceManager = serviceManager;
        this.environmentValidator = environmentValidator;
        this.monitoring = monitoring != null ? monitoring : MonitoringPort.NOOP;
        this.metrics = metrics != null ? metrics : new NoopMetricsRegistry();
        this.record = DeploymentRecord.initial(settings);
    }

    // ========== 部署 ==========

    /**
     * 执行一次完整部署：生成新 ID，环境校验，带重试的部署协调
     *
     * @return 部署成功返回 true
     * @throws DeploymentException 校验失败、重试耗尽或其他任何错误
     */
    public boolean deploy() {
        settings = DeploymentSettings.from(config);
        DeploymentId id = DeploymentId.generate();
        record = DeploymentRecord.start(id, settings);
        startedAt = LocalDateTime.now();
        MDC.put(MDC_DEPLOYMENT_ID, id.getValue());
        try {
            log.info("开始部署: deploymentId={}, {}", id, settings);
            validatePreDeployment();
            boolean result = coordinateDeployment();
            log.info("部署完成: deploymentId={}, attempts={}, elapsed={}ms",
                    id, record.getAttempt(), record.getElapsed().toMillis());
            return result;
        } catch (DeploymentException e) {
            log.error("部署失败: deploymentId={}, attempts={}, reason={}", id, record.getAttempt(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("部署异常: deploymentId={}", id, e);
            throw new DeploymentException(ErrorType.SYSTEM_ERROR, "Deployment failed: " + e.getMessage(), e);
        } finally {
            MDC.remove(MDC_DEPLOYMENT_ID);
        }
    }

    /**
     * 部署前环境校验，失败不重试
     *
     * @throws DeploymentException 校验端口未配置、资源要求或兼容性检查未通过
     */
    public boolean validatePreDeployment() {
        if (environmentValidator == null) {
            throw new DeploymentException(ErrorType.VALIDATION_ERROR, "Environment validator not configured");
        }
        boolean requirements;
        boolean compatible;
        try {
            requirements = environmentValidator.validateRequirements();
            compatible = requirements && environmentValidator.checkCompatibility();
        } catch (RuntimeException e) {
            throw new DeploymentException(ErrorType.VALIDATION_ERROR,
                    "Pre-deployment validation failed: " + e.getMessage(), e);
        }
        if (!requirements) {
            throw new DeploymentException(ErrorType.VALIDATION_ERROR, "Pre-deployment validation failed: requirements");
        }
        if (!compatible) {
            throw new DeploymentException(ErrorType.VALIDATION_ERROR, "Pre-deployment validation failed: compatibility");
        }
        log.debug("部署前校验通过");
        return true;
    }

    /**
     * 重试循环：1..max_retries 次尝试，任一次成功即返回
     *
     * @throws DeploymentException 服务管理端口未配置或重试耗尽
     */
    public boolean coordinateDeployment() {
        if (serviceManager == null) {
            throw new DeploymentException(ErrorType.CONFIGURATION_ERROR, "Service manager not configured");
        }
        if (!record.hasId()) {
            record = DeploymentRecord.start(DeploymentId.generate(), settings);
        }
        int maxRetries = settings.getMaxRetries();
        AttemptResult last = null;
        for (int i = 1; i <= maxRetries; i++) {
            record.startAttempt();
            last = runAttempt(record.getAttempt());
            if (last.isSuccess()) {
                record.complete();
                recordMetricsSafely(last);
                return true;
            }
            record.fail(last.getMessage());
            metrics.incrementCounter(METRIC_ATTEMPT_FAILED);
            log.warn("第 {}/{} 次部署尝试失败, 耗时 {}ms: {}", last.getAttempt(), maxRetries,
                    last.getDuration().toMillis(), last.getMessage());
            cleanupSafely();
        }
        throw new DeploymentException(ErrorType.RETRY_EXHAUSTED,
                "Maximum deployment attempts exceeded (max_retries=" + maxRetries + ")",
                last != null ? last.getFailure() : null);
    }

    private AttemptResult runAttempt(int attempt) {
        LocalDateTime start = LocalDateTime.now();
        DeploymentProgress progress = new DeploymentProgress(settings.getServices().size());
        try {
            deployWithTimeout(settings.getTimeoutSeconds(), progress);
            if (settings.isVerifyHealth()) {
                orchestrateHealthChecks();
            }
            return AttemptResult.ok(attempt, Duration.between(start, LocalDateTime.now()),
                    progress.getDeployedServices());
        } catch (RuntimeException e) {
            return AttemptResult.fail(attempt, Duration.between(start, LocalDateTime.now()), e,
                    progress.getDeployedServices());
        }
    }

    /**
     * 在超时预算内部署全部服务，同时运行进度监控
     *
     * @throws DeploymentException 超时或任一服务部署失败
     */
    public boolean deployWithTimeout(int timeoutSeconds) {
        return deployWithTimeout(timeoutSeconds, new DeploymentProgress(settings.getServices().size()));
    }

    private boolean deployWithTimeout(int timeoutSeconds, DeploymentProgress progress) {
        String deploymentId = currentIdValue();
        String mdcId = MDC.get(MDC_DEPLOYMENT_ID);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "deploy-worker-" + deploymentId);
            t.setDaemon(true);
            return t;
        });
        DeploymentProgressMonitor monitor = new DeploymentProgressMonitor(
                deploymentId, progress, metrics, settings.getMonitorIntervalMillis());
        Future<Boolean> future = executor.submit(() -> {
            if (mdcId != null) MDC.put(MDC_DEPLOYMENT_ID, mdcId);
            try {
                return deployAllServices(settings.getServices(), progress);
            } finally {
                MDC.remove(MDC_DEPLOYMENT_ID);
            }
        });
        monitor.start();
        try {
            return future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new DeploymentException(ErrorType.TIMEOUT_ERROR,
                    "Deployment timeout after " + timeoutSeconds + " seconds", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DeploymentException de) {
                throw de;
            }
            throw new DeploymentException(ErrorType.SERVICE_ERROR, "Deployment failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new DeploymentException(ErrorType.SYSTEM_ERROR, "Deployment interrupted", e);
        } finally {
            monitor.stop();
            executor.shutdownNow();
        }
    }

    /**
     * 按顺序部署服务，任一失败即中止本次尝试
     *
     * @throws DeploymentException 首个失败的服务
     */
    public boolean deployAllServices(Map<String, Map<String, Object>> services) {
        return deployAllServices(services, new DeploymentProgress(services.size()));
    }

    private boolean deployAllServices(Map<String, Map<String, Object>> services, DeploymentProgress progress) {
        for (String serviceName : services.keySet()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new DeploymentException(ErrorType.TIMEOUT_ERROR,
                        "Deployment cancelled before service " + serviceName);
            }
            progress.markStarted(serviceName);
            ServiceOperationResult result;
            try {
                result = serviceManager.deployService(serviceName);
            } catch (RuntimeException e) {
                throw new DeploymentException(ErrorType.SERVICE_ERROR,
                        "Service deployment failed: " + serviceName + ": " + e.getMessage(), e);
            }
            if (result == null || !result.success()) {
                String reason = result == null ? "no result" : result.message();
                throw new DeploymentException(ErrorType.SERVICE_ERROR,
                        "Service deployment failed: " + serviceName + ": " + reason);
            }
            progress.markDeployed(serviceName);
            log.info("服务部署成功: {} ({}/{})", serviceName, progress.getDeployedCount(), progress.getTotalServices());
        }
        return true;
    }

    // ========== 健康检查 ==========

    /**
     * 逐个查询服务状态，首个非 healthy 的服务立即失败
     *
     * @throws HealthCheckException 服务不健康、状态查询失败或服务管理端口未配置
     */
    public boolean orchestrateHealthChecks() {
        if (serviceManager == null) {
            throw new HealthCheckException("Service manager not configured");
        }
        for (String serviceName : settings.getServiceNames()) {
            ServiceStatus status;
            try {
                status = serviceManager.getServiceStatus(serviceName);
            } catch (RuntimeException e) {
                throw new HealthCheckException(serviceName,
                        "Health check failed for service " + serviceName + ": " + e.getMessage(), e);
            }
            if (status == null || !status.isHealthy()) {
                String reported = status == null ? "no status" : status.status();
                throw new HealthCheckException(serviceName,
                        "Health checks failed: service " + serviceName + " reported " + reported);
            }
        }
        log.info("健康检查通过: {} 个服务", settings.getServiceNames().size());
        return true;
    }

    // ========== 回滚 ==========

    /**
     * 回滚全部服务，需由调用方显式触发
     *
     * @throws RollbackException 回滚未启用、服务管理端口未配置、无部署 ID，或任一服务回滚失败
     */
    public boolean executeRollback() {
        if (!settings.isRollbackEnabled()) {
            throw new RollbackException(ErrorType.CONFIGURATION_ERROR, "Rollback not enabled");
        }
        if (serviceManager == null) {
            throw new RollbackException(ErrorType.CONFIGURATION_ERROR, "Service manager not configured");
        }
        if (!record.hasId()) {
            throw new RollbackException(ErrorType.VALIDATION_ERROR, "No deployment ID available for rollback");
        }
        String deploymentId = record.getId().getValue();
        MDC.put(MDC_DEPLOYMENT_ID, deploymentId);
        try {
            log.info("开始回滚: deploymentId={}", deploymentId);
            for (String serviceName : settings.getServiceNames()) {
                rollbackService(deploymentId, serviceName);
            }
            if (record.getStatus().canTransitionTo(DeploymentStatus.STOPPED)) {
                record.stop();
            } else {
                log.warn("回滚完成但状态 {} 无法转为 stopped", record.getStatus());
            }
            sendAlertSafely(AlertSeverity.WARNING, "Rollback completed for deployment " + deploymentId);
            log.info("回滚完成: deploymentId={}", deploymentId);
            return true;
        } finally {
            MDC.remove(MDC_DEPLOYMENT_ID);
        }
    }

    private void rollbackService(String deploymentId, String serviceName) {
        RuntimeException cause = null;
        String reason;
        try {
            ServiceOperationResult result = serviceManager.rollbackService(serviceName);
            if (result != null && result.success()) {
                log.info("服务回滚成功: {}", serviceName);
                return;
            }
            reason = result == null ? "no result" : result.message();
        } catch (RuntimeException e) {
            cause = e;
            reason = e.getMessage();
        }
        String message = "Rollback failed: " + serviceName + ": " + reason;
        log.error("回滚失败: deploymentId={}, service={}, reason={}", deploymentId, serviceName, reason);
        sendAlertSafely(AlertSeverity.CRITICAL, message);
        throw new RollbackException(ErrorType.SERVICE_ERROR, message, cause);
    }

    // ========== 辅助 ==========

    private void cleanupSafely() {
        String deploymentId = record.getId().getValue();
        try {
            serviceManager.cleanupDeployment(deploymentId);
        } catch (RuntimeException e) {
            metrics.incrementCounter(METRIC_CLEANUP_FAILED);
            log.warn("清理部署资源失败: deploymentId={}, reason={}", deploymentId, e.getMessage());
        }
    }

    private void recordMetricsSafely(AttemptResult result) {
        LocalDateTime start = startedAt != null ? startedAt : record.getCreatedAt();
        DeploymentMetrics snapshot = new DeploymentMetrics(record.getId().getValue(), record.getAttempt(),
                Duration.between(start, LocalDateTime.now()), result.getDeployedServices(), settings.getStrategy());
        try {
            monitoring.recordDeploymentMetrics(snapshot);
        } catch (RuntimeException e) {
            log.warn("部署指标上报失败: {}", e.getMessage());
        }
    }

    private void sendAlertSafely(AlertSeverity severity, String message) {
        try {
            monitoring.sendAlert(DeploymentAlert.of(currentIdValue(), severity, message));
        } catch (RuntimeException e) {
            log.warn("告警发送失败: severity={}, reason={}", severity, e.getMessage());
        }
    }

    private String currentIdValue() {
        return record.hasId() ? record.getId().getValue() : "none";
    }

    // ========== 查询 ==========

    public DeploymentStatus getStatus() {
        return record.getStatus();
    }

    public int getCurrentAttempt() {
        return record.getAttempt();
    }

    /**
     * @return 当前部署 ID，尚未调用 deploy() 时为 null
     */
    public String getDeploymentId() {
        return record.hasId() ? record.getId().getValue() : null;
    }

    public DeploymentRecord getRecord() {
        return record;
    }

    public DeploymentSettings getSettings() {
        return settings;
    }
}
