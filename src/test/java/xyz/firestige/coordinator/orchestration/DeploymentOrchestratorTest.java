package xyz.firestige.coordinator.orchestration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import xyz.firestige.coordinator.config.ConfigStore;
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
import xyz.firestige.coordinator.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.coordinator.testutil.TestConfigs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * DeploymentOrchestrator 单元测试
 * <p>
 * 测试范围：
 * - 重试与每次失败后的清理
 * - 部署前校验
 * - 超时
 * - 健康检查短路
 * - 回滚前置条件与告警
 */
@Tag("unit")
@Tag("orchestration")
@DisplayName("DeploymentOrchestrator 单元测试")
class DeploymentOrchestratorTest {

    private ConfigStore config;
    private ServiceManagerPort serviceManager;
    private EnvironmentValidatorPort validator;
    private MonitoringPort monitoring;

    @BeforeEach
    void setUp() {
        config = TestConfigs.deploymentStore();
        serviceManager = mock(ServiceManagerPort.class);
        validator = mock(EnvironmentValidatorPort.class);
        monitoring = mock(MonitoringPort.class);

        when(validator.validateRequirements()).thenReturn(true);
        when(validator.checkCompatibility()).thenReturn(true);
        when(serviceManager.deployService(anyString()))
                .thenAnswer(inv -> ServiceOperationResult.ok(inv.getArgument(0)));
        when(serviceManager.rollbackService(anyString()))
                .thenAnswer(inv -> ServiceOperationResult.ok(inv.getArgument(0)));
        when(serviceManager.getServiceStatus(anyString()))
                .thenAnswer(inv -> ServiceStatus.healthy(inv.getArgument(0)));
    }

    private DeploymentOrchestrator orchestrator() {
        return new DeploymentOrchestrator(config, serviceManager, validator, monitoring, new NoopMetricsRegistry());
    }

    @Test
    @DisplayName("配置缺少 deployment section 时构造失败")
    void constructor_withoutDeploymentSection_fails() {
        ConfigStore empty = new ConfigStore();

        assertThatThrownBy(() -> new DeploymentOrchestrator(empty, serviceManager, validator, monitoring, null))
                .isInstanceOf(DeploymentException.class)
                .hasMessageContaining("Invalid deployment configuration");
    }

    @Test
    @DisplayName("构造后状态为 initialized，尚无部署 ID")
    void constructor_initialState() {
        DeploymentOrchestrator orchestrator = orchestrator();

        assertThat(orchestrator.getStatus()).isEqualTo(DeploymentStatus.INITIALIZED);
        assertThat(orchestrator.getCurrentAttempt()).isZero();
        assertThat(orchestrator.getDeploymentId()).isNull();
    }

    @Nested
    @DisplayName("部署与重试")
    class DeployAndRetry {

        @Test
        @Tag("happy-path")
        @DisplayName("全部服务按顺序部署成功，上报一次指标")
        void deploy_success() {
            DeploymentOrchestrator orchestrator = orchestrator();

            assertThat(orchestrator.deploy()).isTrue();

            assertThat(orchestrator.getStatus()).isEqualTo(DeploymentStatus.COMPLETED);
            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(1);
            assertThat(orchestrator.getDeploymentId()).startsWith("deploy_");
            InOrder order = inOrder(serviceManager);
            order.verify(serviceManager).deployService("api");
            order.verify(serviceManager).deployService("worker");
            order.verify(serviceManager).deployService("gateway");
            ArgumentCaptor<DeploymentMetrics> metrics = ArgumentCaptor.forClass(DeploymentMetrics.class);
            verify(monitoring).recordDeploymentMetrics(metrics.capture());
            assertThat(metrics.getValue().deploymentId()).isEqualTo(orchestrator.getDeploymentId());
            assertThat(metrics.getValue().attempts()).isEqualTo(1);
            assertThat(metrics.getValue().services()).containsExactly("api", "worker", "gateway");
            assertThat(metrics.getValue().strategy()).isEqualTo("rolling");
            verify(serviceManager, never()).cleanupDeployment(anyString());
        }

        @Test
        @DisplayName("服务始终抛异常: 3 次尝试后抛 DeploymentException，清理 3 次且 ID 相同")
        void deploy_alwaysFailing_exhaustsRetries() {
            when(serviceManager.deployService(anyString())).thenThrow(new IllegalStateException("cluster down"));
            DeploymentOrchestrator orchestrator = orchestrator();

            DeploymentException ex = catchThrowableOfType(orchestrator::deploy, DeploymentException.class);

            assertThat(ex).isNotNull();
            assertThat(ex.getErrorType()).isEqualTo(ErrorType.RETRY_EXHAUSTED);
            assertThat(ex.getMessage()).contains("Maximum deployment attempts exceeded").contains("max_retries=3");
            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(3);
            assertThat(orchestrator.getStatus()).isEqualTo(DeploymentStatus.FAILED);
            String id = orchestrator.getDeploymentId();
            assertThat(id).isNotNull();
            verify(serviceManager, times(3)).cleanupDeployment(id);
            verify(serviceManager, times(3)).cleanupDeployment(anyString());
            verify(monitoring, never()).recordDeploymentMetrics(any());
        }

        @Test
        @DisplayName("某个服务失败时中止本次尝试，不继续部署后续服务")
        void deploy_failureAbortsRemainingServices() {
            config.set("deployment.max_retries", 1);
            when(serviceManager.deployService("worker")).thenThrow(new RuntimeException("worker broken"));
            DeploymentOrchestrator orchestrator = orchestrator();

            assertThatThrownBy(orchestrator::deploy).isInstanceOf(DeploymentException.class);

            verify(serviceManager).deployService("api");
            verify(serviceManager).deployService("worker");
            verify(serviceManager, never()).deployService("gateway");
        }

        @Test
        @DisplayName("success=false 的结果与抛异常等价")
        void deploy_unsuccessfulResultCountsAsFailure() {
            config.set("deployment.max_retries", 1);
            when(serviceManager.deployService("api")).thenReturn(ServiceOperationResult.fail("api", "quota exceeded"));
            DeploymentOrchestrator orchestrator = orchestrator();

            DeploymentException ex = catchThrowableOfType(orchestrator::deploy, DeploymentException.class);

            assertThat(ex.getCause()).hasMessageContaining("quota exceeded");
            verify(serviceManager).cleanupDeployment(orchestrator.getDeploymentId());
        }

        @Test
        @DisplayName("第二次尝试成功: 尝试次数 2，清理 1 次")
        void deploy_succeedsOnRetry() {
            when(serviceManager.deployService("api"))
                    .thenThrow(new RuntimeException("transient"))
                    .thenReturn(ServiceOperationResult.ok("api"));
            DeploymentOrchestrator orchestrator = orchestrator();

            assertThat(orchestrator.deploy()).isTrue();

            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(2);
            assertThat(orchestrator.getStatus()).isEqualTo(DeploymentStatus.COMPLETED);
            verify(serviceManager, times(1)).cleanupDeployment(orchestrator.getDeploymentId());
        }

        @Test
        @DisplayName("清理失败不影响后续重试")
        void deploy_cleanupFailureDoesNotAbortRetries() {
            when(serviceManager.deployService(anyString())).thenThrow(new RuntimeException("down"));
            doThrow(new RuntimeException("cleanup broken")).when(serviceManager).cleanupDeployment(anyString());
            DeploymentOrchestrator orchestrator = orchestrator();

            assertThatThrownBy(orchestrator::deploy).isInstanceOf(DeploymentException.class);

            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(3);
            verify(serviceManager, times(3)).cleanupDeployment(anyString());
        }

        @Test
        @DisplayName("指标上报失败不改变部署结果")
        void deploy_monitoringFailureIgnored() {
            doThrow(new RuntimeException("metrics backend down")).when(monitoring).recordDeploymentMetrics(any());

            assertThat(orchestrator().deploy()).isTrue();
        }

        @Test
        @DisplayName("每次 deploy() 生成新的部署 ID 并重置尝试次数")
        void deploy_newIdPerCall() {
            DeploymentOrchestrator orchestrator = orchestrator();
            orchestrator.deploy();
            String first = orchestrator.getDeploymentId();

            orchestrator.deploy();

            assertThat(orchestrator.getDeploymentId()).isNotEqualTo(first);
            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(1);
        }

        @Test
        @DisplayName("服务管理端口未配置时抛 DeploymentException")
        void deploy_withoutServiceManager() {
            DeploymentOrchestrator orchestrator =
                    new DeploymentOrchestrator(config, null, validator, monitoring, null);

            assertThatThrownBy(orchestrator::deploy)
                    .isInstanceOf(DeploymentException.class)
                    .hasMessageContaining("Service manager not configured");
        }
    }

    @Nested
    @DisplayName("部署前校验")
    class PreDeployment {

        @Test
        @DisplayName("资源要求不满足时失败且不重试")
        void requirementsFail() {
            when(validator.validateRequirements()).thenReturn(false);
            DeploymentOrchestrator orchestrator = orchestrator();

            DeploymentException ex = catchThrowableOfType(orchestrator::deploy, DeploymentException.class);

            assertThat(ex.getMessage()).isEqualTo("Pre-deployment validation failed: requirements");
            assertThat(ex.getErrorType()).isEqualTo(ErrorType.VALIDATION_ERROR);
            assertThat(orchestrator.getCurrentAttempt()).isZero();
            verify(serviceManager, never()).deployService(anyString());
        }

        @Test
        @DisplayName("兼容性检查不通过")
        void compatibilityFail() {
            when(validator.checkCompatibility()).thenReturn(false);

            assertThatThrownBy(() -> orchestrator().deploy())
                    .isInstanceOf(DeploymentException.class)
                    .hasMessage("Pre-deployment validation failed: compatibility");
        }

        @Test
        @DisplayName("校验端口未配置")
        void validatorMissing() {
            DeploymentOrchestrator orchestrator =
                    new DeploymentOrchestrator(config, serviceManager, null, monitoring, null);

            assertThatThrownBy(orchestrator::deploy)
                    .isInstanceOf(DeploymentException.class)
                    .hasMessageContaining("Environment validator not configured");
        }

        @Test
        @DisplayName("校验端口抛出的外部异常被包装")
        void validatorThrows_wrapped() {
            when(validator.validateRequirements()).thenThrow(new NullPointerException("probe"));

            assertThatThrownBy(() -> orchestrator().deploy())
                    .isInstanceOf(DeploymentException.class)
                    .hasCauseInstanceOf(NullPointerException.class);
        }
    }

    @Nested
    @DisplayName("超时")
    class Timeout {

        @Test
        @DisplayName("超过超时时间抛 TIMEOUT_ERROR")
        void deployWithTimeout_timesOut() {
            when(serviceManager.deployService("api")).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return ServiceOperationResult.ok("api");
            });
            DeploymentOrchestrator orchestrator = orchestrator();

            DeploymentException ex = catchThrowableOfType(() -> orchestrator.deployWithTimeout(1),
                    DeploymentException.class);

            assertThat(ex.getErrorType()).isEqualTo(ErrorType.TIMEOUT_ERROR);
            assertThat(ex.getMessage()).isEqualTo("Deployment timeout after 1 seconds");
        }

        @Test
        @DisplayName("超时与其他失败一样参与重试")
        void timeout_isRetried() {
            config.set("deployment.timeout", 1);
            config.set("deployment.max_retries", 2);
            when(serviceManager.deployService("api")).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return ServiceOperationResult.ok("api");
            });
            DeploymentOrchestrator orchestrator = orchestrator();

            DeploymentException ex = catchThrowableOfType(orchestrator::deploy, DeploymentException.class);

            assertThat(ex.getErrorType()).isEqualTo(ErrorType.RETRY_EXHAUSTED);
            assertThat(ex.getCause()).isInstanceOf(DeploymentException.class);
            assertThat(((DeploymentException) ex.getCause()).getErrorType()).isEqualTo(ErrorType.TIMEOUT_ERROR);
            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(2);
            verify(serviceManager, times(2)).cleanupDeployment(orchestrator.getDeploymentId());
        }
    }

    @Nested
    @DisplayName("健康检查")
    class HealthChecks {

        @Test
        @DisplayName("全部 healthy 时通过")
        void allHealthy() {
            assertThat(orchestrator().orchestrateHealthChecks()).isTrue();
            verify(serviceManager, times(3)).getServiceStatus(anyString());
        }

        @Test
        @DisplayName("首个不健康服务立即失败，不再查询后续服务")
        void shortCircuitsOnFirstUnhealthy() {
            when(serviceManager.getServiceStatus("worker"))
                    .thenReturn(ServiceStatus.of("worker", "degraded"));

            HealthCheckException ex = catchThrowableOfType(() -> orchestrator().orchestrateHealthChecks(),
                    HealthCheckException.class);

            assertThat(ex.getServiceName()).isEqualTo("worker");
            assertThat(ex.getMessage()).contains("worker").contains("degraded");
            verify(serviceManager, never()).getServiceStatus("gateway");
        }

        @Test
        @DisplayName("状态查询异常被包装为 HealthCheckException")
        void statusQueryFailure_wrapped() {
            when(serviceManager.getServiceStatus("api")).thenThrow(new IllegalStateException("timeout"));

            assertThatThrownBy(() -> orchestrator().orchestrateHealthChecks())
                    .isInstanceOf(HealthCheckException.class)
                    .hasCauseInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("verify_health 开启时健康检查失败导致重试")
        void verifyHealth_failureRetried() {
            config.set("deployment.verify_health", true);
            config.set("deployment.max_retries", 2);
            when(serviceManager.getServiceStatus("gateway"))
                    .thenReturn(ServiceStatus.of("gateway", "starting"))
                    .thenAnswer(inv -> ServiceStatus.healthy("gateway"));
            DeploymentOrchestrator orchestrator = orchestrator();

            assertThat(orchestrator.deploy()).isTrue();

            assertThat(orchestrator.getCurrentAttempt()).isEqualTo(2);
            verify(serviceManager).cleanupDeployment(orchestrator.getDeploymentId());
        }
    }

    @Nested
    @DisplayName("回滚")
    class Rollback {

        @Test
        @DisplayName("rollback.enabled=false 时抛 RollbackException 且不调用 rollbackService")
        void rollbackDisabled() {
            config.set("rollback.enabled", false);
            DeploymentOrchestrator orchestrator = orchestrator();
            orchestrator.deploy();

            assertThatThrownBy(orchestrator::executeRollback)
                    .isInstanceOf(RollbackException.class)
                    .hasMessage("Rollback not enabled");
            verify(serviceManager, never()).rollbackService(anyString());
        }

        @Test
        @DisplayName("没有部署 ID 时无法回滚")
        void rollbackWithoutDeploymentId() {
            assertThatThrownBy(() -> orchestrator().executeRollback())
                    .isInstanceOf(RollbackException.class)
                    .hasMessage("No deployment ID available for rollback");
            verify(serviceManager, never()).rollbackService(anyString());
        }

        @Test
        @DisplayName("服务管理端口未配置时无法回滚")
        void rollbackWithoutServiceManager() {
            DeploymentOrchestrator orchestrator =
                    new DeploymentOrchestrator(config, null, validator, monitoring, null);

            assertThatThrownBy(orchestrator::executeRollback)
                    .isInstanceOf(RollbackException.class)
                    .hasMessage("Service manager not configured");
        }

        @Test
        @DisplayName("回滚成功: 全部服务回滚，状态 stopped，发送一次告警")
        void rollbackSuccess() {
            when(serviceManager.deployService(anyString())).thenThrow(new RuntimeException("down"));
            DeploymentOrchestrator orchestrator = orchestrator();
            assertThatThrownBy(orchestrator::deploy).isInstanceOf(DeploymentException.class);

            assertThat(orchestrator.executeRollback()).isTrue();

            assertThat(orchestrator.getStatus()).isEqualTo(DeploymentStatus.STOPPED);
            verify(serviceManager, times(3)).rollbackService(anyString());
            ArgumentCaptor<DeploymentAlert> alert = ArgumentCaptor.forClass(DeploymentAlert.class);
            verify(monitoring, times(1)).sendAlert(alert.capture());
            assertThat(alert.getValue().severity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(alert.getValue().deploymentId()).isEqualTo(orchestrator.getDeploymentId());
        }

        @Test
        @DisplayName("回滚失败: 发送一次 CRITICAL 告警后抛 RollbackException")
        void rollbackFailure() {
            DeploymentOrchestrator orchestrator = orchestrator();
            orchestrator.deploy();
            when(serviceManager.rollbackService("worker")).thenThrow(new IllegalStateException("image missing"));

            RollbackException ex = catchThrowableOfType(orchestrator::executeRollback, RollbackException.class);

            assertThat(ex.getMessage()).startsWith("Rollback failed").contains("worker");
            assertThat(ex).hasCauseInstanceOf(IllegalStateException.class);
            ArgumentCaptor<DeploymentAlert> alert = ArgumentCaptor.forClass(DeploymentAlert.class);
            verify(monitoring, times(1)).sendAlert(alert.capture());
            assertThat(alert.getValue().severity()).isEqualTo(AlertSeverity.CRITICAL);
            verify(serviceManager, never()).rollbackService("gateway");
            assertThat(orchestrator.getStatus()).isEqualTo(DeploymentStatus.COMPLETED);
        }

        @Test
        @DisplayName("告警发送失败不掩盖回滚结果")
        void rollbackAlertFailureIgnored() {
            DeploymentOrchestrator orchestrator = orchestrator();
            orchestrator.deploy();
            doThrow(new RuntimeException("pager down")).when(monitoring).sendAlert(any());

            assertThat(orchestrator.executeRollback()).isTrue();
        }
    }
}
