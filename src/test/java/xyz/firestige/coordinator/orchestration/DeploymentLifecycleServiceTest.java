package xyz.firestige.coordinator.orchestration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.domain.deployment.DeploymentStatus;
import xyz.firestige.coordinator.domain.port.EnvironmentValidatorPort;
import xyz.firestige.coordinator.domain.port.MonitoringPort;
import xyz.firestige.coordinator.domain.port.ServiceManagerPort;
import xyz.firestige.coordinator.domain.port.ServiceOperationResult;
import xyz.firestige.coordinator.domain.shared.exception.DeploymentException;
import xyz.firestige.coordinator.domain.shared.exception.RollbackException;
import xyz.firestige.coordinator.testutil.TestConfigs;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@Tag("orchestration")
@DisplayName("DeploymentLifecycleService 测试")
class DeploymentLifecycleServiceTest {

    private ConfigStore config;
    private ServiceManagerPort serviceManager;
    private DeploymentLifecycleService service;

    @BeforeEach
    void setUp() {
        config = TestConfigs.deploymentStore();
        config.set("deployment.max_retries", 1);
        serviceManager = mock(ServiceManagerPort.class);
        EnvironmentValidatorPort validator = mock(EnvironmentValidatorPort.class);
        when(validator.validateRequirements()).thenReturn(true);
        when(validator.checkCompatibility()).thenReturn(true);
        when(serviceManager.deployService(anyString()))
                .thenAnswer(inv -> ServiceOperationResult.ok(inv.getArgument(0)));
        when(serviceManager.rollbackService(anyString()))
                .thenAnswer(inv -> ServiceOperationResult.ok(inv.getArgument(0)));
        service = new DeploymentLifecycleService(new DeploymentOrchestratorFactory(
                config, serviceManager, validator, MonitoringPort.NOOP, null));
    }

    @Test
    @DisplayName("部署成功返回 completed 报告")
    void run_success() {
        DeploymentReport report = service.run();

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.status()).isEqualTo(DeploymentStatus.COMPLETED);
        assertThat(report.attempts()).isEqualTo(1);
        assertThat(report.rolledBack()).isFalse();
        assertThat(report.deploymentId()).startsWith("deploy_");
    }

    @Test
    @DisplayName("rollback_on_failure 未开启时失败直接抛出，不回滚")
    void run_failureWithoutRollback() {
        when(serviceManager.deployService("api")).thenThrow(new RuntimeException("down"));

        DeploymentException ex = catchThrowableOfType(service::run, DeploymentException.class);

        assertThat(ex).isNotNull();
        verify(serviceManager, never()).rollbackService(anyString());
    }

    @Test
    @DisplayName("rollback_on_failure 开启时失败后显式回滚，原异常仍抛出")
    void run_failureTriggersRollback() {
        config.set("deployment.rollback_on_failure", true);
        when(serviceManager.deployService("api")).thenThrow(new RuntimeException("down"));

        DeploymentException ex = catchThrowableOfType(service::run, DeploymentException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.getSuppressed()).isEmpty();
        verify(serviceManager, times(3)).rollbackService(anyString());
    }

    @Test
    @DisplayName("回滚失败作为 suppressed 附加到原始部署异常")
    void run_rollbackFailureSuppressed() {
        config.set("deployment.rollback_on_failure", true);
        when(serviceManager.deployService("api")).thenThrow(new RuntimeException("down"));
        when(serviceManager.rollbackService("api")).thenThrow(new RuntimeException("rollback down"));

        DeploymentException ex = catchThrowableOfType(service::run, DeploymentException.class);

        assertThat(ex.getSuppressed()).hasSize(1);
        assertThat(ex.getSuppressed()[0]).isInstanceOf(RollbackException.class);
    }

    @Test
    @DisplayName("runQuietly 失败时返回 stopped 报告")
    void runQuietly_rolledBack() {
        config.set("deployment.rollback_on_failure", true);
        when(serviceManager.deployService("api")).thenThrow(new RuntimeException("down"));

        DeploymentReport report = service.runQuietly();

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.status()).isEqualTo(DeploymentStatus.STOPPED);
        assertThat(report.rolledBack()).isTrue();
        assertThat(report.failureMessage()).contains("Maximum deployment attempts exceeded");
    }

    @Test
    @DisplayName("rollback.enabled=false 时即使开启 rollback_on_failure 也不回滚")
    void run_rollbackDisabled() {
        config.set("deployment.rollback_on_failure", true);
        config.set("rollback.enabled", false);
        when(serviceManager.deployService("api")).thenThrow(new RuntimeException("down"));

        DeploymentReport report = service.runQuietly();

        assertThat(report.status()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(report.rolledBack()).isFalse();
        verify(serviceManager, never()).rollbackService(anyString());
    }

    @Test
    @DisplayName("runQuietly 在部署配置缺失时返回 failed 报告而不抛出")
    void runQuietly_invalidConfiguration() {
        DeploymentLifecycleService quiet = new DeploymentLifecycleService(new DeploymentOrchestratorFactory(
                new ConfigStore(), serviceManager, mock(EnvironmentValidatorPort.class), MonitoringPort.NOOP, null));

        DeploymentReport report = quiet.runQuietly();

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.deploymentId()).isNull();
        assertThat(report.status()).isEqualTo(DeploymentStatus.FAILED);
        assertThat(report.attempts()).isZero();
        assertThat(report.rolledBack()).isFalse();
        assertThat(report.failureMessage()).contains("Invalid deployment configuration");
        verify(serviceManager, never()).deployService(anyString());
    }
}
