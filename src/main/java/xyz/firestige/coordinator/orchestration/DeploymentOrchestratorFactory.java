package xyz.firestige.coordinator.orchestration;

import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.domain.port.EnvironmentValidatorPort;
import xyz.firestige.coordinator.domain.port.MonitoringPort;
import xyz.firestige.coordinator.domain.port.ServiceManagerPort;
import xyz.firestige.coordinator.infrastructure.metrics.MetricsRegistry;

/**
 * 编排器工厂：每次部署创建一个新实例，共享配置与端口
 */
public class DeploymentOrchestratorFactory {

    private final ConfigStore config;
    private final ServiceManagerPort serviceManager;
    private final EnvironmentValidatorPort environmentValidator;
    private final MonitoringPort monitoring;
    private final MetricsRegistry metrics;

    public DeploymentOrchestratorFactory(ConfigStore config,
                                         ServiceManagerPort serviceManager,
                                         EnvironmentValidatorPort environmentValidator,
                                         MonitoringPort monitoring,
                                         MetricsRegistry metrics) {
        this.config = config;
        this.serviceManager = serviceManager;
        this.environmentValidator = environmentValidator;
        this.monitoring = monitoring;
        this.metrics = metrics;
    }

    /**
     * @throws xyz.firestige.coordinator.domain.shared.exception.DeploymentException 配置缺少 deployment section
     */
    public DeploymentOrchestrator create() {
        return new DeploymentOrchestrator(config, serviceManager, environmentValidator, monitoring, metrics);
    }
}
