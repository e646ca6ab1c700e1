package xyz.firestige.coordinator.domain.port;

/**
 * 监控端口：指标上报与告警
 */
public interface MonitoringPort {

    void recordDeploymentMetrics(DeploymentMetrics metrics);

    void sendAlert(DeploymentAlert alert);

    /**
     * 未配置监控时使用
     */
    MonitoringPort NOOP = new MonitoringPort() {
        @Override
        public void recordDeploymentMetrics(DeploymentMetrics metrics) {
        }

        @Override
        public void sendAlert(DeploymentAlert alert) {
        }
    };
}
