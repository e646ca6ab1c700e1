package xyz.firestige.coordinator.domain.port;

import java.time.LocalDateTime;

/**
 * 部署告警
 *
 * @param deploymentId 部署 ID
 * @param severity     级别
 * @param message      内容
 * @param timestamp    产生时间
 */
public record DeploymentAlert(String deploymentId, AlertSeverity severity, String message, LocalDateTime timestamp) {

    public static DeploymentAlert of(String deploymentId, AlertSeverity severity, String message) {
        return new DeploymentAlert(deploymentId, severity, message, LocalDateTime.now());
    }
}
