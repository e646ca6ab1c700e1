package xyz.firestige.coordinator.orchestration;

import xyz.firestige.coordinator.domain.deployment.DeploymentStatus;

/**
 * 一次完整部署（含可能的回滚）的结果
 *
 * @param deploymentId   部署 ID，部署配置无效、编排器未能创建时为 null
 * @param status         最终状态
 * @param attempts       实际尝试次数
 * @param rolledBack     是否已成功回滚
 * @param failureMessage 失败原因，成功时为 null
 */
public record DeploymentReport(String deploymentId, DeploymentStatus status, int attempts,
                               boolean rolledBack, String failureMessage) {

    public boolean isSuccess() {
        return status == DeploymentStatus.COMPLETED;
    }
}
