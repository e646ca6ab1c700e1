package xyz.firestige.coordinator.domain.deployment;

import java.util.EnumSet;
import java.util.Set;

/**
 * 部署状态枚举
 * <p>
 * 状态转换说明：
 * - INITIALIZED → IN_PROGRESS: 开始第一次尝试
 * - IN_PROGRESS → COMPLETED: 所有服务部署成功（终态）
 * - IN_PROGRESS → FAILED: 本次尝试失败
 * - FAILED → IN_PROGRESS: 重试
 * - FAILED / COMPLETED / INITIALIZED → STOPPED: 显式回滚成功
 * <p>
 * FAILED 不会自动转出，由调用方决定是否回滚。
 */
public enum DeploymentStatus {

    /**
     * 已初始化（初始状态）
     */
    INITIALIZED("initialized", "已初始化"),

    /**
     * 部署中，每次尝试进入一次
     */
    IN_PROGRESS("in_progress", "部署中"),

    /**
     * 部署完成
     */
    COMPLETED("completed", "已完成"),

    /**
     * 部署失败
     */
    FAILED("failed", "部署失败"),

    /**
     * 已回滚停止
     */
    STOPPED("stopped", "已停止");

    private final String code;
    private final String description;

    DeploymentStatus(String code, String description) {
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean canTransitionTo(DeploymentStatus target) {
        return allowedTargets().contains(target);
    }

    private Set<DeploymentStatus> allowedTargets() {
        switch (this) {
            case INITIALIZED:
                return EnumSet.of(IN_PROGRESS, STOPPED);
            case IN_PROGRESS:
                return EnumSet.of(COMPLETED, FAILED);
            case FAILED:
                return EnumSet.of(IN_PROGRESS, STOPPED);
            case COMPLETED:
                return EnumSet.of(STOPPED);
            default:
                return EnumSet.noneOf(DeploymentStatus.class);
        }
    }

    @Override
    public String toString() {
        return code;
    }
}
