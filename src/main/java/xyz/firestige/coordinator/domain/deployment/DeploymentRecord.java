package xyz.firestige.coordinator.domain.deployment;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * 单次 deploy() 调用的部署记录
 * <p>
 * 只通过自身的状态转换方法修改；尝试次数在一次调用内严格递增且不超过 max_retries。
 */
public class DeploymentRecord {

    private final DeploymentId id;
    private final DeploymentSettings settings;
    private final LocalDateTime createdAt;

    private volatile DeploymentStatus status;
    private volatile int attempt;
    private volatile String lastFailure;
    private volatile LocalDateTime finishedAt;

    private DeploymentRecord(DeploymentId id, DeploymentSettings settings) {
        this.id = id;
        this.settings = settings;
        this.createdAt = LocalDateTime.now();
        this.status = DeploymentStatus.INITIALIZED;
        this.attempt = 0;
    }

    /**
     * 编排器构造时的占位记录，尚无部署 ID
     */
    public static DeploymentRecord initial(DeploymentSettings settings) {
        return new DeploymentRecord(null, settings);
    }

    public static DeploymentRecord start(DeploymentId id, DeploymentSettings settings) {
        if (id == null) {
            throw new IllegalArgumentException("Deployment ID 不能为空");
        }
        return new DeploymentRecord(id, settings);
    }

    /**
     * 进入新一轮尝试
     *
     * @throws IllegalStateException 状态不允许或已达到 max_retries
     */
    public synchronized void startAttempt() {
        if (attempt >= settings.getMaxRetries()) {
            throw new IllegalStateException("Attempt " + (attempt + 1) + " exceeds max_retries "
                    + settings.getMaxRetries() + " for deployment " + id);
        }
        transitionTo(DeploymentStatus.IN_PROGRESS);
        attempt++;
    }

    public synchronized void complete() {
        transitionTo(DeploymentStatus.COMPLETED);
        lastFailure = null;
        finishedAt = LocalDateTime.now();
    }

    public synchronized void fail(String reason) {
        transitionTo(DeploymentStatus.FAILED);
        lastFailure = reason;
        finishedAt = LocalDateTime.now();
    }

    public synchronized void stop() {
        transitionTo(DeploymentStatus.STOPPED);
        finishedAt = LocalDateTime.now();
    }

    private void transitionTo(DeploymentStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("状态转换不允许: " + status + " -> " + target + ", deploymentId: " + id);
        }
        status = target;
    }

    public boolean hasId() {
        return id != null;
    }

    public DeploymentId getId() {
        return id;
    }

    public DeploymentSettings getSettings() {
        return settings;
    }

    public DeploymentStatus getStatus() {
        return status;
    }

    public int getAttempt() {
        return attempt;
    }

    public String getLastFailure() {
        return lastFailure;
    }

    public LocalDateTime getCreatedAt() {
        return createdAt;
    }

    public LocalDateTime getFinishedAt() {
        return finishedAt;
    }

    public Duration getElapsed() {
        LocalDateTime end = finishedAt != null ? finishedAt : LocalDateTime.now();
        return Duration.between(createdAt, end);
    }

    @Override
    public String toString() {
        return "DeploymentRecord{id=" + id + ", status=" + status + ", attempt=" + attempt + '}';
    }
}
