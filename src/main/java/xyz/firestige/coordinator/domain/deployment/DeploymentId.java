package xyz.firestige.coordinator.domain.deployment;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.UUID;

/**
 * DeploymentId 值对象
 *
 * 格式规则：deploy_{yyyyMMdd_HHmmss}_{8 位随机十六进制}
 * 示例：deploy_20261019_143015_9f3a1c2b
 *
 * 每次 deploy() 生成一个新 ID，同一次调用内的所有重试共用该 ID
 */
public final class DeploymentId {

    public static final String PREFIX = "deploy_";

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final String value;

    private DeploymentId(String value) {
        this.value = value;
    }

    /**
     * 生成新 ID（时间戳 + 随机后缀）
     */
    public static DeploymentId generate() {
        String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return new DeploymentId(PREFIX + LocalDateTime.now().format(TIMESTAMP) + "_" + suffix);
    }

    /**
     * 创建 DeploymentId（带验证）
     *
     * @throws IllegalArgumentException 为空时
     */
    public static DeploymentId of(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Deployment ID 不能为空");
        }
        return new DeploymentId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentId that = (DeploymentId) o;
        return Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
