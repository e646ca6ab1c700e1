package xyz.firestige.coordinator.domain.port;

import java.time.Duration;
import java.util.List;

/**
 * 一次成功部署的指标快照
 *
 * @param deploymentId 部署 ID
 * @param attempts     实际尝试次数
 * @param duration     从 deploy() 开始到完成的耗时
 * @param services     已部署的服务，按部署顺序
 * @param strategy     部署策略
 */
public record DeploymentMetrics(String deploymentId, int attempts, Duration duration,
                                List<String> services, String strategy) {

    public DeploymentMetrics {
        services = services == null ? List.of() : List.copyOf(services);
    }
}
