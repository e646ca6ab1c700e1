package xyz.firestige.coordinator.domain.port;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 服务状态
 *
 * @param serviceName 服务名
 * @param status      状态字符串，只有 {@code "healthy"} 视为健康
 * @param details     附加信息
 */
public record ServiceStatus(String serviceName, String status, Map<String, Object> details) {

    public static final String HEALTHY = "healthy";

    public ServiceStatus {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static ServiceStatus healthy(String serviceName) {
        return new ServiceStatus(serviceName, HEALTHY, Map.of());
    }

    public static ServiceStatus of(String serviceName, String status) {
        return new ServiceStatus(serviceName, status, Map.of());
    }

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
