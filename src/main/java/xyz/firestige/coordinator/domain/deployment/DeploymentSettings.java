package xyz.firestige.coordinator.domain.deployment;

import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.config.exception.ConfigurationException;
import xyz.firestige.coordinator.domain.shared.exception.DeploymentException;
import xyz.firestige.coordinator.domain.shared.exception.ErrorType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 部署参数快照（不可变）
 * <p>
 * 从 {@link ConfigStore} 读取：
 * <ul>
 *   <li>deployment.timeout: 单次尝试超时秒数，默认 300</li>
 *   <li>deployment.max_retries: 最大尝试次数，默认 3</li>
 *   <li>deployment.strategy: 部署策略，默认 blue-green（仅记录）</li>
 *   <li>deployment.verify_health: 每次尝试部署后是否做健康检查，默认 false</li>
 *   <li>deployment.rollback_on_failure: 失败后是否由生命周期服务发起回滚，默认 false</li>
 *   <li>deployment.monitor_interval_ms: 进度监控周期，默认 1000</li>
 *   <li>rollback.enabled: 是否允许回滚，默认 true</li>
 *   <li>services: 服务名 -> 服务参数（保持配置顺序）</li>
 * </ul>
 */
public final class DeploymentSettings {

    public static final int DEFAULT_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final long DEFAULT_MONITOR_INTERVAL_MS = 1000L;
    public static final String DEFAULT_STRATEGY = "blue-green";

    private final int timeoutSeconds;
    private final int maxRetries;
    private final String strategy;
    private final boolean verifyHealth;
    private final boolean rollbackOnFailure;
    private final boolean rollbackEnabled;
    private final long monitorIntervalMillis;
    private final Map<String, Map<String, Object>> services;

    private DeploymentSettings(int timeoutSeconds, int maxRetries, String strategy, boolean verifyHealth,
                               boolean rollbackOnFailure, boolean rollbackEnabled, long monitorIntervalMillis,
                               Map<String, Map<String, Object>> services) {
        this.timeoutSeconds = timeoutSeconds;
        this.maxRetries = maxRetries;
        this.strategy = strategy;
        this.verifyHealth = verifyHealth;
        this.rollbackOnFailure = rollbackOnFailure;
        this.rollbackEnabled = rollbackEnabled;
        this.monitorIntervalMillis = monitorIntervalMillis;
        this.services = Collections.unmodifiableMap(services);
    }

    /**
     * 读取部署参数
     *
     * @throws DeploymentException 缺少非空 deployment section，或参数无法转换
     */
    public static DeploymentSettings from(ConfigStore config) {
        if (config == null || !hasDeploymentSection(config)) {
            throw new DeploymentException(ErrorType.CONFIGURATION_ERROR, "Invalid deployment configuration");
        }
        try {
            return new DeploymentSettings(
                    config.getInt("deployment.timeout", DEFAULT_TIMEOUT_SECONDS),
                    config.getInt("deployment.max_retries", DEFAULT_MAX_RETRIES),
                    config.getString("deployment.strategy", DEFAULT_STRATEGY),
                    config.getBoolean("deployment.verify_health", false),
                    config.getBoolean("deployment.rollback_on_failure", false),
                    config.getBoolean("rollback.enabled", true),
                    config.getLong("deployment.monitor_interval_ms", DEFAULT_MONITOR_INTERVAL_MS),
                    readServices(config));
        } catch (ConfigurationException e) {
            throw new DeploymentException(ErrorType.CONFIGURATION_ERROR,
                    "Invalid deployment configuration: " + e.getMessage(), e);
        }
    }

    private static boolean hasDeploymentSection(ConfigStore config) {
        if (!config.containsPath("deployment")) {
            return false;
        }
        return config.get("deployment") instanceof Map<?, ?> section && !section.isEmpty();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Map<String, Object>> readServices(ConfigStore config) {
        Map<String, Map<String, Object>> services = new LinkedHashMap<>();
        if (!config.containsPath("services")) {
            return services;
        }
        Object raw = config.get("services");
        if (raw instanceof Map<?, ?> map) {
            map.forEach((name, params) -> services.put(String.valueOf(name),
                    params instanceof Map<?, ?> p ? (Map<String, Object>) p : Map.of()));
        } else if (raw instanceof List<?> names) {
            names.forEach(name -> services.put(String.valueOf(name), Map.of()));
        } else {
            throw new DeploymentException(ErrorType.CONFIGURATION_ERROR,
                    "Invalid services configuration: expected an object or a list");
        }
        return services;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public String getStrategy() {
        return strategy;
    }

    public boolean isVerifyHealth() {
        return verifyHealth;
    }

    public boolean isRollbackOnFailure() {
        return rollbackOnFailure;
    }

    public boolean isRollbackEnabled() {
        return rollbackEnabled;
    }

    public long getMonitorIntervalMillis() {
        return monitorIntervalMillis;
    }

    /**
     * @return 服务名 -> 参数，按配置顺序
     */
    public Map<String, Map<String, Object>> getServices() {
        return services;
    }

    public List<String> getServiceNames() {
        return List.copyOf(services.keySet());
    }

    @Override
    public String toString() {
        return "DeploymentSettings{timeout=" + timeoutSeconds + "s, maxRetries=" + maxRetries
                + ", strategy=" + strategy + ", verifyHealth=" + verifyHealth
                + ", rollbackEnabled=" + rollbackEnabled + ", services=" + services.keySet() + '}';
    }
}
