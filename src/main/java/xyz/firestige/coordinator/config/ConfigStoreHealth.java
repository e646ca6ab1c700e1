package xyz.firestige.coordinator.config;

/**
 * ConfigStore 存活探针结果
 *
 * @param status         固定为 healthy
 * @param configSections 顶层 section 数量
 * @param cacheEntries   缓存条目数
 * @param schemaPresent  是否配置了非空 schema
 */
public record ConfigStoreHealth(String status, int configSections, int cacheEntries, boolean schemaPresent) {

    public static final String HEALTHY = "healthy";

    public boolean isHealthy() {
        return HEALTHY.equals(status);
    }
}
