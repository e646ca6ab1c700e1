package xyz.firestige.coordinator.health;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.config.ConfigStoreHealth;

/**
 * ConfigStore 存活探针
 */
public class ConfigStoreHealthIndicator implements HealthIndicator {

    private final ConfigStore configStore;

    public ConfigStoreHealthIndicator(ConfigStore configStore) {
        this.configStore = configStore;
    }

    @Override
    public Health health() {
        try {
            ConfigStoreHealth status = configStore.healthCheck();
            Health.Builder builder = status.isHealthy() ? Health.up() : Health.down();
            return builder
                    .withDetail("status", status.status())
                    .withDetail("configSections", status.configSections())
                    .withDetail("cacheEntries", status.cacheEntries())
                    .withDetail("schemaPresent", status.schemaPresent())
                    .build();
        } catch (RuntimeException e) {
            return Health.down(e).build();
        }
    }
}
