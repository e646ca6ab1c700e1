package xyz.firestige.coordinator.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.config.EnvironmentLookup;
import xyz.firestige.coordinator.config.exception.ConfigurationException;
import xyz.firestige.coordinator.config.schema.ConfigSchema;
import xyz.firestige.coordinator.config.schema.ConfigSchemaLoader;
import xyz.firestige.coordinator.domain.port.EnvironmentValidatorPort;
import xyz.firestige.coordinator.domain.port.MonitoringPort;
import xyz.firestige.coordinator.domain.port.ServiceManagerPort;
import xyz.firestige.coordinator.health.ConfigStoreHealthIndicator;
import xyz.firestige.coordinator.infrastructure.environment.RuntimeEnvironmentValidator;
import xyz.firestige.coordinator.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.coordinator.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.coordinator.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.coordinator.infrastructure.monitoring.MetricsMonitoringAdapter;
import xyz.firestige.coordinator.orchestration.DeploymentLifecycleService;
import xyz.firestige.coordinator.orchestration.DeploymentOrchestratorFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * 部署协调器自动配置
 * <p>
 * ServiceManagerPort 由使用方提供；未提供时编排器在部署阶段报错。
 */
@AutoConfiguration
@EnableConfigurationProperties(CoordinatorProperties.class)
public class CoordinatorAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CoordinatorAutoConfiguration.class);

    /**
     * 配置 schema，资源不存在时使用空 schema
     */
    @Bean
    @ConditionalOnMissingBean
    public ConfigSchema coordinatorConfigSchema(CoordinatorProperties properties) {
        ResourceLoader loader = new DefaultResourceLoader();
        Resource resource = loader.getResource(properties.getSchemaLocation());
        if (!resource.exists()) {
            log.warn("配置 schema 不存在: {}，使用空 schema", properties.getSchemaLocation());
            return ConfigSchema.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            ConfigSchema schema = new ConfigSchemaLoader().load(in, properties.getSchemaLocation());
            log.info("已加载配置 schema: {}, sections={}", properties.getSchemaLocation(), schema.sectionNames());
            return schema;
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration schema: " + properties.getSchemaLocation(), e);
        }
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentLookup coordinatorEnvironmentLookup() {
        return EnvironmentLookup.system();
    }

    /**
     * 配置存储：按顺序加载文件，可选叠加环境变量，可选启动校验
     */
    @Bean
    @ConditionalOnMissingBean
    public ConfigStore configStore(ConfigSchema schema, EnvironmentLookup environment,
                                   CoordinatorProperties properties) {
        ConfigStore store = new ConfigStore(schema, properties.getEnvPrefix(), environment);
        boolean allLoaded = store.loadFromMultipleSources(properties.getSources(), properties.isUseEnvironment());
        if (!allLoaded) {
            log.warn("部分配置来源加载失败: {}", properties.getSources());
        }
        if (properties.isValidateOnStartup()) {
            store.validateConfiguration();
        }
        log.info("ConfigStore 初始化完成: sections={}", store.sectionNames());
        return store;
    }

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry coordinatorMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return registry != null ? new MicrometerMetricsRegistry(registry) : new NoopMetricsRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public MonitoringPort monitoringPort(MetricsRegistry metricsRegistry) {
        return new MetricsMonitoringAdapter(metricsRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public EnvironmentValidatorPort environmentValidatorPort(ConfigStore configStore) {
        return new RuntimeEnvironmentValidator(configStore);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentOrchestratorFactory deploymentOrchestratorFactory(
            ConfigStore configStore,
            ObjectProvider<ServiceManagerPort> serviceManager,
            EnvironmentValidatorPort environmentValidator,
            MonitoringPort monitoring,
            MetricsRegistry metricsRegistry) {
        ServiceManagerPort manager = serviceManager.getIfAvailable();
        if (manager == null) {
            log.warn("未发现 ServiceManagerPort Bean，部署将失败直至提供实现");
        }
        return new DeploymentOrchestratorFactory(configStore, manager, environmentValidator, monitoring, metricsRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeploymentLifecycleService deploymentLifecycleService(DeploymentOrchestratorFactory factory) {
        return new DeploymentLifecycleService(factory);
    }

    /**
     * 健康检查指示器
     */
    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ConfigStoreHealthIndicator configStoreHealthIndicator(ConfigStore configStore) {
            return new ConfigStoreHealthIndicator(configStore);
        }
    }
}
