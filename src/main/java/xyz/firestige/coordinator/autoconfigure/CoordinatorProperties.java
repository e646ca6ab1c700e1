package xyz.firestige.coordinator.autoconfigure;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import xyz.firestige.coordinator.config.ConfigStore;

import java.util.ArrayList;
import java.util.List;

/**
 * 部署协调器配置属性
 * prefix: coordinator
 */
@Validated
@ConfigurationProperties(prefix = "coordinator")
public class CoordinatorProperties {

    /**
     * 环境变量前缀，变量名为 PREFIX_SECTION_FIELD
     */
    @NotBlank
    private String envPrefix = ConfigStore.DEFAULT_ENV_PREFIX;

    /**
     * 配置 schema 位置（Spring Resource 语法）
     */
    @NotBlank
    private String schemaLocation = "classpath:coordinator-schema.yml";

    /**
     * 配置文件列表，按顺序加载，后者覆盖前者
     */
    @NotNull
    private List<String> sources = new ArrayList<>();

    /**
     * 是否叠加环境变量（最高优先级）
     */
    private boolean useEnvironment = true;

    /**
     * 启动时是否执行 schema 校验
     */
    private boolean validateOnStartup = true;

    public String getEnvPrefix() {
        return envPrefix;
    }

    public void setEnvPrefix(String envPrefix) {
        this.envPrefix = envPrefix;
    }

    public String getSchemaLocation() {
        return schemaLocation;
    }

    public void setSchemaLocation(String schemaLocation) {
        this.schemaLocation = schemaLocation;
    }

    public List<String> getSources() {
        return sources;
    }

    public void setSources(List<String> sources) {
        this.sources = sources;
    }

    public boolean isUseEnvironment() {
        return useEnvironment;
    }

    public void setUseEnvironment(boolean useEnvironment) {
        this.useEnvironment = useEnvironment;
    }

    public boolean isValidateOnStartup() {
        return validateOnStartup;
    }

    public void setValidateOnStartup(boolean validateOnStartup) {
        this.validateOnStartup = validateOnStartup;
    }
}
