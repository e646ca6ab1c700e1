package xyz.firestige.coordinator.config.exception;

/**
 * 配置源不存在
 */
public class ConfigSourceNotFoundException extends ConfigurationException {

    private final String source;

    public ConfigSourceNotFoundException(String source) {
        super("Configuration file not found: " + source);
        this.source = source;
    }

    public ConfigSourceNotFoundException(String source, Throwable cause) {
        super("Configuration file not found: " + source, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
