package xyz.firestige.coordinator.config.exception;

/**
 * 配置异常基类
 * 配置加载、解析、取值失败时抛出
 */
public class ConfigurationException extends RuntimeException {

    /**
     * 出错的配置路径（dot-path），可能为空
     */
    private final String path;

    public ConfigurationException(String message) {
        super(message);
        this.path = null;
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
    }

    public ConfigurationException(String path, String message) {
        super(message);
        this.path = path;
    }

    public ConfigurationException(String path, String message, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
