package xyz.firestige.coordinator.config.exception;

/**
 * 配置校验异常
 * 必填缺失、类型无法转换、越界、不在允许值范围内时抛出
 */
public class ConfigValidationException extends ConfigurationException {

    public ConfigValidationException(String path, String message) {
        super(path, message);
    }

    public ConfigValidationException(String path, String message, Throwable cause) {
        super(path, message, cause);
    }
}
