package xyz.firestige.coordinator.domain.shared.exception;

/**
 * 错误类型枚举
 * 用于分类部署过程中的错误，便于日志检索和告警
 */
public enum ErrorType {

    /**
     * 部署前环境校验失败
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 部署超时
     */
    TIMEOUT_ERROR("超时错误"),

    /**
     * 服务部署/回滚调用失败
     */
    SERVICE_ERROR("服务错误"),

    /**
     * 健康检查未通过
     */
    HEALTH_CHECK_ERROR("健康检查错误"),

    /**
     * 重试次数耗尽
     */
    RETRY_EXHAUSTED("重试耗尽"),

    /**
     * 配置缺失或非法
     */
    CONFIGURATION_ERROR("配置错误"),

    /**
     * 系统错误（未预期异常包装）
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
