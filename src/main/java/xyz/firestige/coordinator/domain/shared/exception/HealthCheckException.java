package xyz.firestige.coordinator.domain.shared.exception;

/**
 * 健康检查异常
 * 第一个非 healthy 的服务即触发，不汇总
 */
public class HealthCheckException extends RuntimeException {

    private final String serviceName;

    public HealthCheckException(String message) {
        super(message);
        this.serviceName = null;
    }

    public HealthCheckException(String serviceName, String message) {
        super(message);
        this.serviceName = serviceName;
    }

    public HealthCheckException(String serviceName, String message, Throwable cause) {
        super(message, cause);
        this.serviceName = serviceName;
    }

    /**
     * @return 未通过检查的服务名，前置条件失败时为 null
     */
    public String getServiceName() {
        return serviceName;
    }
}
