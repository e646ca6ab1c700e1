package xyz.firestige.coordinator.domain.shared.exception;

/**
 * 部署异常
 * 部署前校验失败、部署超时、服务部署失败、重试耗尽时抛出。
 * {@code deploy()} 对外只会抛出本异常，其他异常均被包装。
 */
public class DeploymentException extends RuntimeException {

    private final ErrorType errorType;

    public DeploymentException(String message) {
        this(ErrorType.SYSTEM_ERROR, message);
    }

    public DeploymentException(String message, Throwable cause) {
        this(ErrorType.SYSTEM_ERROR, message, cause);
    }

    public DeploymentException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public DeploymentException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
