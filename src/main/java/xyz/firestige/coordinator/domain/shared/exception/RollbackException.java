package xyz.firestige.coordinator.domain.shared.exception;

/**
 * 回滚异常
 * 回滚前置条件不满足或任一服务回滚失败时抛出，不会自动重试
 */
public class RollbackException extends RuntimeException {

    private final ErrorType errorType;

    public RollbackException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public RollbackException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
