package xyz.firestige.coordinator.domain.port;

/**
 * 服务部署/回滚结果
 *
 * @param serviceName 服务名
 * @param success     是否成功
 * @param message     说明，失败时为原因
 */
public record ServiceOperationResult(String serviceName, boolean success, String message) {

    public static ServiceOperationResult ok(String serviceName) {
        return new ServiceOperationResult(serviceName, true, null);
    }

    public static ServiceOperationResult fail(String serviceName, String message) {
        return new ServiceOperationResult(serviceName, false, message);
    }
}
