package xyz.firestige.coordinator.domain.port;

/**
 * 服务管理端口，由外部适配器实现（容器平台、发布系统等）
 * <p>
 * 实现可以抛出任意运行时异常，编排器负责包装。
 */
public interface ServiceManagerPort {

    /**
     * 部署指定服务
     *
     * @param serviceName 服务名
     * @return 操作结果，{@code success=false} 与抛异常等价
     */
    ServiceOperationResult deployService(String serviceName);

    /**
     * 回滚指定服务到部署前状态
     */
    ServiceOperationResult rollbackService(String serviceName);

    /**
     * 查询服务状态
     */
    ServiceStatus getServiceStatus(String serviceName);

    /**
     * 清理某次部署失败遗留的资源，每次失败的尝试调用一次
     */
    void cleanupDeployment(String deploymentId);
}
