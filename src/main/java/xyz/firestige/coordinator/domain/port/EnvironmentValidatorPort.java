package xyz.firestige.coordinator.domain.port;

/**
 * 部署前环境校验端口
 */
public interface EnvironmentValidatorPort {

    /**
     * 资源需求（CPU、内存等）是否满足
     */
    boolean validateRequirements();

    /**
     * 运行时兼容性（JVM 版本、架构等）是否满足
     */
    boolean checkCompatibility();
}
