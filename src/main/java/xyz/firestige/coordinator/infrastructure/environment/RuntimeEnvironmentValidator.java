package xyz.firestige.coordinator.infrastructure.environment;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.coordinator.config.ConfigStore;
import xyz.firestige.coordinator.domain.port.EnvironmentValidatorPort;

import java.util.List;
import java.util.Locale;

/**
 * 基于 JVM 运行时信息的环境校验
 * <p>
 * 阈值从 {@link ConfigStore} 的 environment section 读取：
 * <ul>
 *   <li>min_cpu_cores，默认 1</li>
 *   <li>min_memory_mb，默认 256</li>
 *   <li>min_java_version，默认 17</li>
 *   <li>allowed_architectures，默认 amd64,x86_64,aarch64,arm64</li>
 * </ul>
 */
public class RuntimeEnvironmentValidator implements EnvironmentValidatorPort {

    private static final Logger log = LoggerFactory.getLogger(RuntimeEnvironmentValidator.class);

    static final List<String> DEFAULT_ARCHITECTURES = List.of("amd64", "x86_64", "aarch64", "arm64");

    private final ConfigStore config;
    private final RuntimeInfo runtime;

    public RuntimeEnvironmentValidator(ConfigStore config) {
        this(config, RuntimeInfo.current());
    }

    public RuntimeEnvironmentValidator(ConfigStore config, RuntimeInfo runtime) {
        this.config = config;
        this.runtime = runtime;
    }

    @Override
    public boolean validateRequirements() {
        int minCores = config.getInt("environment.min_cpu_cores", 1);
        long minMemoryMb = config.getLong("environment.min_memory_mb", 256L);

        if (runtime.availableProcessors() < minCores) {
            log.warn("环境校验失败: CPU 核数 {} 低于要求 {}", runtime.availableProcessors(), minCores);
            return false;
        }
        if (runtime.maxMemoryMb() < minMemoryMb) {
            log.warn("环境校验失败: 可用内存 {}MB 低于要求 {}MB", runtime.maxMemoryMb(), minMemoryMb);
            return false;
        }
        log.debug("环境资源满足要求: cores={}, memory={}MB", runtime.availableProcessors(), runtime.maxMemoryMb());
        return true;
    }

    @Override
    public boolean checkCompatibility() {
        int minJava = config.getInt("environment.min_java_version", 17);
        List<String> architectures = config.getStringList("environment.allowed_architectures", DEFAULT_ARCHITECTURES);

        if (runtime.javaFeatureVersion() < minJava) {
            log.warn("兼容性校验失败: Java {} 低于要求 {}", runtime.javaFeatureVersion(), minJava);
            return false;
        }
        String arch = runtime.architecture() == null ? "" : runtime.architecture().toLowerCase(Locale.ROOT);
        boolean supported = architectures.stream().anyMatch(a -> a.equalsIgnoreCase(arch));
        if (!supported) {
            log.warn("兼容性校验失败: 架构 {} 不在 {} 中", runtime.architecture(), architectures);
            return false;
        }
        return true;
    }
}
