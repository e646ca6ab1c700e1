package xyz.firestige.coordinator.infrastructure.environment;

/**
 * 当前运行环境信息
 *
 * @param availableProcessors 可用 CPU 数
 * @param maxMemoryMb         JVM 最大堆（MB）
 * @param javaFeatureVersion  JVM 主版本号
 * @param architecture        os.arch
 */
public record RuntimeInfo(int availableProcessors, long maxMemoryMb, int javaFeatureVersion, String architecture) {

    public static RuntimeInfo current() {
        Runtime runtime = Runtime.getRuntime();
        return new RuntimeInfo(
                runtime.availableProcessors(),
                runtime.maxMemory() / (1024 * 1024),
                Runtime.version().feature(),
                System.getProperty("os.arch", "unknown"));
    }
}
