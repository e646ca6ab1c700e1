package xyz.firestige.coordinator.config;

/**
 * 环境变量查询，默认走 {@link System#getenv(String)}，测试可替换
 */
@FunctionalInterface
public interface EnvironmentLookup {

    /**
     * @return 变量值，未设置返回 null
     */
    String get(String name);

    static EnvironmentLookup system() {
        return System::getenv;
    }
}
