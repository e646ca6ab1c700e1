package xyz.firestige.coordinator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import xyz.firestige.coordinator.config.exception.ConfigSourceNotFoundException;
import xyz.firestige.coordinator.config.exception.ConfigValidationException;
import xyz.firestige.coordinator.config.exception.ConfigurationException;
import xyz.firestige.coordinator.config.schema.ConfigSchema;
import xyz.firestige.coordinator.config.schema.FieldRule;
import xyz.firestige.coordinator.config.schema.FieldType;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 分层配置存储
 * <p>
 * 职责：
 * <ol>
 *   <li>多源加载：文件（JSON/YAML）、环境变量、内存树合并</li>
 *   <li>按 schema 校验、类型转换、填充默认值</li>
 *   <li>dot-path 访问（{@code "database.host"}）与结果缓存</li>
 *   <li>敏感字段脱敏</li>
 * </ol>
 * <p>
 * 缓存不变式：缓存内容始终可由配置树 + schema 重建。
 * 文件加载、环境变量加载、合并、校验会清空整个缓存；{@link #set} 只驱逐与写入路径相关的条目。
 * <p>
 * 并发：读写锁保护配置树；{@link #get} 返回的 Map/List 为不可变副本。
 */
public class ConfigStore {

    private static final Logger log = LoggerFactory.getLogger(ConfigStore.class);

    public static final String DEFAULT_ENV_PREFIX = "COORDINATOR";
    public static final char DEFAULT_MASK_CHAR = '*';

    private final ConfigSchema schema;
    private final String envPrefix;
    private final EnvironmentLookup environment;
    private final ConfigDocumentReader reader;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private Map<String, Object> tree = new LinkedHashMap<>();
    private final Map<String, Object> cache = new ConcurrentHashMap<>();

    public ConfigStore() {
        this(ConfigSchema.empty());
    }

    public ConfigStore(ConfigSchema schema) {
        this(schema, DEFAULT_ENV_PREFIX, EnvironmentLookup.system());
    }

    public ConfigStore(ConfigSchema schema, String envPrefix, EnvironmentLookup environment) {
        this(schema, envPrefix, environment, new ConfigDocumentReader());
    }

    public ConfigStore(ConfigSchema schema, String envPrefix, EnvironmentLookup environment,
                       ConfigDocumentReader reader) {
        this.schema = schema != null ? schema : ConfigSchema.empty();
        this.envPrefix = envPrefix != null ? envPrefix : DEFAULT_ENV_PREFIX;
        this.environment = environment != null ? environment : EnvironmentLookup.system();
        this.reader = reader != null ? reader : new ConfigDocumentReader();
    }

    // ========== 加载 ==========

    /**
     * 加载配置文件并深度合并到配置树，同路径新值覆盖旧值
     *
     * @throws ConfigSourceNotFoundException 文件不存在
     * @throws ConfigurationException        文件无法解析
     */
    public boolean loadFromFile(String path) {
        return loadFromFile(toPath(path));
    }

    public boolean loadFromFile(Path path) {
        Map<String, Object> document = reader.read(path);
        lock.writeLock().lock();
        try {
            deepMerge(tree, document);
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Configuration loaded from {}: sections={}", path, document.keySet());
        return true;
    }

    private static Path toPath(String path) {
        if (path == null || path.isBlank()) {
            throw new ConfigSourceNotFoundException(String.valueOf(path));
        }
        try {
            return Path.of(path);
        } catch (InvalidPathException e) {
            throw new ConfigSourceNotFoundException(path, e);
        }
    }

    /**
     * 按 schema 声明的字段读取 {@code PREFIX_SECTION_FIELD} 环境变量，未设置的跳过
     */
    public boolean loadFromEnvironment() {
        Map<String, Map<String, String>> found = new LinkedHashMap<>();
        for (String section : schema.sectionNames()) {
            for (String field : schema.fields(section).keySet()) {
                String name = environmentVariableName(section, field);
                String value = environment.get(name);
                if (value != null) {
                    found.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(field, value);
                    log.debug("Env override {} -> {}.{}", name, section, field);
                }
            }
        }
        if (found.isEmpty()) {
            return true;
        }
        lock.writeLock().lock();
        try {
            found.forEach((section, fields) -> sectionForWrite(section).putAll(fields));
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Environment overrides applied: {}", found.keySet());
        return true;
    }

    /**
     * 依次加载多个文件（后者覆盖前者），单个文件失败不中断；最后可选叠加环境变量（优先级最高）
     *
     * @return 全部来源都加载成功时为 true
     */
    public boolean loadFromMultipleSources(List<String> paths, boolean useEnvironment) {
        boolean success = true;
        if (paths != null) {
            for (String path : paths) {
                try {
                    loadFromFile(path);
                } catch (ConfigurationException e) {
                    success = false;
                    log.warn("Skipping configuration source {}: {}", path, e.getMessage());
                }
            }
        }
        if (useEnvironment) {
            success &= loadFromEnvironment();
        }
        return success;
    }

    /**
     * 深度合并一棵内存配置树，后写覆盖
     */
    public void merge(Map<String, ?> other) {
        if (other == null || other.isEmpty()) {
            return;
        }
        lock.writeLock().lock();
        try {
            deepMerge(tree, other);
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 重新加载文件，冲突时保留已有值；加载失败则配置树保持不变
     *
     * @return 是否重新加载成功
     */
    public boolean reloadFromFile(String path) {
        Map<String, Object> fresh;
        try {
            fresh = reader.read(toPath(path));
        } catch (ConfigurationException e) {
            log.warn("Reload from {} failed, keeping current configuration: {}", path, e.getMessage());
            return false;
        }
        lock.writeLock().lock();
        try {
            Map<String, Object> merged = new LinkedHashMap<>();
            deepMerge(merged, fresh);
            deepMerge(merged, tree);
            tree = merged;
            cache.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Configuration reloaded from {}", path);
        return true;
    }

    // ========== 校验 ==========

    /**
     * 按 schema 逐 section 校验：必填、类型转换（原地替换）、范围、允许值、默认值。
     * 遇到第一个错误即抛出，不汇总。
     *
     * @throws ConfigValidationException 校验失败
     */
    public boolean validateConfiguration() {
        lock.writeLock().lock();
        try {
            for (String section : schema.sectionNames()) {
                Map<String, Object> values = sectionForValidation(section);
                for (Map.Entry<String, FieldRule> entry : schema.fields(section).entrySet()) {
                    String field = entry.getKey();
                    Object resolved = entry.getValue().apply(section + "." + field, values.get(field));
                    if (resolved != null) {
                        values.put(field, mutableCopy(resolved));
                    }
                }
            }
        } finally {
            cache.clear();
            lock.writeLock().unlock();
        }
        log.debug("Configuration validated against {} schema sections", schema.sectionNames().size());
        return true;
    }

    // ========== 读写 ==========

    /**
     * 按 dot-path 取值，先查缓存
     *
     * @throws ConfigurationException 路径不存在
     */
    public Object get(String path) {
        return get(path, null);
    }

    /**
     * 按 dot-path 取值，不存在时返回并缓存 {@code defaultValue}；默认值为 null 时等同 {@link #get(String)}
     */
    public Object get(String path, Object defaultValue) {
        Object cached = cache.get(path);
        if (cached != null) {
            return cached;
        }
        lock.readLock().lock();
        try {
            Object value = resolve(path);
            if (value != null) {
                Object frozen = immutableCopy(value);
                cache.put(path, frozen);
                return frozen;
            }
            if (defaultValue != null) {
                cache.put(path, defaultValue);
                return defaultValue;
            }
        } finally {
            lock.readLock().unlock();
        }
        throw new ConfigurationException(path, "Configuration key not found: " + path);
    }

    /**
     * 写入 dot-path，沿途创建中间节点，并驱逐该路径及其祖先、后代的缓存
     */
    public void set(String path, Object value) {
        String[] segments = split(path);
        lock.writeLock().lock();
        try {
            Map<String, Object> node = tree;
            for (int i = 0; i < segments.length - 1; i++) {
                node = childForWrite(node, segments[i], path);
            }
            node.put(segments[segments.length - 1], mutableCopy(value));
            evictRelated(path, segments);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public boolean containsPath(String path) {
        lock.readLock().lock();
        try {
            return resolve(path) != null;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> sectionNames() {
        lock.readLock().lock();
        try {
            return Collections.unmodifiableSet(new LinkedHashSet<>(tree.keySet()));
        } finally {
            lock.readLock().unlock();
        }
    }

    // ========== 类型化访问 ==========

    public int getInt(String path) {
        return toInt(path, get(path));
    }

    public int getInt(String path, int defaultValue) {
        return toInt(path, get(path, defaultValue));
    }

    public long getLong(String path, long defaultValue) {
        return FieldType.toInteger(path, get(path, defaultValue)).longValue();
    }

    public double getDouble(String path) {
        return FieldType.toDouble(path, get(path));
    }

    public double getDouble(String path, double defaultValue) {
        return FieldType.toDouble(path, get(path, defaultValue));
    }

    public String getString(String path) {
        return String.valueOf(get(path));
    }

    public String getString(String path, String defaultValue) {
        return String.valueOf(get(path, defaultValue));
    }

    public boolean getBoolean(String path) {
        return FieldType.toBoolean(path, get(path));
    }

    public boolean getBoolean(String path, boolean defaultValue) {
        return FieldType.toBoolean(path, get(path, defaultValue));
    }

    public List<String> getStringList(String path, List<String> defaultValue) {
        List<String> result = new ArrayList<>();
        for (Object item : FieldType.toList(path, get(path, defaultValue))) {
            result.add(String.valueOf(item));
        }
        return Collections.unmodifiableList(result);
    }

    private static int toInt(String path, Object value) {
        Number n = FieldType.toInteger(path, value);
        if (n instanceof Long l && (l > Integer.MAX_VALUE || l < Integer.MIN_VALUE)) {
            throw new ConfigValidationException(path, path + ": cannot convert value '" + l + "' to int, out of range");
        }
        return n.intValue();
    }

    // ========== 脱敏与导出 ==========

    public String getMasked(String path) {
        return getMasked(path, DEFAULT_MASK_CHAR);
    }

    /**
     * 敏感字段保留首尾各两位，其余替换为 {@code maskChar}；非敏感字段返回原值字符串
     */
    public String getMasked(String path, char maskChar) {
        Object value = get(path);
        if (schema.isSensitive(path)) {
            return ValueMasker.maskKeepEdges(value, maskChar);
        }
        return String.valueOf(value);
    }

    /**
     * 导出配置树的深拷贝，可选对 schema 标记为敏感的字段脱敏
     */
    public Map<String, Object> exportConfig(boolean maskSensitive) {
        Map<String, Object> copy;
        lock.readLock().lock();
        try {
            copy = new LinkedHashMap<>();
            deepMerge(copy, tree);
        } finally {
            lock.readLock().unlock();
        }
        if (maskSensitive) {
            maskSensitiveLeaves(copy);
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private void maskSensitiveLeaves(Map<String, Object> copy) {
        for (String section : schema.sectionNames()) {
            if (!(copy.get(section) instanceof Map<?, ?> values)) {
                continue;
            }
            schema.fields(section).forEach((field, rule) -> {
                Object value = values.get(field);
                if (rule.isSensitive() && value != null) {
                    ((Map<String, Object>) values).put(field, ValueMasker.maskForExport(value));
                }
            });
        }
    }

    // ========== 缓存 ==========

    public void invalidateCache() {
        cache.clear();
    }

    public void invalidateCache(String path) {
        if (path == null) {
            cache.clear();
        } else {
            cache.remove(path);
        }
    }

    public int cacheSize() {
        return cache.size();
    }

    public Optional<Object> cachedValue(String path) {
        return Optional.ofNullable(cache.get(path));
    }

    // ========== 其他 ==========

    /**
     * 存活探针，不存在失败分支
     */
    public ConfigStoreHealth healthCheck() {
        lock.readLock().lock();
        try {
            return new ConfigStoreHealth(ConfigStoreHealth.HEALTHY, tree.size(), cache.size(), !schema.isEmpty());
        } finally {
            lock.readLock().unlock();
        }
    }

    public String environmentVariableName(String section, String field) {
        String name = section + "_" + field;
        if (!envPrefix.isEmpty()) {
            name = envPrefix + "_" + name;
        }
        return name.toUpperCase(Locale.ROOT);
    }

    public ConfigSchema getSchema() {
        return schema;
    }

    public String getEnvPrefix() {
        return envPrefix;
    }

    // ========== 内部实现（调用方持有锁） ==========

    private Object resolve(String path) {
        if (path == null || path.isEmpty()) {
            return null;
        }
        Object node = tree;
        for (String segment : path.split("\\.")) {
            if (!(node instanceof Map<?, ?> map)) {
                return null;
            }
            node = map.get(segment);
            if (node == null) {
                return null;
            }
        }
        return node;
    }

    private void evictRelated(String path, String[] segments) {
        cache.remove(path);
        StringBuilder prefix = new StringBuilder();
        for (int i = 0; i < segments.length - 1; i++) {
            if (i > 0) {
                prefix.append('.');
            }
            prefix.append(segments[i]);
            cache.remove(prefix.toString());
        }
        String descendantPrefix = path + ".";
        cache.keySet().removeIf(key -> key.startsWith(descendantPrefix));
    }

    private Map<String, Object> sectionForWrite(String section) {
        return childForWrite(tree, section, section);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> sectionForValidation(String section) {
        Object existing = tree.get(section);
        if (existing == null) {
            Map<String, Object> created = new LinkedHashMap<>();
            tree.put(section, created);
            return created;
        }
        if (existing instanceof Map<?, ?>) {
            return (Map<String, Object>) existing;
        }
        throw new ConfigValidationException(section, "Invalid section " + section + ": expected an object");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> childForWrite(Map<String, Object> node, String key, String path) {
        Object child = node.get(key);
        if (child == null) {
            Map<String, Object> created = new LinkedHashMap<>();
            node.put(key, created);
            return created;
        }
        if (child instanceof Map<?, ?>) {
            return (Map<String, Object>) child;
        }
        throw new ConfigurationException(path, "Cannot write " + path + ": '" + key + "' is not a section");
    }

    private static String[] split(String path) {
        if (path == null || path.isEmpty()) {
            throw new ConfigurationException("Configuration path must not be empty");
        }
        String[] segments = path.split("\\.");
        for (String segment : segments) {
            if (segment.isEmpty()) {
                throw new ConfigurationException(path, "Invalid configuration path: " + path);
            }
        }
        return segments;
    }

    @SuppressWarnings("unchecked")
    private static void deepMerge(Map<String, Object> target, Map<String, ?> source) {
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            Object incoming = entry.getValue();
            Object existing = target.get(entry.getKey());
            if (existing instanceof Map<?, ?> && incoming instanceof Map<?, ?>) {
                deepMerge((Map<String, Object>) existing, (Map<String, ?>) incoming);
            } else {
                target.put(entry.getKey(), mutableCopy(incoming));
            }
        }
    }

    private static Object mutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), mutableCopy(v)));
            return copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(mutableCopy(item)));
            return copy;
        }
        return value;
    }

    private static Object immutableCopy(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), immutableCopy(v)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(immutableCopy(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
