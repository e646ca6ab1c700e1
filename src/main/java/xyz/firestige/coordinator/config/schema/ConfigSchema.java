package xyz.firestige.coordinator.config.schema;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 配置 schema：section -> field -> {@link FieldRule}
 * <p>
 * 构造后不可变。schema 只约束 {@code validateConfiguration} 与敏感字段判定，
 * 不限制普通的 get/set 访问。
 */
public final class ConfigSchema {

    private static final ConfigSchema EMPTY = new ConfigSchema(Map.of());

    private final Map<String, Map<String, FieldRule>> sections;

    private ConfigSchema(Map<String, Map<String, FieldRule>> sections) {
        Map<String, Map<String, FieldRule>> copy = new LinkedHashMap<>();
        sections.forEach((name, fields) ->
                copy.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(fields))));
        this.sections = Collections.unmodifiableMap(copy);
    }

    public static ConfigSchema empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Set<String> sectionNames() {
        return sections.keySet();
    }

    public Map<String, FieldRule> fields(String section) {
        return sections.getOrDefault(section, Map.of());
    }

    public Optional<FieldRule> rule(String section, String field) {
        return Optional.ofNullable(fields(section).get(field));
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }

    /**
     * 判断 dot-path 是否指向敏感字段
     * 敏感字段下的更深路径同样视为敏感
     */
    public boolean isSensitive(String path) {
        if (path == null) {
            return false;
        }
        String[] segments = path.split("\\.");
        if (segments.length < 2) {
            return false;
        }
        return rule(segments[0], segments[1]).map(FieldRule::isSensitive).orElse(false);
    }

    public static final class Builder {
        private final Map<String, Map<String, FieldRule>> sections = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder field(String section, String field, FieldRule rule) {
            sections.computeIfAbsent(section, k -> new LinkedHashMap<>()).put(field, rule);
            return this;
        }

        public Builder section(String section) {
            sections.computeIfAbsent(section, k -> new LinkedHashMap<>());
            return this;
        }

        public ConfigSchema build() {
            return new ConfigSchema(sections);
        }
    }
}
