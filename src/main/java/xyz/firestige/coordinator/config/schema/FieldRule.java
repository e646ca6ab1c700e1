package xyz.firestige.coordinator.config.schema;

import xyz.firestige.coordinator.config.exception.ConfigValidationException;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * 单个配置字段的校验规则（不可变）
 * <p>
 * 类型决定强制转换方式，其余约束可选：
 * required / default / min / max / allowed / sensitive
 */
public final class FieldRule {

    private final FieldType type;
    private final boolean required;
    private final Object defaultValue;
    private final boolean hasDefault;
    private final Double min;
    private final Double max;
    private final Set<Object> allowed;
    private final boolean sensitive;

    private FieldRule(Builder builder) {
        this.type = builder.type;
        this.required = builder.required;
        this.defaultValue = builder.defaultValue;
        this.hasDefault = builder.hasDefault;
        this.min = builder.min;
        this.max = builder.max;
        this.allowed = builder.allowed == null
                ? null
                : Collections.unmodifiableSet(new LinkedHashSet<>(builder.allowed));
        this.sensitive = builder.sensitive;
    }

    public static Builder builder(FieldType type) {
        return new Builder(type);
    }

    public static FieldRule of(FieldType type) {
        return builder(type).build();
    }

    /**
     * 按本规则校验并转换一个原始值
     *
     * @param path 字段路径（section.field）
     * @param raw  当前配置值，缺失为 null
     * @return 转换后的值；缺失且无默认值时返回 null
     * @throws ConfigValidationException 必填缺失、类型不符、越界、不在允许值内
     */
    public Object apply(String path, Object raw) {
        if (required && (raw == null || "".equals(raw))) {
            throw new ConfigValidationException(path, "Required field missing: " + path);
        }
        if (raw == null) {
            return hasDefault ? defaultValue : null;
        }

        Object value = type.coerce(path, raw);

        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (min != null && d < min) {
                throw new ConfigValidationException(path,
                        "Value " + value + " below minimum " + formatBound(min) + " for " + path);
            }
            if (max != null && d > max) {
                throw new ConfigValidationException(path,
                        "Value " + value + " above maximum " + formatBound(max) + " for " + path);
            }
        }

        if (allowed != null && !isAllowed(value)) {
            throw new ConfigValidationException(path,
                    "Value " + value + " not in allowed values " + allowed + " for " + path);
        }
        return value;
    }

    private boolean isAllowed(Object value) {
        for (Object candidate : allowed) {
            if (sameValue(candidate, value)) {
                return true;
            }
        }
        return false;
    }

    // 1 与 1L、1.0 视为同一取值
    private static boolean sameValue(Object a, Object b) {
        if (a instanceof Number x && b instanceof Number y) {
            return new BigDecimal(x.toString()).compareTo(new BigDecimal(y.toString())) == 0;
        }
        return Objects.equals(a, b);
    }

    private static String formatBound(double bound) {
        return bound == Math.rint(bound) ? String.valueOf((long) bound) : String.valueOf(bound);
    }

    public FieldType getType() {
        return type;
    }

    public boolean isRequired() {
        return required;
    }

    public boolean hasDefault() {
        return hasDefault;
    }

    public Object getDefaultValue() {
        return defaultValue;
    }

    public Double getMin() {
        return min;
    }

    public Double getMax() {
        return max;
    }

    public Set<Object> getAllowed() {
        return allowed;
    }

    public boolean isSensitive() {
        return sensitive;
    }

    @Override
    public String toString() {
        return "FieldRule{type=" + type.getTypeName()
                + ", required=" + required
                + (hasDefault ? ", default=" + (sensitive ? "***" : defaultValue) : "")
                + (min != null ? ", min=" + min : "")
                + (max != null ? ", max=" + max : "")
                + (allowed != null ? ", allowed=" + allowed : "")
                + ", sensitive=" + sensitive + '}';
    }

    public static final class Builder {
        private final FieldType type;
        private boolean required;
        private Object defaultValue;
        private boolean hasDefault;
        private Double min;
        private Double max;
        private Set<Object> allowed;
        private boolean sensitive;

        private Builder(FieldType type) {
            this.type = Objects.requireNonNull(type, "type");
        }

        public Builder required(boolean required) {
            this.required = required;
            return this;
        }

        public Builder required() {
            return required(true);
        }

        public Builder defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            this.hasDefault = true;
            return this;
        }

        public Builder min(Number min) {
            this.min = min == null ? null : min.doubleValue();
            return this;
        }

        public Builder max(Number max) {
            this.max = max == null ? null : max.doubleValue();
            return this;
        }

        public Builder allowed(Set<?> allowed) {
            this.allowed = allowed == null ? null : new LinkedHashSet<>(allowed);
            return this;
        }

        public Builder allowed(Object... allowed) {
            return allowed(new LinkedHashSet<>(Arrays.asList(allowed)));
        }

        public Builder sensitive(boolean sensitive) {
            this.sensitive = sensitive;
            return this;
        }

        public Builder sensitive() {
            return sensitive(true);
        }

        public FieldRule build() {
            if (min != null && max != null && min > max) {
                throw new IllegalArgumentException("min " + min + " greater than max " + max);
            }
            return new FieldRule(this);
        }
    }
}
