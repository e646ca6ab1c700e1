package xyz.firestige.coordinator.config.schema;

import xyz.firestige.coordinator.config.exception.ConfigValidationException;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 配置字段类型
 * <p>
 * 每种类型自带强制转换规则，把原始值（通常来自文件或环境变量的字符串）转换成声明类型：
 * <ul>
 *   <li>STRING: 标量转字符串，Map/List 拒绝</li>
 *   <li>INTEGER: 整数保留，浮点截断，字符串解析，布尔拒绝</li>
 *   <li>FLOAT: 数字转 double，字符串解析</li>
 *   <li>BOOLEAN: true/1/yes/on 与 false/0/no/off（忽略大小写）</li>
 *   <li>LIST: 列表保留，逗号分隔字符串拆分</li>
 * </ul>
 */
public enum FieldType {

    STRING("string") {
        @Override
        public Object coerce(String path, Object value) {
            if (value instanceof String) {
                return value;
            }
            if (value instanceof Map || value instanceof Collection) {
                throw new ConfigValidationException(path, "Invalid type for " + path + ": expected string");
            }
            return String.valueOf(value);
        }
    },

    INTEGER("integer") {
        @Override
        public Object coerce(String path, Object value) {
            return toInteger(path, value);
        }
    },

    FLOAT("float") {
        @Override
        public Object coerce(String path, Object value) {
            return toDouble(path, value);
        }
    },

    BOOLEAN("boolean") {
        @Override
        public Object coerce(String path, Object value) {
            return toBoolean(path, value);
        }
    },

    LIST("list") {
        @Override
        public Object coerce(String path, Object value) {
            return toList(path, value);
        }
    };

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "yes", "on");
    private static final Set<String> FALSE_WORDS = Set.of("false", "0", "no", "off");

    private final String typeName;

    FieldType(String typeName) {
        this.typeName = typeName;
    }

    /**
     * 把原始值转换为本类型
     *
     * @param path  配置路径，仅用于错误信息
     * @param value 非 null 的原始值
     * @throws ConfigValidationException 无法转换时
     */
    public abstract Object coerce(String path, Object value);

    public String getTypeName() {
        return typeName;
    }

    /**
     * 按 schema 文档中的类型名解析
     */
    public static FieldType fromName(String name) {
        if (name == null) {
            return STRING;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.typeName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + name);
    }

    // ========== 转换工具，供 ConfigStore 的类型化访问复用 ==========

    private static final double LONG_UPPER_BOUND = 0x1p63;

    public static Number toInteger(String path, Object value) {
        if (value instanceof Integer || value instanceof Long) {
            return (Number) value;
        }
        if (value instanceof BigInteger big) {
            try {
                return narrow(big.longValueExact());
            } catch (ArithmeticException e) {
                throw new ConfigValidationException(path,
                        path + ": cannot convert value '" + value + "' to integer", e);
            }
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            // 超出 long 范围或 NaN/Infinity 不做截断
            if (!Double.isFinite(d) || d >= LONG_UPPER_BOUND || d < -LONG_UPPER_BOUND) {
                throw new ConfigValidationException(path,
                        path + ": cannot convert value '" + value + "' to integer");
            }
            return narrow(n.longValue());
        }
        if (value instanceof String s) {
            try {
                return narrow(Long.parseLong(s.trim()));
            } catch (NumberFormatException e) {
                throw new ConfigValidationException(path,
                        path + ": cannot convert value '" + s + "' to integer", e);
            }
        }
        throw new ConfigValidationException(path,
                path + ": cannot convert value '" + value + "' to integer");
    }

    public static Double toDouble(String path, Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ConfigValidationException(path,
                        path + ": cannot convert value '" + s + "' to float", e);
            }
        }
        throw new ConfigValidationException(path,
                path + ": cannot convert value '" + value + "' to float");
    }

    public static Boolean toBoolean(String path, Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String word = s.trim().toLowerCase(Locale.ROOT);
            if (TRUE_WORDS.contains(word)) {
                return Boolean.TRUE;
            }
            if (FALSE_WORDS.contains(word)) {
                return Boolean.FALSE;
            }
        }
        throw new ConfigValidationException(path, "Invalid boolean value for " + path + ": " + value);
    }

    public static List<Object> toList(String path, Object value) {
        if (value instanceof List<?> list) {
            return new ArrayList<>(list);
        }
        if (value instanceof String s) {
            List<Object> items = new ArrayList<>();
            if (s.isBlank()) {
                return items;
            }
            Arrays.stream(s.split(","))
                    .map(String::trim)
                    .filter(item -> !item.isEmpty())
                    .forEach(items::add);
            return items;
        }
        throw new ConfigValidationException(path, "Invalid type for " + path + ": expected list");
    }

    private static Number narrow(long v) {
        if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE) {
            return (int) v;
        }
        return v;
    }
}
