package xyz.firestige.coordinator.config;

/**
 * 敏感值脱敏
 * <p>
 * 两种格式并存：
 * <ul>
 *   <li>{@link #maskKeepEdges}: 保留首尾各两位，中间逐字符替换，长度不变；长度 ≤ 4 时全部替换</li>
 *   <li>{@link #maskForExport}: 首两位 + {@code ***} + 末一位；长度 ≤ 4 时为 {@code ***}</li>
 * </ul>
 */
public final class ValueMasker {

    public static final String EXPORT_MASK = "***";

    private ValueMasker() {
    }

    public static String maskKeepEdges(Object value, char maskChar) {
        String s = String.valueOf(value);
        int len = s.length();
        if (len <= 4) {
            return String.valueOf(maskChar).repeat(len);
        }
        return s.substring(0, 2) + String.valueOf(maskChar).repeat(len - 4) + s.substring(len - 2);
    }

    public static String maskForExport(Object value) {
        String s = String.valueOf(value);
        if (s.length() <= 4) {
            return EXPORT_MASK;
        }
        return s.substring(0, 2) + EXPORT_MASK + s.substring(s.length() - 1);
    }
}
