package com.novelforge.common.util;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Objects;

/**
 * 属性值比较：数字按数值比较（JSON 往返后 Integer/Long/Double 可能不同），字符串忽略首尾空白
 */
public final class AttributeValues {

    private AttributeValues() {
    }

    public static boolean same(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return new BigDecimal(a.toString()).compareTo(new BigDecimal(b.toString())) == 0;
        }
        if (a instanceof String && b instanceof String) {
            return ((String) a).trim().equals(((String) b).trim());
        }
        return Objects.equals(a, b);
    }

    public static boolean sameAttributes(Map<String, Object> a, Map<String, Object> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (Map.Entry<String, Object> entry : a.entrySet()) {
            if (!b.containsKey(entry.getKey()) || !same(entry.getValue(), b.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * 新值是否只是在旧值基础上补充描述（例如 "黑发" → "黑发，左眉有疤"）
     */
    public static boolean isRefinement(Object oldValue, Object newValue) {
        if (!(oldValue instanceof String) || !(newValue instanceof String)) {
            return false;
        }
        String oldText = ((String) oldValue).trim();
        String newText = ((String) newValue).trim();
        return !oldText.isEmpty() && newText.length() > oldText.length() && newText.contains(oldText);
    }

    public static boolean isTrue(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value != null && "true".equalsIgnoreCase(value.toString().trim());
    }

    public static boolean isFalse(Object value) {
        if (value instanceof Boolean) {
            return !((Boolean) value);
        }
        return value != null && "false".equalsIgnoreCase(value.toString().trim());
    }
}
