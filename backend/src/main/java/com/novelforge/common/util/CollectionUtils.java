package com.novelforge.common.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 集合工具类
 *
 * 保持插入顺序，允许 null 值（属性合并时 null 表示删除该属性）
 */
public final class CollectionUtils {

    private CollectionUtils() {
    }

    /**
     * 按键值对创建有序可变 Map
     */
    public static <K, V> Map<K, V> mapOf(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("键值对数量必须是偶数");
        }

        Map<K, V> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            @SuppressWarnings("unchecked")
            K key = (K) keyValues[i];
            @SuppressWarnings("unchecked")
            V value = (V) keyValues[i + 1];
            map.put(key, value);
        }
        return map;
    }

    @SafeVarargs
    public static <T> List<T> listOf(T... elements) {
        return new ArrayList<>(Arrays.asList(elements));
    }

    @SafeVarargs
    public static <T> Set<T> setOf(T... elements) {
        return new LinkedHashSet<>(Arrays.asList(elements));
    }

    /**
     * 把元数据中的集合/单值/逗号分隔字符串统一转成字符串列表
     */
    public static List<String> toStringList(Object value) {
        if (value == null) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        if (value instanceof Collection) {
            for (Object item : (Collection<?>) value) {
                if (item != null && !item.toString().trim().isEmpty()) {
                    result.add(item.toString().trim());
                }
            }
        } else if (value instanceof Object[]) {
            for (Object item : (Object[]) value) {
                if (item != null && !item.toString().trim().isEmpty()) {
                    result.add(item.toString().trim());
                }
            }
        } else {
            for (String part : value.toString().split(",")) {
                if (!part.trim().isEmpty()) {
                    result.add(part.trim());
                }
            }
        }
        return result;
    }
}
