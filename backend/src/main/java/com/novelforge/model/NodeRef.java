package com.novelforge.model;

import com.novelforge.common.exception.ValidationException;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 节点引用，文本形式为 "type:key"，例如 character:lihang
 */
@Getter
@EqualsAndHashCode
public final class NodeRef {

    private final NodeType type;
    private final String key;

    private NodeRef(NodeType type, String key) {
        this.type = type;
        this.key = key;
    }

    public static NodeRef of(NodeType type, String key) {
        if (type == null || key == null || key.trim().isEmpty()) {
            throw new ValidationException("节点引用缺少类型或键");
        }
        return new NodeRef(type, key.trim());
    }

    public static NodeRef parse(String ref) {
        if (ref == null) {
            throw new ValidationException("节点引用为空");
        }
        int idx = ref.indexOf(':');
        if (idx <= 0 || idx == ref.length() - 1) {
            throw new ValidationException("节点引用格式应为 type:key，实际为: " + ref);
        }
        return of(NodeType.fromValue(ref.substring(0, idx)), ref.substring(idx + 1));
    }

    public static boolean isQualified(String ref) {
        if (ref == null) {
            return false;
        }
        int idx = ref.indexOf(':');
        if (idx <= 0) {
            return false;
        }
        String prefix = ref.substring(0, idx);
        for (NodeType type : NodeType.values()) {
            if (type.getValue().equalsIgnoreCase(prefix)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return type.getValue() + ":" + key;
    }
}
