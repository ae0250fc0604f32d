package com.novelforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.novelforge.common.exception.ValidationException;

/**
 * 图谱节点类型
 */
public enum NodeType {
    CHARACTER("character"),
    LOCATION("location"),
    ITEM("item"),
    RULE("rule"),
    EVENT("event");

    private final String value;

    NodeType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static NodeType fromValue(String value) {
        for (NodeType type : values()) {
            if (type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new ValidationException("未知的节点类型: " + value);
    }
}
