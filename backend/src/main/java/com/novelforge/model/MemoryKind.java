package com.novelforge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.novelforge.common.exception.ValidationException;

/**
 * 记忆条目类型
 */
public enum MemoryKind {
    SUMMARY("summary"),
    EVENT("event"),
    CHARACTER_STATE("character_state"),
    PLOT_POINT("plot_point"),
    WORLDBUILDING("worldbuilding");

    private final String value;

    MemoryKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MemoryKind fromValue(String value) {
        for (MemoryKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value) || kind.name().equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new ValidationException("未知的记忆类型: " + value);
    }
}
