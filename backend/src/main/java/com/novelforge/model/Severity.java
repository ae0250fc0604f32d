package com.novelforge.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 一致性发现的严重程度
 */
public enum Severity {
    INFO,
    WARNING,
    BLOCKING;

    @JsonValue
    public String getValue() {
        return name().toLowerCase();
    }
}
