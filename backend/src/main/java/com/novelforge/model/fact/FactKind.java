package com.novelforge.model.fact;

/**
 * 候选事实类型标签
 */
public enum FactKind {
    CHARACTER_STATE,
    LOCATION_CHANGE,
    RULE_INVOCATION,
    EVENT,
    RELATION,
    /** 抽取结果中无法识别的类型，校验时显式拒绝 */
    UNRECOGNIZED;

    public static FactKind fromLabel(String label) {
        if (label == null) {
            return UNRECOGNIZED;
        }
        String normalized = label.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (FactKind kind : values()) {
            if (kind != UNRECOGNIZED && kind.name().equals(normalized)) {
                return kind;
            }
        }
        return UNRECOGNIZED;
    }
}
