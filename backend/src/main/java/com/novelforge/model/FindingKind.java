package com.novelforge.model;

/**
 * 一致性发现类型
 */
public enum FindingKind {
    /** 已死亡角色在非回忆情节中行动 */
    DEAD_CHARACTER_ACTING,
    /** 已死亡角色被直接改为存活 */
    RESURRECTION,
    /** 不可变属性被改写（性别、种族、出生地等） */
    IMMUTABLE_ATTRIBUTE_CONFLICT,
    /** 同一事件被重新定义为不同的时间顺序或类型 */
    EVENT_REDEFINED,
    /** 角色事件序号倒退且未标记回忆 */
    TEMPORAL_ORDER,
    /** 违反世界规则 */
    RULE_VIOLATION,
    /** 引用了尚未建立的世界规则 */
    UNKNOWN_RULE,
    /** 对已有属性的补充描述 */
    ATTRIBUTE_REFINEMENT,
    /** 正常的状态变化 */
    STATE_CHANGE,
    /** 无法识别的事实类型，已拒绝 */
    UNRECOGNIZED_FACT
}
