package com.novelforge.model.fact;

/**
 * 从生成文本中抽取的候选事实（带标签的变体）
 *
 * sequence 为叙事顺序号（章节/场景顺序），flashback 标记回忆/倒叙情节
 */
public abstract class CandidateFact {

    private final Long sequence;
    private final boolean flashback;
    private final String evidence;

    protected CandidateFact(Long sequence, boolean flashback, String evidence) {
        this.sequence = sequence;
        this.flashback = flashback;
        this.evidence = evidence;
    }

    public abstract FactKind getKind();

    /**
     * 简短描述，用于发现引用和日志
     */
    public abstract String describe();

    public Long getSequence() {
        return sequence;
    }

    public boolean isFlashback() {
        return flashback;
    }

    public String getEvidence() {
        return evidence;
    }

    @Override
    public String toString() {
        return getKind() + "[" + describe() + ", seq=" + sequence + (flashback ? ", flashback" : "") + "]";
    }
}
