package com.novelforge.service.graph;

/**
 * 单次图谱写入的结果：created 表示新建，changed 表示存储内容发生变化
 */
public class GraphWriteOutcome<T> {

    private final T value;
    private final boolean created;
    private final boolean changed;

    public GraphWriteOutcome(T value, boolean created, boolean changed) {
        this.value = value;
        this.created = created;
        this.changed = changed;
    }

    public T getValue() {
        return value;
    }

    public boolean isCreated() {
        return created;
    }

    public boolean isChanged() {
        return changed;
    }
}
