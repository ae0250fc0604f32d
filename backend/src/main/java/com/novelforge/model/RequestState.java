package com.novelforge.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 生成请求状态机
 *
 * PENDING → CONTEXT_BUILT → GENERATED → CHECKED → {ACCEPTED | BLOCKED | RETRYING} → COMMITTED | FAILED
 */
public enum RequestState {
    PENDING,
    CONTEXT_BUILT,
    GENERATED,
    CHECKED,
    ACCEPTED,
    RETRYING,
    BLOCKED,
    COMMITTED,
    FAILED;

    public boolean isTerminal() {
        return this == COMMITTED || this == FAILED || this == BLOCKED;
    }

    /**
     * 合法的下一状态；任何非终态都可以转入 FAILED
     */
    public Set<RequestState> successors() {
        switch (this) {
            case PENDING:
                return EnumSet.of(CONTEXT_BUILT, FAILED);
            case CONTEXT_BUILT:
                return EnumSet.of(GENERATED, FAILED);
            case GENERATED:
                return EnumSet.of(CHECKED, FAILED);
            case CHECKED:
                return EnumSet.of(ACCEPTED, RETRYING, BLOCKED, FAILED);
            case RETRYING:
                return EnumSet.of(GENERATED, FAILED);
            case ACCEPTED:
                return EnumSet.of(COMMITTED, FAILED);
            default:
                return EnumSet.noneOf(RequestState.class);
        }
    }
}
