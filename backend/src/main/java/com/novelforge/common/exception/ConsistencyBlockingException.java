package com.novelforge.common.exception;

import com.novelforge.model.ConsistencyFinding;

import java.util.Collections;
import java.util.List;

/**
 * 一致性校验存在阻断性发现且重试次数已用尽
 *
 * 发现列表必须随异常一并返回给调用方，由人工处理
 */
public class ConsistencyBlockingException extends NovelMemoryException {

    private final String requestId;
    private final List<ConsistencyFinding> findings;

    public ConsistencyBlockingException(String requestId, List<ConsistencyFinding> findings) {
        super("生成内容存在阻断性一致性冲突: " + findings.size() + " 项", "CONSISTENCY_BLOCKING");
        this.requestId = requestId;
        this.findings = Collections.unmodifiableList(findings);
    }

    public String getRequestId() {
        return requestId;
    }

    public List<ConsistencyFinding> getFindings() {
        return findings;
    }
}
