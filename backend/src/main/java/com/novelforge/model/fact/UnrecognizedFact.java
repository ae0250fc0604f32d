package com.novelforge.model.fact;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 抽取服务返回了未知类型的事实，保留原始载荷以便在发现中说明
 */
public class UnrecognizedFact extends CandidateFact {

    private final String rawKind;
    private final Map<String, Object> payload;

    public UnrecognizedFact(String rawKind, Map<String, Object> payload, String evidence) {
        super(null, false, evidence);
        this.rawKind = rawKind;
        this.payload = payload != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(payload)) : Collections.emptyMap();
    }

    @Override
    public FactKind getKind() {
        return FactKind.UNRECOGNIZED;
    }

    @Override
    public String describe() {
        return "unrecognized:" + rawKind;
    }

    public String getRawKind() {
        return rawKind;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }
}
