package com.novelforge.model.fact;

import com.novelforge.model.NodeRef;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 实体之间的关系，例如 character:lihang ALLY_OF character:suqing
 */
public class RelationFact extends CandidateFact {

    private final NodeRef source;
    private final NodeRef target;
    private final String relation;
    private final Map<String, Object> attributes;

    public RelationFact(NodeRef source, NodeRef target, String relation, Map<String, Object> attributes,
                        Long sequence, boolean flashback, String evidence) {
        super(sequence, flashback, evidence);
        this.source = source;
        this.target = target;
        this.relation = relation;
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Collections.emptyMap();
    }

    @Override
    public FactKind getKind() {
        return FactKind.RELATION;
    }

    @Override
    public String describe() {
        return source + " " + relation + " " + target;
    }

    public NodeRef getSource() {
        return source;
    }

    public NodeRef getTarget() {
        return target;
    }

    public String getRelation() {
        return relation;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }
}
