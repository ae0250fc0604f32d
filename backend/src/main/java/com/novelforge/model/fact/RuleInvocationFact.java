package com.novelforge.model.fact;

/**
 * 情节中援引或触发了某条世界规则
 */
public class RuleInvocationFact extends CandidateFact {

    private final String ruleKey;
    private final String actorKey;
    private final String action;

    public RuleInvocationFact(String ruleKey, String actorKey, String action,
                              Long sequence, boolean flashback, String evidence) {
        super(sequence, flashback, evidence);
        this.ruleKey = ruleKey;
        this.actorKey = actorKey;
        this.action = action;
    }

    @Override
    public FactKind getKind() {
        return FactKind.RULE_INVOCATION;
    }

    @Override
    public String describe() {
        return "rule:" + ruleKey + (actorKey != null ? " by character:" + actorKey : "") + " action=" + action;
    }

    public String getRuleKey() {
        return ruleKey;
    }

    public String getActorKey() {
        return actorKey;
    }

    public String getAction() {
        return action;
    }
}
