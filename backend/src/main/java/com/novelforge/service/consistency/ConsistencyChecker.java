package com.novelforge.service.consistency;

import com.novelforge.common.util.AttributeValues;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.model.CheckResult;
import com.novelforge.model.ConsistencyFinding;
import com.novelforge.model.FindingKind;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import com.novelforge.model.Severity;
import com.novelforge.model.StagedGraphChanges;
import com.novelforge.model.fact.CandidateFact;
import com.novelforge.model.fact.CharacterStateFact;
import com.novelforge.model.fact.EventFact;
import com.novelforge.model.fact.LocationChangeFact;
import com.novelforge.model.fact.RelationFact;
import com.novelforge.model.fact.RuleInvocationFact;
import com.novelforge.model.fact.UnrecognizedFact;
import com.novelforge.service.memory.NarrativeMemoryFacade;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 一致性校验
 *
 * 针对请求开始时的图谱读视图逐条评估候选事实：与既有事实矛盾的给出 blocking，
 * 新事实暂存待提交，对既有属性的补充给出 info。校验本身不写任何存储
 */
@Service
public class ConsistencyChecker {

    private static final Logger logger = LoggerFactory.getLogger(ConsistencyChecker.class);

    public static final String ATTR_ALIVE = "alive";
    public static final String ATTR_DEATH_EVENT = "deathEvent";
    public static final String ATTR_DEATH_SEQUENCE = "deathSequence";
    public static final String ATTR_LOCATION = "location";
    public static final String ATTR_FORBIDDEN_ACTIONS = "forbiddenActions";

    public static final String RELATION_LOCATED_AT = "LOCATED_AT";
    public static final String RELATION_INVOKES = "INVOKES";

    private final MemoryProperties properties;

    public ConsistencyChecker(MemoryProperties properties) {
        this.properties = properties;
    }

    /**
     * @param contentRef 触发内容的引用（requestId#attempt），写入每条发现
     */
    public CheckResult check(String contentRef, List<CandidateFact> facts, GraphSnapshot view) {
        Session session = new Session(contentRef, view);
        for (CandidateFact fact : facts) {
            session.evaluate(fact);
        }
        long blocking = session.findings.stream().filter(ConsistencyFinding::isBlocking).count();
        logger.info("🔎 一致性校验完成: ref={}, facts={}, findings={}, blocking={}",
            contentRef, facts.size(), session.findings.size(), blocking);
        return new CheckResult(session.findings, session.staged);
    }

    boolean isDeathType(String eventType) {
        if (eventType == null) {
            return false;
        }
        for (String type : properties.getDeathEventTypes()) {
            if (type.equalsIgnoreCase(eventType.trim())) {
                return true;
            }
        }
        return false;
    }

    private boolean isImmutable(String attribute) {
        for (String name : properties.getImmutableAttributes()) {
            if (name.equalsIgnoreCase(attribute)) {
                return true;
            }
        }
        return false;
    }

    static Long asLong(Object value) {
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String && StringUtils.isNumeric(((String) value).trim())) {
            // 超出 long 范围的数字串按非数值处理
            long parsed = NumberUtils.toLong(((String) value).trim(), -1L);
            return parsed >= 0 ? parsed : null;
        }
        return null;
    }

    /**
     * 角色死亡记录
     */
    private static final class Death {
        private final String eventKey;
        private final Long sequence;

        Death(String eventKey, Long sequence) {
            this.eventKey = eventKey;
            this.sequence = sequence;
        }
    }

    /**
     * 单次校验的状态：读视图 + 已暂存变更 + 本批次内新增的死亡
     */
    private final class Session {

        private final String contentRef;
        private final GraphSnapshot view;
        private final StagedGraphChanges staged = new StagedGraphChanges();
        private final List<ConsistencyFinding> findings = new ArrayList<>();
        private final Map<String, Death> stagedDeaths = new HashMap<>();
        private final Map<String, Long> stagedLatestSequence = new HashMap<>();

        Session(String contentRef, GraphSnapshot view) {
            this.contentRef = contentRef;
            this.view = view;
        }

        void evaluate(CandidateFact fact) {
            switch (fact.getKind()) {
                case CHARACTER_STATE:
                    checkCharacterState((CharacterStateFact) fact);
                    break;
                case LOCATION_CHANGE:
                    checkLocationChange((LocationChangeFact) fact);
                    break;
                case RULE_INVOCATION:
                    checkRuleInvocation((RuleInvocationFact) fact);
                    break;
                case EVENT:
                    checkEvent((EventFact) fact);
                    break;
                case RELATION:
                    checkRelation((RelationFact) fact);
                    break;
                case UNRECOGNIZED:
                default:
                    UnrecognizedFact unknown = fact instanceof UnrecognizedFact ? (UnrecognizedFact) fact : null;
                    add(FindingKind.UNRECOGNIZED_FACT, Severity.WARNING,
                        "无法识别的事实类型，已忽略: " + (unknown != null ? unknown.getRawKind() : fact.getKind()),
                        new LinkedHashSet<>());
                    break;
            }
        }

        // ==================== 各类事实 ====================

        private void checkCharacterState(CharacterStateFact fact) {
            NodeRef ref = NodeRef.of(NodeType.CHARACTER, fact.getCharacterKey());
            Map<String, Object> attrs = fact.getAttributes();
            Death death = deathOf(fact.getCharacterKey());
            boolean blocked = false;

            if (death != null && !fact.isFlashback()) {
                if (AttributeValues.isTrue(attrs.get(ATTR_ALIVE))) {
                    add(FindingKind.RESURRECTION, Severity.BLOCKING,
                        "角色 " + fact.getCharacterKey() + " 已死亡，不能直接改为存活",
                        deathRefs(ref, death));
                    blocked = true;
                } else if (hasNonDeathAttributes(attrs) && isDeadAt(death, fact.getSequence())) {
                    add(FindingKind.DEAD_CHARACTER_ACTING, Severity.BLOCKING,
                        "角色 " + fact.getCharacterKey() + " 已死亡，却出现新的状态变化: " + attrs,
                        deathRefs(ref, death));
                    blocked = true;
                }
            }

            Map<String, Object> toStage = new LinkedHashMap<>();
            for (Map.Entry<String, Object> entry : attrs.entrySet()) {
                String name = entry.getKey();
                Object newValue = entry.getValue();
                Object oldValue = currentAttribute(ref, name);
                if (oldValue == null || AttributeValues.same(oldValue, newValue)) {
                    if (oldValue == null) {
                        toStage.put(name, newValue);
                    }
                    continue;
                }
                if (isImmutable(name)) {
                    add(FindingKind.IMMUTABLE_ATTRIBUTE_CONFLICT, Severity.BLOCKING,
                        "角色 " + fact.getCharacterKey() + " 的不可变属性 " + name + " 已确定为 " + oldValue
                            + "，不能改为 " + newValue,
                        CollectionUtils.setOf(ref.toString()));
                    blocked = true;
                } else if (AttributeValues.isRefinement(oldValue, newValue)) {
                    add(FindingKind.ATTRIBUTE_REFINEMENT, Severity.INFO,
                        "补充角色 " + fact.getCharacterKey() + " 的 " + name + ": " + newValue,
                        CollectionUtils.setOf(ref.toString()));
                    toStage.put(name, newValue);
                } else {
                    add(FindingKind.STATE_CHANGE, Severity.INFO,
                        "角色 " + fact.getCharacterKey() + " 的 " + name + " 由 " + oldValue + " 变为 " + newValue,
                        CollectionUtils.setOf(ref.toString()));
                    toStage.put(name, newValue);
                }
            }
            if (blocked || fact.isFlashback()) {
                // 回忆情节描述的是过去的状态，不改写当前状态
                return;
            }
            if (AttributeValues.isFalse(attrs.get(ATTR_ALIVE)) && death == null) {
                toStage.put(ATTR_DEATH_SEQUENCE, fact.getSequence());
                stagedDeaths.put(fact.getCharacterKey(), new Death(null, fact.getSequence()));
            }
            if (!toStage.isEmpty()) {
                stageNode(ref, toStage);
            }
        }

        private void checkLocationChange(LocationChangeFact fact) {
            NodeRef character = NodeRef.of(NodeType.CHARACTER, fact.getCharacterKey());
            NodeRef location = NodeRef.of(NodeType.LOCATION, fact.getLocationKey());
            if (!fact.isFlashback() && blockIfDead(fact.getCharacterKey(), fact.getSequence(),
                "移动到 " + fact.getLocationKey())) {
                return;
            }
            if (fact.isFlashback()) {
                return;
            }
            Object previous = currentAttribute(character, ATTR_LOCATION);
            if (previous != null && !AttributeValues.same(previous, fact.getLocationKey())) {
                add(FindingKind.STATE_CHANGE, Severity.INFO,
                    "角色 " + fact.getCharacterKey() + " 从 " + previous + " 移动到 " + fact.getLocationKey(),
                    CollectionUtils.setOf(character.toString(), location.toString()));
            }
            ensureNode(location);
            stageNode(character, CollectionUtils.mapOf(ATTR_LOCATION, fact.getLocationKey()));
            staged.stageEdge(character, location, RELATION_LOCATED_AT,
                CollectionUtils.mapOf("sequence", fact.getSequence()));
            trackSequence(fact.getCharacterKey(), fact.getSequence());
        }

        private void checkRuleInvocation(RuleInvocationFact fact) {
            NodeRef rule = NodeRef.of(NodeType.RULE, fact.getRuleKey());
            boolean blocked = false;
            if (fact.getActorKey() != null && !fact.isFlashback()) {
                blocked = blockIfDead(fact.getActorKey(), fact.getSequence(), "援引规则 " + fact.getRuleKey());
            }

            if (!exists(rule)) {
                add(FindingKind.UNKNOWN_RULE, Severity.WARNING,
                    "引用了尚未建立的世界规则: " + fact.getRuleKey(), CollectionUtils.setOf(rule.toString()));
                if (!blocked) {
                    stageNode(rule, CollectionUtils.mapOf("firstInvokedAt", fact.getSequence()));
                }
            } else if (fact.getAction() != null) {
                for (String forbidden : CollectionUtils.toStringList(currentAttribute(rule, ATTR_FORBIDDEN_ACTIONS))) {
                    if (forbidden.trim().equalsIgnoreCase(fact.getAction().trim())) {
                        Set<String> refs = CollectionUtils.setOf(rule.toString());
                        if (fact.getActorKey() != null) {
                            refs.add(NodeRef.of(NodeType.CHARACTER, fact.getActorKey()).toString());
                        }
                        add(FindingKind.RULE_VIOLATION, Severity.BLOCKING,
                            "动作 " + fact.getAction() + " 违反世界规则 " + fact.getRuleKey(), refs);
                        blocked = true;
                        break;
                    }
                }
            }
            if (blocked || fact.getActorKey() == null) {
                return;
            }
            NodeRef actor = NodeRef.of(NodeType.CHARACTER, fact.getActorKey());
            ensureNode(actor);
            staged.stageEdge(actor, rule, RELATION_INVOKES,
                CollectionUtils.mapOf("action", fact.getAction(), "sequence", fact.getSequence()));
        }

        private void checkEvent(EventFact fact) {
            NodeRef eventRef = NodeRef.of(NodeType.EVENT, fact.getEventKey());
            boolean blocked = false;

            Optional<KnowledgeNode> existing = view.findNode(eventRef);
            if (existing.isPresent()) {
                Map<String, Object> attrs = existing.get().getAttributes();
                Object oldType = attrs != null ? attrs.get("eventType") : null;
                Long oldSequence = attrs != null ? asLong(attrs.get("sequence")) : null;
                boolean typeChanged = oldType != null && !AttributeValues.same(oldType, fact.getEventType());
                boolean sequenceChanged = oldSequence != null && fact.getSequence() != null
                    && !oldSequence.equals(fact.getSequence());
                if (typeChanged || sequenceChanged) {
                    add(FindingKind.EVENT_REDEFINED, Severity.BLOCKING,
                        "事件 " + fact.getEventKey() + " 已记录为 " + oldType + "(seq=" + oldSequence
                            + ")，不能重新定义为 " + fact.getEventType() + "(seq=" + fact.getSequence() + ")",
                        CollectionUtils.setOf(eventRef.toString()));
                    blocked = true;
                }
            }

            Set<String> actors = new LinkedHashSet<>(fact.getParticipants());
            if (fact.getSubjectKey() != null) {
                actors.add(fact.getSubjectKey());
            }
            if (!fact.isFlashback()) {
                for (String actor : actors) {
                    Death death = deathOf(actor);
                    if (death != null && fact.getEventKey().equals(death.eventKey)) {
                        continue;
                    }
                    if (blockIfDead(actor, fact.getSequence(), fact.getEventType() + "(" + fact.getEventKey() + ")")) {
                        blocked = true;
                    }
                }
                for (String actor : actors) {
                    Long latest = latestSequence(actor);
                    if (latest != null && fact.getSequence() != null && fact.getSequence() < latest) {
                        add(FindingKind.TEMPORAL_ORDER, Severity.WARNING,
                            "角色 " + actor + " 的事件顺序倒退: " + fact.getEventKey() + "(seq=" + fact.getSequence()
                                + ") 早于已记录的 seq=" + latest + "，且未标记为回忆",
                            CollectionUtils.setOf(NodeRef.of(NodeType.CHARACTER, actor).toString(), eventRef.toString()));
                    }
                }
            }
            if (blocked) {
                return;
            }

            Map<String, Object> eventAttrs = CollectionUtils.mapOf(
                "eventType", fact.getEventType(),
                "participants", new ArrayList<>(fact.getParticipants()),
                "sequence", fact.getSequence(),
                "flashback", fact.isFlashback());
            if (fact.getSubjectKey() != null) {
                eventAttrs.put("subject", fact.getSubjectKey());
            }
            if (fact.getDescription() != null) {
                eventAttrs.put("description", fact.getDescription());
            }
            if (fact.getLocationKey() != null) {
                eventAttrs.put(ATTR_LOCATION, fact.getLocationKey());
            }
            stageNode(eventRef, eventAttrs);

            for (String actor : actors) {
                NodeRef actorRef = NodeRef.of(NodeType.CHARACTER, actor);
                ensureNode(actorRef);
                staged.stageEdge(actorRef, eventRef, NarrativeMemoryFacade.RELATION_PARTICIPATES_IN,
                    CollectionUtils.mapOf("sequence", fact.getSequence()));
                if (!fact.isFlashback()) {
                    trackSequence(actor, fact.getSequence());
                }
            }
            if (fact.getLocationKey() != null) {
                NodeRef location = NodeRef.of(NodeType.LOCATION, fact.getLocationKey());
                ensureNode(location);
                staged.stageEdge(eventRef, location, NarrativeMemoryFacade.RELATION_OCCURRED_AT, new LinkedHashMap<>());
            }

            if (isDeathType(fact.getEventType()) && !fact.isFlashback() && fact.getSubjectKey() != null) {
                NodeRef subject = NodeRef.of(NodeType.CHARACTER, fact.getSubjectKey());
                stageNode(subject, CollectionUtils.mapOf(
                    ATTR_ALIVE, false,
                    ATTR_DEATH_EVENT, fact.getEventKey(),
                    ATTR_DEATH_SEQUENCE, fact.getSequence()));
                stagedDeaths.put(fact.getSubjectKey(), new Death(fact.getEventKey(), fact.getSequence()));
                add(FindingKind.STATE_CHANGE, Severity.INFO,
                    "角色 " + fact.getSubjectKey() + " 在事件 " + fact.getEventKey() + " 中死亡",
                    CollectionUtils.setOf(subject.toString(), eventRef.toString()));
            }
        }

        private void checkRelation(RelationFact fact) {
            ensureNode(fact.getSource());
            ensureNode(fact.getTarget());
            staged.stageEdge(fact.getSource(), fact.getTarget(), fact.getRelation(), fact.getAttributes());
        }

        // ==================== 死亡与时间顺序 ====================

        /**
         * 查找角色的死亡记录：本批次暂存 > 角色节点属性 > 图谱中的死亡事件
         */
        private Death deathOf(String characterKey) {
            Death recent = stagedDeaths.get(characterKey);
            if (recent != null) {
                return recent;
            }
            NodeRef ref = NodeRef.of(NodeType.CHARACTER, characterKey);
            Optional<KnowledgeNode> node = view.findNode(ref);
            if (node.isPresent() && node.get().getAttributes() != null
                && AttributeValues.isFalse(node.get().getAttributes().get(ATTR_ALIVE))) {
                Map<String, Object> attrs = node.get().getAttributes();
                Object eventKey = attrs.get(ATTR_DEATH_EVENT);
                return new Death(eventKey != null ? eventKey.toString() : null, asLong(attrs.get(ATTR_DEATH_SEQUENCE)));
            }
            for (KnowledgeNode event : view.nodesOfType(NodeType.EVENT)) {
                Map<String, Object> attrs = event.getAttributes();
                if (attrs == null || AttributeValues.isTrue(attrs.get("flashback"))) {
                    continue;
                }
                Object type = attrs.get("eventType");
                if (!isDeathType(type != null ? type.toString() : null)) {
                    continue;
                }
                Object subject = attrs.get("subject");
                if (subject == null) {
                    List<String> participants = CollectionUtils.toStringList(attrs.get("participants"));
                    subject = participants.isEmpty() ? null : participants.get(0);
                }
                if (characterKey.equals(subject)) {
                    return new Death(event.getNodeKey(), asLong(attrs.get("sequence")));
                }
            }
            return null;
        }

        /**
         * 死亡之后（序号更大）的行动视为矛盾；序号未知时按已死亡处理
         */
        private boolean isDeadAt(Death death, Long sequence) {
            return death != null && (death.sequence == null || sequence == null || sequence > death.sequence);
        }

        private boolean blockIfDead(String characterKey, Long sequence, String activity) {
            Death death = deathOf(characterKey);
            if (!isDeadAt(death, sequence)) {
                return false;
            }
            NodeRef ref = NodeRef.of(NodeType.CHARACTER, characterKey);
            add(FindingKind.DEAD_CHARACTER_ACTING, Severity.BLOCKING,
                "角色 " + characterKey + " 已在 " + (death.eventKey != null ? "事件 " + death.eventKey : "先前情节")
                    + " 中死亡(seq=" + death.sequence + ")，却在 seq=" + sequence + " 出现行动: " + activity
                    + "；如为回忆请标记 flashback",
                deathRefs(ref, death));
            return true;
        }

        private Set<String> deathRefs(NodeRef character, Death death) {
            Set<String> refs = CollectionUtils.setOf(character.toString());
            if (death.eventKey != null) {
                refs.add(NodeRef.of(NodeType.EVENT, death.eventKey).toString());
            }
            return refs;
        }

        private boolean hasNonDeathAttributes(Map<String, Object> attrs) {
            for (String name : attrs.keySet()) {
                if (!ATTR_ALIVE.equals(name) && !ATTR_DEATH_EVENT.equals(name) && !ATTR_DEATH_SEQUENCE.equals(name)) {
                    return true;
                }
            }
            return false;
        }

        private Long latestSequence(String characterKey) {
            Long latest = stagedLatestSequence.get(characterKey);
            for (KnowledgeNode event : view.nodesOfType(NodeType.EVENT)) {
                Map<String, Object> attrs = event.getAttributes();
                if (attrs == null || AttributeValues.isTrue(attrs.get("flashback"))) {
                    continue;
                }
                if (!CollectionUtils.toStringList(attrs.get("participants")).contains(characterKey)
                    && !characterKey.equals(attrs.get("subject"))) {
                    continue;
                }
                Long sequence = asLong(attrs.get("sequence"));
                if (sequence != null && (latest == null || sequence > latest)) {
                    latest = sequence;
                }
            }
            return latest;
        }

        private void trackSequence(String characterKey, Long sequence) {
            if (sequence != null) {
                stagedLatestSequence.merge(characterKey, sequence, Long::max);
            }
        }

        // ==================== 暂存 ====================

        private boolean exists(NodeRef ref) {
            return staged.isStaged(ref) || view.findNode(ref).isPresent();
        }

        /**
         * 暂存值优先，其次为读视图中的已提交值
         */
        private Object currentAttribute(NodeRef ref, String name) {
            Map<String, Object> stagedAttrs = staged.stagedAttributes(ref);
            if (stagedAttrs.containsKey(name)) {
                return stagedAttrs.get(name);
            }
            return view.findNode(ref)
                .map(KnowledgeNode::getAttributes)
                .map(attrs -> attrs.get(name))
                .orElse(null);
        }

        private void ensureNode(NodeRef ref) {
            if (!exists(ref)) {
                stageNode(ref, new LinkedHashMap<>());
            }
        }

        private void stageNode(NodeRef ref, Map<String, Object> attributes) {
            Integer baseVersion = view.findNode(ref).map(KnowledgeNode::getVersion).orElse(null);
            staged.stageNode(ref, attributes, baseVersion);
        }

        private void add(FindingKind kind, Severity severity, String description, Set<String> refs) {
            ConsistencyFinding finding = ConsistencyFinding.builder()
                .contentRef(contentRef)
                .kind(kind)
                .severity(severity)
                .description(description)
                .conflictingRefs(refs)
                .build();
            findings.add(finding);
            if (severity == Severity.BLOCKING) {
                logger.warn("⛔ 阻断性冲突: ref={}, kind={}, {}", contentRef, kind, description);
            }
        }
    }
}
