package com.novelforge.service.consistency;

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
import com.novelforge.model.StagedEdge;
import com.novelforge.model.StagedNodeUpsert;
import com.novelforge.model.fact.CharacterStateFact;
import com.novelforge.model.fact.EventFact;
import com.novelforge.model.fact.LocationChangeFact;
import com.novelforge.model.fact.RelationFact;
import com.novelforge.model.fact.RuleInvocationFact;
import com.novelforge.model.fact.UnrecognizedFact;
import com.novelforge.service.memory.NarrativeMemoryFacade;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ConsistencyCheckerTest {

    private final ConsistencyChecker checker = new ConsistencyChecker(new MemoryProperties());

    // ==================== 死亡 ====================

    @Test
    void characterCannotSpeakAfterDyingInTheSameBatch() {
        CheckResult result = checker.check("req#1", Arrays.asList(
            event("e1", "death", 1L, false, "lihang"),
            event("e2", "speech", 2L, false, "lihang")), emptyView());

        ConsistencyFinding blocking = only(result, Severity.BLOCKING);
        assertThat(blocking.getKind()).isEqualTo(FindingKind.DEAD_CHARACTER_ACTING);
        assertThat(blocking.getConflictingRefs()).containsExactlyInAnyOrder("character:lihang", "event:e1");
        assertThat(blocking.getContentRef()).isEqualTo("req#1");
        assertThat(kinds(result)).contains(FindingKind.STATE_CHANGE);
    }

    @Test
    void flashbackAfterDeathIsAccepted() {
        CheckResult result = checker.check("req#1", Arrays.asList(
            event("e1", "death", 1L, false, "lihang"),
            event("e2", "speech", 2L, true, "lihang")), emptyView());

        assertThat(result.hasBlocking()).isFalse();
        assertThat(result.getStagedChanges().stagedAttributes(NodeRef.parse("character:lihang")))
            .containsEntry(ConsistencyChecker.ATTR_ALIVE, false)
            .containsEntry(ConsistencyChecker.ATTR_DEATH_EVENT, "e1");
    }

    @Test
    void committedDeathBlocksLaterActionButNotEarlierOnes() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 2, CollectionUtils.mapOf(
            "alive", false, "deathEvent", "duel", "deathSequence", 10L)));

        CheckResult later = checker.check("r#1", Collections.singletonList(
            event("e2", "speech", 11L, false, "lihang")), view);
        assertThat(only(later, Severity.BLOCKING).getConflictingRefs())
            .containsExactlyInAnyOrder("character:lihang", "event:duel");

        CheckResult earlier = checker.check("r#1", Collections.singletonList(
            event("e0", "training", 9L, false, "lihang")), view);
        assertThat(earlier.hasBlocking()).isFalse();
    }

    @Test
    void deathIsAlsoDetectedFromCommittedDeathEvents() {
        GraphSnapshot view = view(
            node(NodeType.CHARACTER, "lihang", 1, new LinkedHashMap<>()),
            node(NodeType.EVENT, "duel", 1, CollectionUtils.mapOf(
                "eventType", "killed", "participants", CollectionUtils.listOf("lihang"), "sequence", 5L,
                "flashback", false)));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new LocationChangeFact("lihang", "qingyun", 6L, false, null)), view);

        assertThat(only(result, Severity.BLOCKING).getKind()).isEqualTo(FindingKind.DEAD_CHARACTER_ACTING);
        assertThat(result.getStagedChanges().isStaged(NodeRef.parse("location:qingyun"))).isFalse();
    }

    @Test
    void deadCharacterCannotBeResurrected() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 2, CollectionUtils.mapOf(
            "alive", false, "deathEvent", "duel", "deathSequence", 10L)));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("alive", true), 12L, false, null)), view);

        assertThat(only(result, Severity.BLOCKING).getKind()).isEqualTo(FindingKind.RESURRECTION);
        assertThat(result.getStagedChanges().isEmpty()).isTrue();
    }

    @Test
    void oversizedSequenceStringIsTreatedAsUnknown() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 2, CollectionUtils.mapOf(
            "alive", false, "deathEvent", "duel", "deathSequence", "123456789012345678901234")));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            event("e2", "speech", 11L, false, "lihang")), view);

        assertThat(only(result, Severity.BLOCKING).getKind()).isEqualTo(FindingKind.DEAD_CHARACTER_ACTING);
        assertThat(ConsistencyChecker.asLong("123456789012345678901234")).isNull();
        assertThat(ConsistencyChecker.asLong(" 42 ")).isEqualTo(42L);
    }

    @Test
    void unknownSequenceAfterDeathCountsAsDead() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 2, CollectionUtils.mapOf(
            "alive", false, "deathSequence", 10L)));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("mood", "愤怒"), null, false, null)), view);

        assertThat(only(result, Severity.BLOCKING).getConflictingRefs()).containsExactly("character:lihang");
    }

    // ==================== 属性 ====================

    @Test
    void immutableAttributeCannotChange() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 1, CollectionUtils.mapOf("gender", "male")));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("gender", "female"), 3L, false, null)), view);

        assertThat(only(result, Severity.BLOCKING).getKind()).isEqualTo(FindingKind.IMMUTABLE_ATTRIBUTE_CONFLICT);
        assertThat(result.getStagedChanges().isStaged(NodeRef.parse("character:lihang"))).isFalse();
    }

    @Test
    void refinementIsInformationalAndStaged() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 4, CollectionUtils.mapOf("appearance", "黑发")));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("appearance", "黑发，左眉有疤"), 3L, false, null)),
            view);

        assertThat(result.hasBlocking()).isFalse();
        assertThat(kinds(result)).containsExactly(FindingKind.ATTRIBUTE_REFINEMENT);
        StagedNodeUpsert upsert = upsert(result, "character:lihang");
        assertThat(upsert.getAttributes()).containsEntry("appearance", "黑发，左眉有疤");
        assertThat(upsert.getBaseVersion()).isEqualTo(4);
    }

    @Test
    void ordinaryChangeIsAStateChange() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 1, CollectionUtils.mapOf("realm", "炼气")));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("realm", "筑基", "weapon", "青锋剑"), 3L, false,
                null)), view);

        assertThat(kinds(result)).containsExactly(FindingKind.STATE_CHANGE);
        assertThat(upsert(result, "character:lihang").getAttributes())
            .containsEntry("realm", "筑基").containsEntry("weapon", "青锋剑");
    }

    @Test
    void flashbackStateDoesNotOverwriteTheCurrentState() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 1, CollectionUtils.mapOf("realm", "筑基")));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("realm", "炼气"), 1L, true, null)), view);

        assertThat(result.hasBlocking()).isFalse();
        assertThat(result.getStagedChanges().isStaged(NodeRef.parse("character:lihang"))).isFalse();
    }

    @Test
    void newCharacterIsStagedWithoutBaseVersion() {
        CheckResult result = checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("newbie", CollectionUtils.mapOf("realm", "炼气"), 3L, false, null)), emptyView());

        assertThat(result.getFindings()).isEmpty();
        assertThat(upsert(result, "character:newbie").getBaseVersion()).isNull();
    }

    // ==================== 规则 ====================

    @Test
    void forbiddenActionViolatesRule() {
        GraphSnapshot view = view(node(NodeType.RULE, "no_flight", 1, CollectionUtils.mapOf(
            "description", "青云山禁止御剑飞行", "forbiddenActions", CollectionUtils.listOf("飞行"))));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new RuleInvocationFact("no_flight", "lihang", "飞行", 3L, false, null)), view);

        ConsistencyFinding blocking = only(result, Severity.BLOCKING);
        assertThat(blocking.getKind()).isEqualTo(FindingKind.RULE_VIOLATION);
        assertThat(blocking.getConflictingRefs()).containsExactlyInAnyOrder("rule:no_flight", "character:lihang");
        assertThat(result.getStagedChanges().getEdges()).isEmpty();
    }

    @Test
    void permittedActionRecordsAnInvocation() {
        GraphSnapshot view = view(node(NodeType.RULE, "no_flight", 1, CollectionUtils.mapOf(
            "forbiddenActions", CollectionUtils.listOf("飞行"))));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new RuleInvocationFact("no_flight", "lihang", "步行", 3L, false, null)), view);

        assertThat(result.getFindings()).isEmpty();
        StagedEdge edge = result.getStagedChanges().getEdges().get(0);
        assertThat(edge.getRelation()).isEqualTo(ConsistencyChecker.RELATION_INVOKES);
        assertThat(edge.getSource()).isEqualTo(NodeRef.parse("character:lihang"));
        assertThat(upsert(result, "character:lihang").getAttributes()).isEmpty();
    }

    @Test
    void unknownRuleIsAWarningAndGetsStaged() {
        CheckResult result = checker.check("r#1", Collections.singletonList(
            new RuleInvocationFact("blood_oath", "lihang", "立誓", 7L, false, null)), emptyView());

        ConsistencyFinding warning = only(result, Severity.WARNING);
        assertThat(warning.getKind()).isEqualTo(FindingKind.UNKNOWN_RULE);
        assertThat(upsert(result, "rule:blood_oath").getAttributes()).containsEntry("firstInvokedAt", 7L);
    }

    // ==================== 事件 ====================

    @Test
    void backwardsSequenceWithoutFlashbackIsAWarning() {
        GraphSnapshot view = view(node(NodeType.EVENT, "e5", 1, CollectionUtils.mapOf(
            "eventType", "battle", "participants", CollectionUtils.listOf("lihang"), "sequence", 5L,
            "flashback", false)));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            event("e3", "training", 3L, false, "lihang")), view);

        assertThat(result.hasBlocking()).isFalse();
        assertThat(only(result, Severity.WARNING).getKind()).isEqualTo(FindingKind.TEMPORAL_ORDER);

        CheckResult flashback = checker.check("r#1", Collections.singletonList(
            event("e3", "training", 3L, true, "lihang")), view);
        assertThat(flashback.getFindings()).isEmpty();
    }

    @Test
    void redefiningAnEventIsBlocking() {
        GraphSnapshot view = view(node(NodeType.EVENT, "e1", 1, CollectionUtils.mapOf(
            "eventType", "battle", "participants", CollectionUtils.listOf("lihang"), "sequence", 1L)));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            event("e1", "battle", 2L, false, "lihang")), view);

        assertThat(only(result, Severity.BLOCKING).getKind()).isEqualTo(FindingKind.EVENT_REDEFINED);
        assertThat(result.getStagedChanges().isEmpty()).isTrue();
    }

    @Test
    void restatingAnEventUnchangedIsFine() {
        GraphSnapshot view = view(node(NodeType.EVENT, "e1", 1, CollectionUtils.mapOf(
            "eventType", "battle", "participants", CollectionUtils.listOf("lihang"), "sequence", 1L)));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            event("e1", "battle", 1L, false, "lihang")), view);

        assertThat(result.hasBlocking()).isFalse();
    }

    @Test
    void eventStagesMissingEndpointsAndEdges() {
        EventFact fact = new EventFact("ambush", "battle", CollectionUtils.listOf("lihang", "zhangsan"), null,
            "qingyun", "山道伏击", 4L, false, null);

        CheckResult result = checker.check("r#1", Collections.singletonList(fact), emptyView());

        assertThat(result.getFindings()).isEmpty();
        assertThat(upsert(result, "character:zhangsan").getAttributes()).isEmpty();
        assertThat(upsert(result, "location:qingyun").getAttributes()).isEmpty();
        assertThat(upsert(result, "event:ambush").getAttributes())
            .containsEntry("eventType", "battle").containsEntry("sequence", 4L);
        assertThat(result.getStagedChanges().getEdges()).extracting(StagedEdge::getRelation)
            .containsExactly(NarrativeMemoryFacade.RELATION_PARTICIPATES_IN,
                NarrativeMemoryFacade.RELATION_PARTICIPATES_IN, NarrativeMemoryFacade.RELATION_OCCURRED_AT);
    }

    // ==================== 其他 ====================

    @Test
    void locationMoveIsAStateChange() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 1, CollectionUtils.mapOf("location", "qingyun")));

        CheckResult result = checker.check("r#1", Collections.singletonList(
            new LocationChangeFact("lihang", "tianyin", 3L, false, null)), view);

        assertThat(only(result, Severity.INFO).getKind()).isEqualTo(FindingKind.STATE_CHANGE);
        assertThat(upsert(result, "character:lihang").getAttributes()).containsEntry("location", "tianyin");
        assertThat(result.getStagedChanges().getEdges().get(0).getRelation())
            .isEqualTo(ConsistencyChecker.RELATION_LOCATED_AT);
    }

    @Test
    void relationStagesBothEndpoints() {
        CheckResult result = checker.check("r#1", Collections.singletonList(
            new RelationFact(NodeRef.parse("character:lihang"), NodeRef.parse("item:sword"), "OWNS",
                CollectionUtils.mapOf("since", 3), 3L, false, null)), emptyView());

        assertThat(result.getStagedChanges().isStaged(NodeRef.parse("item:sword"))).isTrue();
        assertThat(result.getStagedChanges().getEdges()).hasSize(1);
    }

    @Test
    void unrecognizedFactIsRejectedWithAWarning() {
        CheckResult result = checker.check("r#1", Collections.singletonList(
            new UnrecognizedFact("teleport", CollectionUtils.mapOf("kind", "teleport"), null)), emptyView());

        ConsistencyFinding warning = only(result, Severity.WARNING);
        assertThat(warning.getKind()).isEqualTo(FindingKind.UNRECOGNIZED_FACT);
        assertThat(warning.getDescription()).contains("teleport");
        assertThat(result.getStagedChanges().isEmpty()).isTrue();
    }

    @Test
    void checkingNeverMutatesTheView() {
        GraphSnapshot view = view(node(NodeType.CHARACTER, "lihang", 1, CollectionUtils.mapOf("realm", "炼气")));

        checker.check("r#1", Collections.singletonList(
            new CharacterStateFact("lihang", CollectionUtils.mapOf("realm", "筑基"), 3L, false, null)), view);

        assertThat(view.findNode(NodeRef.parse("character:lihang")).get().getAttributes())
            .containsEntry("realm", "炼气");
    }

    // ==================== 工具 ====================

    private static EventFact event(String key, String type, Long sequence, boolean flashback, String... participants) {
        return new EventFact(key, type, new ArrayList<>(Arrays.asList(participants)), null, null, null,
            sequence, flashback, null);
    }

    private static KnowledgeNode node(NodeType type, String key, int version, Map<String, Object> attributes) {
        return KnowledgeNode.builder()
            .id(UUID.randomUUID().toString())
            .projectId("p")
            .type(type)
            .nodeKey(key)
            .attributes(attributes)
            .version(version)
            .build();
    }

    private static GraphSnapshot view(KnowledgeNode... nodes) {
        return new GraphSnapshot(null, "p", 1L, Arrays.asList(nodes), Collections.emptyList(), LocalDateTime.now());
    }

    private static GraphSnapshot emptyView() {
        return view();
    }

    private static ConsistencyFinding only(CheckResult result, Severity severity) {
        List<ConsistencyFinding> matching = new ArrayList<>();
        for (ConsistencyFinding finding : result.getFindings()) {
            if (finding.getSeverity() == severity) {
                matching.add(finding);
            }
        }
        assertThat(matching).as("findings of severity %s in %s", severity, result.getFindings()).hasSize(1);
        return matching.get(0);
    }

    private static List<FindingKind> kinds(CheckResult result) {
        List<FindingKind> kinds = new ArrayList<>();
        for (ConsistencyFinding finding : result.getFindings()) {
            kinds.add(finding.getKind());
        }
        return kinds;
    }

    private static StagedNodeUpsert upsert(CheckResult result, String ref) {
        Optional<StagedNodeUpsert> upsert = result.getStagedChanges().getNodeUpserts().stream()
            .filter(u -> u.getRef().equals(NodeRef.parse(ref)))
            .findFirst();
        assertThat(upsert).as("staged upsert for %s", ref).isPresent();
        return upsert.get();
    }
}
