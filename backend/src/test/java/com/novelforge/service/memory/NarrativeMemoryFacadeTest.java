package com.novelforge.service.memory;

import com.novelforge.common.exception.ValidationException;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.NodeRef;
import com.novelforge.service.consistency.ConsistencyChecker;
import com.novelforge.service.context.ProjectContextRegistry;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.support.MemoryTestKit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NarrativeMemoryFacadeTest {

    private static final String PROJECT = "novel-1";

    private MemoryTestKit kit;
    private NarrativeMemoryFacade facade;

    @BeforeEach
    void setUp() {
        kit = new MemoryTestKit();
        facade = kit.facade;
    }

    @AfterEach
    void tearDown() {
        kit.close();
    }

    @Test
    void characterWritesNodeAndLinkedMemory() {
        MemoryEntry entry = facade.addCharacter(PROJECT, "lihang",
            CollectionUtils.mapOf("gender", "male", "realm", "炼气"), "李航，青云宗外门弟子");

        assertThat(entry.getKind()).isEqualTo(MemoryKind.CHARACTER_STATE);
        assertThat(entry.getContent()).isEqualTo("李航，青云宗外门弟子");
        assertThat(CollectionUtils.toStringList(entry.getMetadata().get(LongTermMemoryStore.META_NODE_REFS)))
            .containsExactly("character:lihang");
        KnowledgeNode node = kit.graph.findNode(PROJECT, NodeRef.parse("character:lihang")).get();
        assertThat(node.getAttributes()).containsEntry("gender", "male").containsEntry("realm", "炼气");
    }

    @Test
    void locationAndRuleAreStoredAsWorldbuilding() {
        facade.addLocation(PROJECT, "qingyun", null, "青云山，终年云雾");
        MemoryEntry rule = facade.addRule(PROJECT, "no_flight", "青云山上禁止御剑飞行",
            CollectionUtils.listOf("飞行"));

        assertThat(rule.getKind()).isEqualTo(MemoryKind.WORLDBUILDING);
        assertThat(rule.getMetadata()).containsEntry("category", "rule");
        assertThat(kit.graph.findNode(PROJECT, NodeRef.parse("location:qingyun"))).isPresent();
        assertThat(kit.graph.findNode(PROJECT, NodeRef.parse("rule:no_flight")).get().getAttributes())
            .containsEntry(ConsistencyChecker.ATTR_FORBIDDEN_ACTIONS, CollectionUtils.listOf("飞行"));
    }

    @Test
    void ruleWithoutDescriptionIsRejected() {
        assertThatThrownBy(() -> facade.addRule(PROJECT, "r", " ", null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void deathEventMarksTheSubjectDeadAndLinksParticipants() {
        facade.addCharacter(PROJECT, "lihang", null, "李航");

        MemoryEntry entry = facade.addEvent(PROJECT, "duel", "death", CollectionUtils.listOf("lihang", "zhangsan"),
            12L, "李航在决斗中被张三所杀", false);

        KnowledgeNode lihang = kit.graph.findNode(PROJECT, NodeRef.parse("character:lihang")).get();
        assertThat(lihang.getAttributes())
            .containsEntry(ConsistencyChecker.ATTR_ALIVE, false)
            .containsEntry(ConsistencyChecker.ATTR_DEATH_EVENT, "duel")
            .containsEntry(ConsistencyChecker.ATTR_DEATH_SEQUENCE, 12L);

        // 未登记的参与者先建占位节点
        KnowledgeNode zhangsan = kit.graph.findNode(PROJECT, NodeRef.parse("character:zhangsan")).get();
        assertThat(zhangsan.getAttributes()).containsEntry(KnowledgeGraphService.PLACEHOLDER_ATTRIBUTE, true);

        List<KnowledgeEdge> edges = kit.graph.relationships(PROJECT, NodeRef.parse("event:duel"));
        assertThat(edges).hasSize(2)
            .extracting(KnowledgeEdge::getRelation)
            .containsOnly(NarrativeMemoryFacade.RELATION_PARTICIPATES_IN);
        assertThat(entry.getKind()).isEqualTo(MemoryKind.EVENT);
        assertThat(CollectionUtils.toStringList(entry.getMetadata().get(LongTermMemoryStore.META_NODE_REFS)))
            .containsExactly("event:duel", "character:lihang", "character:zhangsan");
    }

    @Test
    void flashbackDeathDoesNotChangeCurrentState() {
        facade.addCharacter(PROJECT, "master", CollectionUtils.mapOf("realm", "元婴"), "师父");

        facade.addEvent(PROJECT, "old_war", "death", CollectionUtils.listOf("master"), 3L, "回忆中师父战死", true);

        assertThat(kit.graph.findNode(PROJECT, NodeRef.parse("character:master")).get().getAttributes())
            .doesNotContainKey(ConsistencyChecker.ATTR_ALIVE);
    }

    @Test
    void chapterSummaryIsNotARollingSummary() {
        MemoryEntry entry = facade.addChapterSummary(PROJECT, 3, "下山", "李航下山历练");

        assertThat(entry.getContent()).isEqualTo("第3章《下山》：李航下山历练");
        assertThat(entry.getMetadata())
            .containsEntry(ProjectContextRegistry.META_SUMMARY_TYPE, ProjectContextRegistry.CHAPTER_SUMMARY)
            .containsEntry("chapter", 3);
        assertThatThrownBy(() -> facade.addChapterSummary(PROJECT, 0, null, "x"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void generationContextCombinesMemoriesAndTheirGraphFacts() {
        facade.addCharacter(PROJECT, "lihang", CollectionUtils.mapOf("realm", "筑基"), "李航是青云宗弟子");
        facade.addLocation(PROJECT, "qingyun", null, "青云山");

        String context = facade.getContextForGeneration(PROJECT, "李航是青云宗弟子", 1);

        assertThat(context).startsWith("【相关记忆】\n- [character_state] 李航是青云宗弟子");
        assertThat(context).contains("【图谱事实】").contains("- character:lihang {realm=筑基}");
        assertThat(context).doesNotContain("location:qingyun");
    }

    @Test
    void generationContextIsEmptyForAnEmptyProject() {
        assertThat(facade.getContextForGeneration(PROJECT, "任何内容", 3)).isEmpty();
    }
}
