package com.novelforge.persistence.jdbc;

import com.novelforge.common.exception.ConsistencyBlockingException;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.domain.entity.KnowledgeEdge;
import com.novelforge.domain.entity.KnowledgeNode;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.GenerationRequest;
import com.novelforge.model.GenerationResult;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.NodeRef;
import com.novelforge.model.NodeType;
import com.novelforge.model.RequestState;
import com.novelforge.model.fact.EventFact;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.service.memory.LongTermMemoryStore;
import com.novelforge.service.memory.NarrativeMemoryFacade;
import com.novelforge.service.orchestrator.GenerationOrchestrator;
import com.novelforge.support.HashEmbeddingProvider;
import com.novelforge.support.RecordingSummarizationProvider;
import com.novelforge.support.ScriptedExtractionProvider;
import com.novelforge.support.ScriptedGenerationProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 基于 H2 的完整链路：MyBatis-Plus 存储 + 事务 + 编排
 */
@SpringBootTest(properties = {
    "spring.datasource.url=jdbc:h2:mem:novelforge_it;MODE=MySQL;DATABASE_TO_LOWER=TRUE;DB_CLOSE_DELAY=-1",
    "novel.memory.persistence=jdbc",
    "novel.memory.embedding-dimension=64",
    "novel.memory.backoff-initial-ms=1"
})
class JdbcPersistenceIntegrationTest {

    @Autowired
    private NarrativeMemoryFacade facade;

    @Autowired
    private LongTermMemoryStore memoryStore;

    @Autowired
    private KnowledgeGraphService graphService;

    @Autowired
    private GenerationOrchestrator orchestrator;

    @Test
    void deathEventIsPersistedAcrossGraphAndMemory() {
        String projectId = "it-death";
        facade.addCharacter(projectId, "lihang", CollectionUtils.mapOf("gender", "male"), "李航是青云宗弟子");
        facade.addEvent(projectId, "duel", "death", CollectionUtils.listOf("lihang"), 10L, "李航战死", false);

        KnowledgeNode lihang = graphService.findNode(projectId, NodeRef.parse("character:lihang")).get();
        assertThat(lihang.getAttributes())
            .containsEntry("gender", "male")
            .containsEntry("alive", false)
            .containsEntry("deathEvent", "duel");
        assertThat(((Number) lihang.getAttributes().get("deathSequence")).longValue()).isEqualTo(10L);

        List<KnowledgeEdge> edges = graphService.relationships(projectId, NodeRef.parse("character:lihang"));
        assertThat(edges).extracting(KnowledgeEdge::getRelation).containsExactly("PARTICIPATES_IN");

        assertThat(memoryStore.list(projectId, null, 10)).hasSize(2);
        assertThat(memoryStore.embeddingDimension(projectId)).isEqualTo(64);
        assertThat(facade.getContextForGeneration(projectId, "李航战死", 5)).contains("李航战死");
    }

    @Test
    void versionChainSurvivesUpdateAndRollback() {
        String projectId = "it-chain";
        MemoryEntry first = memoryStore.add(projectId, MemoryKind.PLOT_POINT, "主角下山",
            CollectionUtils.mapOf("chapter", 1));
        memoryStore.update(first.getId(), "主角被逐出山门", CollectionUtils.mapOf("chapter", 2));

        assertThat(memoryStore.history(first.getId())).extracting(MemoryEntry::getVersion).containsExactly(1, 2);
        MemoryEntry latest = memoryStore.get(first.getId()).get();
        assertThat(latest.getContent()).isEqualTo("主角被逐出山门");
        assertThat(latest.getPreviousVersionId()).isEqualTo(first.getId());
        assertThat(memoryStore.list(projectId, MemoryKind.PLOT_POINT, 10))
            .extracting(MemoryEntry::getContent).containsExactly("主角被逐出山门");

        memoryStore.rollback(first.getId(), 1);

        assertThat(memoryStore.history(first.getId())).hasSize(1);
        assertThat(memoryStore.get(first.getId()).get().getContent()).isEqualTo("主角下山");
    }

    @Test
    void snapshotRollbackRestoresAttributes() {
        String projectId = "it-snapshot";
        graphService.upsertNode(projectId, NodeType.CHARACTER, "lihang", CollectionUtils.mapOf("realm", "炼气"));
        GraphSnapshot snapshot = graphService.snapshot(projectId);
        graphService.upsertNode(projectId, NodeType.CHARACTER, "lihang", CollectionUtils.mapOf("realm", "筑基"));
        long before = graphService.graphVersion(projectId);

        long after = graphService.rollback(projectId, snapshot.getId());

        assertThat(after).isGreaterThan(before);
        Map<String, Object> attributes = graphService.findNode(projectId, NodeRef.parse("character:lihang"))
            .get().getAttributes();
        assertThat(attributes).containsEntry("realm", "炼气");
    }

    @Test
    void acceptedGenerationIsCommittedInOneTransaction() {
        String projectId = "it-accept";
        GenerationResult result = orchestrator.generate(GenerationRequest.builder()
            .projectId(projectId)
            .chapterNumber(1)
            .sceneNumber(1)
            .instruction("写酒楼")
            .build());

        assertThat(result.getState()).isEqualTo(RequestState.COMMITTED);
        assertThat(graphService.findNode(projectId, NodeRef.parse("event:enter_inn"))).isPresent();
        assertThat(graphService.findNode(projectId, NodeRef.parse("location:inn"))).isPresent();
        MemoryEntry entry = memoryStore.get(result.getMemoryEntryId()).get();
        assertThat(entry.getContent()).isEqualTo("王五走进酒楼。");
        assertThat(CollectionUtils.toStringList(entry.getMetadata().get(LongTermMemoryStore.META_NODE_REFS)))
            .contains("event:enter_inn", "character:wangwu", "location:inn");
    }

    @Test
    void blockedGenerationLeavesNoTrace() {
        String projectId = "it-blocked";
        facade.addEvent(projectId, "duel", "death", CollectionUtils.listOf("lihang"), 10L, "李航战死", false);
        long version = graphService.graphVersion(projectId);
        int entries = memoryStore.list(projectId, null, 100).size();

        assertThatThrownBy(() -> orchestrator.generate(GenerationRequest.builder()
            .projectId(projectId)
            .instruction("写对话")
            .narrativeSequence(11L)
            .build()))
            .isInstanceOf(ConsistencyBlockingException.class);

        assertThat(graphService.graphVersion(projectId)).isEqualTo(version);
        assertThat(memoryStore.list(projectId, null, 100)).hasSize(entries);
        assertThat(graphService.findNode(projectId, NodeRef.parse("event:speak"))).isEmpty();
    }

    @TestConfiguration
    static class ScriptedProviders {

        @Bean
        @Primary
        HashEmbeddingProvider scriptedEmbeddingProvider() {
            return new HashEmbeddingProvider(64);
        }

        @Bean
        @Primary
        ScriptedGenerationProvider scriptedGenerationProvider() {
            return new ScriptedGenerationProvider()
                .then((context, instruction) -> instruction.startsWith("写对话") ? "李航开口说话。" : "王五走进酒楼。");
        }

        @Bean
        @Primary
        ScriptedExtractionProvider scriptedExtractionProvider() {
            return new ScriptedExtractionProvider()
                .when("李航开口说话。", new EventFact("speak", "speech", CollectionUtils.listOf("lihang"),
                    null, null, null, 11L, false, null))
                .when("王五走进酒楼。", new EventFact("enter_inn", "arrival", CollectionUtils.listOf("wangwu"),
                    null, "inn", "王五进酒楼", 1001L, false, null));
        }

        @Bean
        @Primary
        RecordingSummarizationProvider scriptedSummarizationProvider() {
            return new RecordingSummarizationProvider();
        }
    }
}
