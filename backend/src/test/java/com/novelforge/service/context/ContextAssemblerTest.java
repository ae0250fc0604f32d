package com.novelforge.service.context;

import com.novelforge.common.exception.ValidationException;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.AssembledContext;
import com.novelforge.model.ContextSegment;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.ScoredMemory;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextAssemblerTest {

    private final ContextAssembler assembler = new ContextAssembler(null, null, new MemoryProperties());

    @Test
    void keepsTheNewestContiguousTailOfRecentSegments() {
        List<String> recent = Arrays.asList("甲甲甲甲甲甲", "乙乙乙乙乙乙", "丙丙丙丙丙丙", "丁丁丁丁丁丁");

        AssembledContext context = assembler.buildContext(recent, Collections.emptyList(), null, 12);

        assertThat(context.getText()).isEqualTo("【前文】\n丙丙丙丙丙丙\n丁丁丁丁丁丁");
        assertThat(context.getTokens()).isEqualTo(11).isLessThanOrEqualTo(12);
        assertThat(context.getDroppedSegments()).isEqualTo(2);
        assertThat(context.getIncluded()).extracting(ContextSegment::getText)
            .containsExactly("丙丙丙丙丙丙", "丁丁丁丁丁丁");
    }

    @Test
    void everythingFitsInsideAGenerousBudgetInFixedSectionOrder() {
        AssembledContext context = assembler.buildContext(
            Collections.singletonList("李航是剑修"),
            "李航离开宗门",
            Arrays.asList("第一段", "第二段"),
            Collections.singletonList(memory(MemoryKind.EVENT, "李航击败张三")),
            "李航下山\n\n遇到师妹",
            1000);

        assertThat(context.getText()).isEqualTo(
            "【必须遵守的设定】\n李航是剑修"
                + "\n\n【相关记忆】\n[前情摘要] 李航离开宗门\n[event] 李航击败张三"
                + "\n\n【本章大纲】\n李航下山\n遇到师妹"
                + "\n\n【前文】\n第一段\n第二段");
        assertThat(context.getDroppedSegments()).isZero();
        assertThat(context.getIncluded()).extracting(ContextSegment::getSource).containsExactly(
            ContextSegment.Source.PINNED,
            ContextSegment.Source.RETRIEVED, ContextSegment.Source.RETRIEVED,
            ContextSegment.Source.OUTLINE, ContextSegment.Source.OUTLINE,
            ContextSegment.Source.RECENT, ContextSegment.Source.RECENT);
        assertThat(context.getTokens()).isEqualTo(TokenEstimator.estimate(context.getText()));
    }

    @Test
    void tightBudgetDropsOutlineAndRecentBeforePinnedAndRetrieved() {
        String kept = "【必须遵守的设定】\n李航是剑修\n\n【相关记忆】\n[event] 李航击败张三";
        int budget = TokenEstimator.estimate(kept);

        AssembledContext context = assembler.buildContext(
            Collections.singletonList("李航是剑修"),
            null,
            Arrays.asList("前文一", "前文二"),
            Collections.singletonList(memory(MemoryKind.EVENT, "李航击败张三")),
            "大纲",
            budget);

        assertThat(context.getText()).isEqualTo(kept);
        assertThat(context.getTokens()).isLessThanOrEqualTo(budget);
        assertThat(context.getDroppedSegments()).isEqualTo(3);
    }

    @Test
    void outlineKeepsAContiguousPrefixOfParagraphs() {
        String outline = "一一一一一一\n\n二二二二二二\n\n三三三三三三";
        // 标题 + 两段
        int budget = TokenEstimator.estimate("【本章大纲】\n一一一一一一\n二二二二二二");

        AssembledContext context = assembler.buildContext(Collections.emptyList(), Collections.emptyList(),
            outline, budget);

        assertThat(context.getIncluded()).extracting(ContextSegment::getText)
            .containsExactly("一一一一一一", "二二二二二二");
        assertThat(context.getDroppedSegments()).isEqualTo(1);
    }

    @Test
    void budgetTooSmallForAnythingYieldsEmptyContext() {
        AssembledContext context = assembler.buildContext(Collections.singletonList("李航是剑修"), null,
            Collections.singletonList("前文"), Collections.emptyList(), null, 1);

        assertThat(context.getText()).isEmpty();
        assertThat(context.getTokens()).isZero();
        assertThat(context.getDroppedSegments()).isEqualTo(2);
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThatThrownBy(() -> assembler.buildContext(Collections.emptyList(), Collections.emptyList(), null, 0))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void splitsOutlineOnBlankLines() {
        assertThat(ContextAssembler.splitParagraphs("  a\n\n \n b\nc \n\n")).containsExactly("a", "b\nc");
        assertThat(ContextAssembler.splitParagraphs(null)).isEmpty();
    }

    @Test
    void randomInputsNeverExceedBudgetAndNeverSplitSegments() {
        Random random = new Random(42);
        for (int round = 0; round < 300; round++) {
            List<String> pinned = randomSegments(random, 3);
            List<String> recent = randomSegments(random, 6);
            List<ScoredMemory> retrieved = new ArrayList<>();
            for (String text : randomSegments(random, 4)) {
                retrieved.add(memory(MemoryKind.PLOT_POINT, text));
            }
            String outline = String.join("\n\n", randomSegments(random, 3));
            String summary = random.nextBoolean() ? randomText(random) : null;
            int budget = 1 + random.nextInt(150);

            AssembledContext context = assembler.buildContext(pinned, summary, recent, retrieved, outline, budget);

            assertThat(context.getTokens()).isLessThanOrEqualTo(budget);
            assertThat(context.getTokens()).isEqualTo(TokenEstimator.estimate(context.getText()));
            for (ContextSegment segment : context.getIncluded()) {
                assertThat(context.getText()).contains(segment.getText());
            }
            List<String> keptRecent = context.getIncluded().stream()
                .filter(s -> s.getSource() == ContextSegment.Source.RECENT)
                .map(ContextSegment::getText)
                .collect(Collectors.toList());
            assertThat(recent.subList(recent.size() - keptRecent.size(), recent.size())).isEqualTo(keptRecent);
        }
    }

    private static List<String> randomSegments(Random random, int max) {
        List<String> segments = new ArrayList<>();
        int count = random.nextInt(max + 1);
        for (int i = 0; i < count; i++) {
            segments.add(randomText(random));
        }
        return segments;
    }

    private static String randomText(Random random) {
        String alphabet = "李航张三剑宗门山abcxyz,. ";
        StringBuilder sb = new StringBuilder();
        int length = 1 + random.nextInt(30);
        for (int i = 0; i < length; i++) {
            sb.append(alphabet.charAt(random.nextInt(alphabet.length())));
        }
        String text = sb.toString().trim();
        return text.isEmpty() ? "空" : text;
    }

    private static ScoredMemory memory(MemoryKind kind, String content) {
        MemoryEntry entry = MemoryEntry.builder()
            .id(content)
            .projectId("p")
            .kind(kind)
            .content(content)
            .version(1)
            .createdAt(LocalDateTime.now())
            .build();
        return new ScoredMemory(entry, 0.9);
    }
}
