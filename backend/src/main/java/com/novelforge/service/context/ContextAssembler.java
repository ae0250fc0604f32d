package com.novelforge.service.context;

import com.novelforge.common.exception.ValidationException;
import com.novelforge.config.MemoryProperties;
import com.novelforge.model.AssembledContext;
import com.novelforge.model.ContextSegment;
import com.novelforge.model.GenerationRequest;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.MemoryFilter;
import com.novelforge.model.ScoredMemory;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.service.memory.LongTermMemoryStore;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 上下文组装器
 *
 * 预算不足时的保留优先级：必须保留的设定 > 检索记忆 > 大纲 > 滑动窗口尾部；
 * 片段整段纳入或整段丢弃，输出顺序固定为 设定、记忆、大纲、近期原文
 */
@Service
public class ContextAssembler {

    private static final Logger logger = LoggerFactory.getLogger(ContextAssembler.class);

    static final String SECTION_SEPARATOR = "\n\n";
    static final String SEGMENT_SEPARATOR = "\n";

    private static final Map<ContextSegment.Source, String> HEADERS = new EnumMap<>(ContextSegment.Source.class);

    static {
        HEADERS.put(ContextSegment.Source.PINNED, "【必须遵守的设定】\n");
        HEADERS.put(ContextSegment.Source.RETRIEVED, "【相关记忆】\n");
        HEADERS.put(ContextSegment.Source.OUTLINE, "【本章大纲】\n");
        HEADERS.put(ContextSegment.Source.RECENT, "【前文】\n");
    }

    private static final int FOCUS_DEPTH = 1;

    private final LongTermMemoryStore memoryStore;
    private final KnowledgeGraphService graphService;
    private final MemoryProperties properties;

    public ContextAssembler(LongTermMemoryStore memoryStore,
                            KnowledgeGraphService graphService,
                            MemoryProperties properties) {
        this.memoryStore = memoryStore;
        this.graphService = graphService;
        this.properties = properties;
    }

    /**
     * 语义检索，排序完全由记忆库决定（相似度优先，并列时新者优先）
     */
    public List<ScoredMemory> retrieveRelevant(String query, String projectId, int topK, MemoryFilter filters) {
        return memoryStore.query(projectId, query, filters, topK);
    }

    public AssembledContext buildContext(List<String> recentSegments, List<ScoredMemory> retrieved,
                                         String outline, int tokenBudget) {
        return buildContext(Collections.<String>emptyList(), null, recentSegments, retrieved, outline, tokenBudget);
    }

    /**
     * 组装有界上下文
     *
     * @param pinned         必须保留的设定/图谱事实，按给定顺序
     * @param rollingSummary 滚动摘要，作为检索记忆的第一段
     * @param recentSegments 近期原文，按时间正序；预算不足时保留最新的连续尾部
     */
    public AssembledContext buildContext(List<String> pinned, String rollingSummary, List<String> recentSegments,
                                         List<ScoredMemory> retrieved, String outline, int tokenBudget) {
        if (tokenBudget < 1) {
            throw new ValidationException("tokenBudget必须大于0");
        }
        Budget budget = new Budget(tokenBudget);

        List<String> pinnedKept = new ArrayList<>();
        for (String text : nonBlank(pinned)) {
            budget.offer(ContextSegment.Source.PINNED, text, pinnedKept);
        }

        List<String> retrievedKept = new ArrayList<>();
        if (StringUtils.isNotBlank(rollingSummary)) {
            budget.offer(ContextSegment.Source.RETRIEVED, "[前情摘要] " + rollingSummary.trim(), retrievedKept);
        }
        for (ScoredMemory memory : retrieved != null ? retrieved : Collections.<ScoredMemory>emptyList()) {
            String text = "[" + memory.getEntry().getKind().getValue() + "] " + memory.getEntry().getContent();
            budget.offer(ContextSegment.Source.RETRIEVED, text, retrievedKept);
        }

        // 大纲按段落切分，保留从头开始的连续段落
        List<String> paragraphs = splitParagraphs(outline);
        List<String> outlineKept = new ArrayList<>();
        for (String paragraph : paragraphs) {
            if (!budget.offer(ContextSegment.Source.OUTLINE, paragraph, outlineKept)) {
                budget.dropRemaining(paragraphs.size() - outlineKept.size() - 1);
                break;
            }
        }

        // 近期原文从最新往前取，遇到放不下的片段即停止，保证尾部连续
        List<String> recent = nonBlank(recentSegments);
        List<String> recentReversed = new ArrayList<>();
        for (int i = recent.size() - 1; i >= 0; i--) {
            if (!budget.offer(ContextSegment.Source.RECENT, recent.get(i), recentReversed)) {
                budget.dropRemaining(i);
                break;
            }
        }
        List<String> recentKept = new ArrayList<>(recentReversed);
        Collections.reverse(recentKept);

        List<ContextSegment> included = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        appendSection(text, included, ContextSegment.Source.PINNED, pinnedKept);
        appendSection(text, included, ContextSegment.Source.RETRIEVED, retrievedKept);
        appendSection(text, included, ContextSegment.Source.OUTLINE, outlineKept);
        appendSection(text, included, ContextSegment.Source.RECENT, recentKept);

        String assembled = text.toString();
        int tokens = TokenEstimator.estimate(assembled);
        if (budget.dropped > 0) {
            logger.debug("上下文超出预算，丢弃片段: budget={}, used={}, dropped={}", tokenBudget, tokens, budget.dropped);
        }
        return new AssembledContext(assembled, tokens, tokenBudget, included, budget.dropped);
    }

    /**
     * 为生成请求组装上下文：必须保留的设定 + 焦点实体的图谱事实 + 检索记忆 + 大纲 + 近期原文
     *
     * 图谱事实取自请求开始时的读视图
     */
    public AssembledContext assemble(GenerationRequest request, ProjectContext projectContext, GraphSnapshot view) {
        List<String> pinned = new ArrayList<>(nonBlank(request.getPinnedFacts()));
        if (request.getFocusKeys() != null && !request.getFocusKeys().isEmpty()) {
            pinned.addAll(GraphFactFormatter.format(
                graphService.querySubgraph(view, request.getFocusKeys(), FOCUS_DEPTH)));
        }
        int topK = request.getTopK() != null ? request.getTopK() : properties.getDefaultTopK();
        int budget = request.getTokenBudget() != null ? request.getTokenBudget() : properties.getDefaultTokenBudget();

        List<ScoredMemory> retrieved = retrieveRelevant(request.resolveQuery(), request.getProjectId(), topK,
            MemoryFilter.none());
        return buildContext(pinned, projectContext.getRollingSummary(), projectContext.recentSegments(),
            retrieved, request.getOutline(), budget);
    }

    private void appendSection(StringBuilder text, List<ContextSegment> included,
                               ContextSegment.Source source, List<String> segments) {
        if (segments.isEmpty()) {
            return;
        }
        if (text.length() > 0) {
            text.append(SECTION_SEPARATOR);
        }
        text.append(HEADERS.get(source));
        for (int i = 0; i < segments.size(); i++) {
            if (i > 0) {
                text.append(SEGMENT_SEPARATOR);
            }
            text.append(segments.get(i));
            included.add(new ContextSegment(source, segments.get(i)));
        }
    }

    static List<String> splitParagraphs(String outline) {
        List<String> paragraphs = new ArrayList<>();
        if (StringUtils.isBlank(outline)) {
            return paragraphs;
        }
        for (String paragraph : outline.trim().split("\\n\\s*\\n")) {
            if (StringUtils.isNotBlank(paragraph)) {
                paragraphs.add(paragraph.trim());
            }
        }
        return paragraphs;
    }

    private static List<String> nonBlank(List<String> segments) {
        List<String> result = new ArrayList<>();
        if (segments != null) {
            for (String segment : segments) {
                if (StringUtils.isNotBlank(segment)) {
                    result.add(segment);
                }
            }
        }
        return result;
    }

    /**
     * 预算记账：字符计数可累加，拼接结果的 token 数与各部分计数之和一致
     */
    private static final class Budget {

        private final int limit;
        private final EnumMap<ContextSegment.Source, Boolean> opened = new EnumMap<>(ContextSegment.Source.class);
        private TokenEstimator.Count used = TokenEstimator.Count.ZERO;
        private int dropped;

        Budget(int limit) {
            this.limit = limit;
        }

        /**
         * 放得下则记账并加入 kept，否则计为丢弃
         */
        boolean offer(ContextSegment.Source source, String segment, List<String> kept) {
            TokenEstimator.Count cost = TokenEstimator.count(segment);
            boolean sectionOpen = opened.containsKey(source);
            if (sectionOpen) {
                cost = cost.plus(TokenEstimator.count(SEGMENT_SEPARATOR));
            } else {
                cost = cost.plus(TokenEstimator.count(HEADERS.get(source)));
                if (!opened.isEmpty()) {
                    cost = cost.plus(TokenEstimator.count(SECTION_SEPARATOR));
                }
            }
            TokenEstimator.Count next = used.plus(cost);
            if (next.tokens() > limit) {
                dropped++;
                return false;
            }
            used = next;
            opened.put(source, Boolean.TRUE);
            kept.add(segment);
            return true;
        }

        void dropRemaining(int count) {
            dropped += Math.max(0, count);
        }
    }
}
