package com.novelforge.service.orchestrator;

import com.novelforge.common.exception.ConsistencyBlockingException;
import com.novelforge.common.exception.NotFoundException;
import com.novelforge.common.exception.NovelMemoryException;
import com.novelforge.common.exception.RequestCancelledException;
import com.novelforge.common.exception.ValidationException;
import com.novelforge.common.util.CollectionUtils;
import com.novelforge.config.MemoryProperties;
import com.novelforge.domain.entity.MemoryEntry;
import com.novelforge.model.AssembledContext;
import com.novelforge.model.CheckResult;
import com.novelforge.model.ConsistencyFinding;
import com.novelforge.model.GenerationRequest;
import com.novelforge.model.GenerationResult;
import com.novelforge.model.GraphSnapshot;
import com.novelforge.model.MemoryKind;
import com.novelforge.model.RequestState;
import com.novelforge.model.StagedNodeUpsert;
import com.novelforge.model.fact.CandidateFact;
import com.novelforge.persistence.TransactionRunner;
import com.novelforge.provider.ExtractionProvider;
import com.novelforge.provider.GenerationProvider;
import com.novelforge.service.cache.RetrievalQueryCache;
import com.novelforge.service.consistency.ConsistencyChecker;
import com.novelforge.service.context.ContextAssembler;
import com.novelforge.service.context.ProjectContext;
import com.novelforge.service.context.ProjectContextRegistry;
import com.novelforge.service.graph.KnowledgeGraphService;
import com.novelforge.service.memory.LongTermMemoryStore;
import com.novelforge.service.memory.PreparedMemory;
import com.novelforge.service.support.CancellationToken;
import com.novelforge.service.support.ProjectLockRegistry;
import com.novelforge.service.support.ProviderCallRunner;
import com.novelforge.service.support.TransientRetryExecutor;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 生成编排器
 *
 * 每个请求独立运行：组装上下文 → 生成 → 抽取并校验 → 接受后原子提交；
 * 阻断性冲突最多重试 maxConsistencyRetries 次，仍冲突则 BLOCKED 并把发现返回给调用方。
 * 任何失败都不会留下部分写入
 */
@Service
public class GenerationOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private static final Duration FINISHED_RETENTION = Duration.ofHours(1);

    private final Map<String, RequestHandle> handles = new ConcurrentHashMap<>();

    private final ContextAssembler contextAssembler;
    private final ProjectContextRegistry contextRegistry;
    private final ConsistencyChecker consistencyChecker;
    private final KnowledgeGraphService graphService;
    private final LongTermMemoryStore memoryStore;
    private final GenerationProvider generationProvider;
    private final ExtractionProvider extractionProvider;
    private final ProviderCallRunner providerCallRunner;
    private final TransientRetryExecutor retryExecutor;
    private final ProjectLockRegistry lockRegistry;
    private final TransactionRunner transactionRunner;
    private final RetrievalQueryCache queryCache;
    private final AsyncTaskExecutor taskExecutor;
    private final MemoryProperties properties;

    public GenerationOrchestrator(ContextAssembler contextAssembler,
                                  ProjectContextRegistry contextRegistry,
                                  ConsistencyChecker consistencyChecker,
                                  KnowledgeGraphService graphService,
                                  LongTermMemoryStore memoryStore,
                                  GenerationProvider generationProvider,
                                  ExtractionProvider extractionProvider,
                                  ProviderCallRunner providerCallRunner,
                                  TransientRetryExecutor retryExecutor,
                                  ProjectLockRegistry lockRegistry,
                                  TransactionRunner transactionRunner,
                                  RetrievalQueryCache queryCache,
                                  @Qualifier("novelTaskExecutor") AsyncTaskExecutor taskExecutor,
                                  MemoryProperties properties) {
        this.contextAssembler = contextAssembler;
        this.contextRegistry = contextRegistry;
        this.consistencyChecker = consistencyChecker;
        this.graphService = graphService;
        this.memoryStore = memoryStore;
        this.generationProvider = generationProvider;
        this.extractionProvider = extractionProvider;
        this.providerCallRunner = providerCallRunner;
        this.retryExecutor = retryExecutor;
        this.lockRegistry = lockRegistry;
        this.transactionRunner = transactionRunner;
        this.queryCache = queryCache;
        this.taskExecutor = taskExecutor;
        this.properties = properties;
    }

    // ==================== 对外接口 ====================

    /**
     * 提交生成请求，立即返回请求ID
     */
    public String submit(GenerationRequest request) {
        validate(request);
        String requestId = UUID.randomUUID().toString();
        RequestHandle handle = new RequestHandle(requestId, request);
        handles.put(requestId, handle);
        logger.info("📝 收到生成请求: requestId={}, project={}, chapter={}, scene={}",
            requestId, request.getProjectId(), request.getChapterNumber(), request.getSceneNumber());
        taskExecutor.execute(() -> run(handle));
        return requestId;
    }

    public GenerationResult status(String requestId) {
        return handle(requestId).snapshot();
    }

    /**
     * 取消进行中的请求；已进入终态的请求返回 false
     */
    public boolean cancel(String requestId) {
        RequestHandle handle = handle(requestId);
        if (handle.state().isTerminal()) {
            return false;
        }
        handle.getToken().cancel();
        logger.info("🛑 请求取消: requestId={}, state={}", requestId, handle.state());
        return true;
    }

    /**
     * 等待请求结束；超时返回当前状态。BLOCKED/FAILED 以异常形式抛出
     */
    public GenerationResult await(String requestId, long timeoutMs) {
        RequestHandle handle = handle(requestId);
        try {
            return handle.getCompletion().get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return handle.snapshot();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return handle.snapshot();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new NovelMemoryException("生成请求失败: " + cause.getMessage(), "GENERATION_FAILED", cause);
        }
    }

    /**
     * 同步生成：提交并等待结束
     */
    public GenerationResult generate(GenerationRequest request) {
        String requestId = submit(request);
        return await(requestId, Long.MAX_VALUE);
    }

    // ==================== 主流程 ====================

    void run(RequestHandle handle) {
        GenerationRequest request = handle.getRequest();
        CancellationToken token = handle.getToken();
        String projectId = request.getProjectId();
        try {
            token.throwIfCancelled();
            GraphSnapshot view = graphService.readView(projectId);
            ProjectContext projectContext = contextRegistry.acquire(projectId);
            AssembledContext context = contextAssembler.assemble(request, projectContext, view);
            handle.transition(RequestState.CONTEXT_BUILT);
            logger.debug("上下文已组装: requestId={}, tokens={}/{}, dropped={}", handle.getRequestId(),
                context.getTokens(), context.getTokenBudget(), context.getDroppedSegments());

            List<ConsistencyFinding> previousBlocking = new ArrayList<>();
            int maxAttempts = properties.getMaxConsistencyRetries() + 1;
            for (int attempt = 1; attempt <= maxAttempts; attempt++) {
                String instruction = attempt == 1
                    ? request.getInstruction()
                    : correctiveInstruction(request.getInstruction(), previousBlocking);
                String text = providerCallRunner.call("正文生成", properties.getGenerationTimeoutMs(), token,
                    () -> generationProvider.generate(context.getText(), instruction));
                if (StringUtils.isBlank(text)) {
                    throw new NovelMemoryException("生成服务返回空文本", "GENERATION_EMPTY");
                }
                int attemptNo = attempt;
                handle.transition(RequestState.GENERATED, b -> b.text(text).attempts(attemptNo));

                List<CandidateFact> facts = providerCallRunner.call("事实抽取", properties.getExtractionTimeoutMs(),
                    token, () -> extractionProvider.extract(text, request.resolveSequence()));
                CheckResult check = consistencyChecker.check(handle.getRequestId() + "#" + attempt, facts, view);
                handle.transition(RequestState.CHECKED, b -> b.findings(new ArrayList<>(check.getFindings())));

                if (!check.hasBlocking()) {
                    handle.transition(RequestState.ACCEPTED);
                    commit(handle, text, check);
                    return;
                }
                previousBlocking = blockingOf(check.getFindings());
                if (attempt < maxAttempts) {
                    logger.warn("⚠️ 存在阻断性冲突，准备重试: requestId={}, attempt={}/{}, blocking={}",
                        handle.getRequestId(), attempt, maxAttempts, previousBlocking.size());
                    handle.transition(RequestState.RETRYING);
                } else {
                    handle.transition(RequestState.BLOCKED);
                    logger.warn("⛔ 重试次数已用尽，请求阻断: requestId={}, blocking={}",
                        handle.getRequestId(), previousBlocking.size());
                    handle.getCompletion().completeExceptionally(
                        new ConsistencyBlockingException(handle.getRequestId(), check.getFindings()));
                    return;
                }
            }
        } catch (RuntimeException e) {
            fail(handle, e);
        } catch (Error e) {
            fail(handle, e);
            throw e;
        }
    }

    /**
     * 原子提交：暂存的图谱变更 + 新记忆条目，同一项目写锁与事务内完成
     */
    private void commit(RequestHandle handle, String text, CheckResult check) {
        GenerationRequest request = handle.getRequest();
        String projectId = request.getProjectId();
        CancellationToken token = handle.getToken();

        PreparedMemory prepared = memoryStore.prepare(projectId,
            request.getMemoryKind() != null ? request.getMemoryKind() : MemoryKind.EVENT,
            text, commitMetadata(handle, check), null);

        // 事务整体失败时全部回滚，瞬时故障可整体重试
        CommitOutcome outcome = retryExecutor.callStorage(() -> lockRegistry.withWriteLock(projectId,
            () -> transactionRunner.inTransaction(projectId, () -> {
                token.throwIfCancelled();
                boolean changed = graphService.applyStagedChanges(projectId, handle.getRequestId(),
                    check.getStagedChanges());
                long version = changed ? graphService.bumpVersion(projectId) : graphService.graphVersion(projectId);
                MemoryEntry entry = memoryStore.insertPrepared(prepared);
                return new CommitOutcome(entry, version);
            })));
        queryCache.invalidateProject(projectId);

        handle.transition(RequestState.COMMITTED, b -> b
            .memoryEntryId(outcome.entry.getId())
            .graphVersion(outcome.graphVersion));
        logger.info("✅ 生成已提交: requestId={}, project={}, entry={}, graphVersion={}",
            handle.getRequestId(), projectId, outcome.entry.getId(), outcome.graphVersion);

        try {
            contextRegistry.appendSegment(projectId, text);
        } catch (RuntimeException e) {
            // 提交已完成，滑动窗口更新失败只影响后续上下文
            logger.error("❌ 更新滑动窗口失败: requestId={}, project={}", handle.getRequestId(), projectId, e);
        }
        handle.getCompletion().complete(handle.snapshot());
    }

    private Map<String, Object> commitMetadata(RequestHandle handle, CheckResult check) {
        GenerationRequest request = handle.getRequest();
        Map<String, Object> metadata = new LinkedHashMap<>();
        if (request.getMetadata() != null) {
            metadata.putAll(request.getMetadata());
        }
        metadata.put("requestId", handle.getRequestId());
        metadata.put("sequence", request.resolveSequence());
        if (request.getChapterNumber() != null) {
            metadata.put("chapter", request.getChapterNumber());
        }
        if (request.getSceneNumber() != null) {
            metadata.put("scene", request.getSceneNumber());
        }
        // 调用方给出的引用与本次暂存的节点合并
        Set<String> nodeRefs = new LinkedHashSet<>(
            CollectionUtils.toStringList(metadata.get(LongTermMemoryStore.META_NODE_REFS)));
        for (StagedNodeUpsert upsert : check.getStagedChanges().getNodeUpserts()) {
            nodeRefs.add(upsert.getRef().toString());
        }
        if (!nodeRefs.isEmpty()) {
            metadata.put(LongTermMemoryStore.META_NODE_REFS, new ArrayList<>(nodeRefs));
        }
        return metadata;
    }

    private void fail(RequestHandle handle, Throwable e) {
        String reason = e instanceof RequestCancelledException ? "请求已取消" : e.getMessage();
        if (e instanceof RequestCancelledException) {
            logger.info("🛑 请求已取消，未写入任何内容: requestId={}", handle.getRequestId());
        } else {
            logger.error("❌ 生成请求失败: requestId={}, project={}, state={}",
                handle.getRequestId(), handle.getRequest().getProjectId(), handle.state(), e);
        }
        handle.failIfActive(reason);
        handle.getCompletion().completeExceptionally(e);
    }

    static String correctiveInstruction(String instruction, List<ConsistencyFinding> blocking) {
        StringBuilder sb = new StringBuilder(instruction);
        sb.append("\n\n【上一稿与既有设定冲突，请在重写时修正以下问题】\n");
        for (ConsistencyFinding finding : blocking) {
            sb.append("- ").append(finding.getDescription()).append("\n");
        }
        return sb.toString().trim();
    }

    private List<ConsistencyFinding> blockingOf(List<ConsistencyFinding> findings) {
        List<ConsistencyFinding> blocking = new ArrayList<>();
        for (ConsistencyFinding finding : findings) {
            if (finding.isBlocking()) {
                blocking.add(finding);
            }
        }
        return blocking;
    }

    private void validate(GenerationRequest request) {
        if (request == null) {
            throw new ValidationException("生成请求不能为空");
        }
        if (StringUtils.isBlank(request.getProjectId())) {
            throw new ValidationException("projectId不能为空");
        }
        if (StringUtils.isBlank(request.getInstruction())) {
            throw new ValidationException("instruction不能为空");
        }
        if (request.getTokenBudget() != null && request.getTokenBudget() < 1) {
            throw new ValidationException("tokenBudget必须大于0");
        }
        if (request.getTopK() != null && request.getTopK() < 1) {
            throw new ValidationException("topK必须大于0");
        }
    }

    private RequestHandle handle(String requestId) {
        RequestHandle handle = handles.get(requestId);
        if (handle == null) {
            throw new NotFoundException("生成请求不存在: " + requestId);
        }
        return handle;
    }

    /**
     * 定时清理已结束较久的请求句柄
     */
    @Scheduled(fixedDelay = 10 * 60 * 1000)
    public void purgeFinished() {
        LocalDateTime cutoff = LocalDateTime.now().minus(FINISHED_RETENTION);
        int removed = 0;
        Iterator<Map.Entry<String, RequestHandle>> iterator = handles.entrySet().iterator();
        while (iterator.hasNext()) {
            GenerationResult result = iterator.next().getValue().snapshot();
            if (result.getState().isTerminal() && result.getUpdatedAt().isBefore(cutoff)) {
                iterator.remove();
                removed++;
            }
        }
        if (removed > 0) {
            logger.info("🧹 清理已结束的生成请求: {}", removed);
        }
    }

    private static final class CommitOutcome {
        private final MemoryEntry entry;
        private final long graphVersion;

        CommitOutcome(MemoryEntry entry, long graphVersion) {
            this.entry = entry;
            this.graphVersion = graphVersion;
        }
    }
}
