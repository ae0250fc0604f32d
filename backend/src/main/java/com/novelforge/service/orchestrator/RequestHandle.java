package com.novelforge.service.orchestrator;

import com.novelforge.model.ConsistencyFinding;
import com.novelforge.model.GenerationRequest;
import com.novelforge.model.GenerationResult;
import com.novelforge.model.RequestState;
import com.novelforge.service.support.CancellationToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * 单个生成请求的运行时句柄：状态机 + 取消标记 + 完成信号
 */
public class RequestHandle {

    private static final Logger logger = LoggerFactory.getLogger(RequestHandle.class);

    private final String requestId;
    private final GenerationRequest request;
    private final CancellationToken token;
    private final CompletableFuture<GenerationResult> completion = new CompletableFuture<>();

    private GenerationResult current;

    RequestHandle(String requestId, GenerationRequest request) {
        this.requestId = requestId;
        this.request = request;
        this.token = new CancellationToken(requestId);
        this.current = GenerationResult.builder()
            .requestId(requestId)
            .projectId(request.getProjectId())
            .state(RequestState.PENDING)
            .findings(new ArrayList<>())
            .updatedAt(LocalDateTime.now())
            .build();
    }

    /**
     * 状态迁移，非法迁移直接抛错
     */
    synchronized void transition(RequestState to, Consumer<GenerationResult.GenerationResultBuilder> changes) {
        RequestState from = current.getState();
        if (!from.successors().contains(to)) {
            throw new IllegalStateException("非法状态迁移: " + from + " -> " + to + ", requestId=" + requestId);
        }
        GenerationResult.GenerationResultBuilder builder = current.toBuilder().state(to).updatedAt(LocalDateTime.now());
        if (changes != null) {
            changes.accept(builder);
        }
        current = builder.build();
        logger.info("🔄 请求状态: requestId={}, project={}, {} -> {}", requestId, request.getProjectId(), from, to);
    }

    synchronized void transition(RequestState to) {
        transition(to, null);
    }

    /**
     * 尚未进入终态时转入 FAILED
     */
    synchronized boolean failIfActive(String reason) {
        if (current.getState().isTerminal()) {
            return false;
        }
        transition(RequestState.FAILED, b -> b.failureReason(reason));
        return true;
    }

    public synchronized GenerationResult snapshot() {
        List<ConsistencyFinding> findings = current.getFindings() != null
            ? new ArrayList<>(current.getFindings()) : new ArrayList<>();
        return current.toBuilder().findings(findings).build();
    }

    public synchronized RequestState state() {
        return current.getState();
    }

    public String getRequestId() {
        return requestId;
    }

    public GenerationRequest getRequest() {
        return request;
    }

    public CancellationToken getToken() {
        return token;
    }

    public CompletableFuture<GenerationResult> getCompletion() {
        return completion;
    }
}
