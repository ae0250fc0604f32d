package com.novelforge.service.support;

import com.novelforge.common.exception.RequestCancelledException;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 请求取消标记，持有当前进行中的外部调用以便中断
 */
public class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken("none");

    private final String requestId;
    private final AtomicReference<Future<?>> inFlight = new AtomicReference<>();
    private volatile boolean cancelled;

    public CancellationToken(String requestId) {
        this.requestId = requestId;
    }

    /**
     * 不可取消的调用（记忆写入、摘要等）
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (this == NONE) {
            return;
        }
        cancelled = true;
        Future<?> future = inFlight.get();
        if (future != null) {
            future.cancel(true);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new RequestCancelledException(requestId);
        }
    }

    void attach(Future<?> future) {
        if (this == NONE) {
            return;
        }
        inFlight.set(future);
        // attach 与 cancel 竞争时补一次取消
        if (cancelled) {
            future.cancel(true);
        }
    }

    void detach(Future<?> future) {
        if (this != NONE) {
            inFlight.compareAndSet(future, null);
        }
    }

    public String getRequestId() {
        return requestId;
    }
}
