package com.novelforge.service.support;

import com.novelforge.common.exception.GenerationTimeoutException;
import com.novelforge.common.exception.NovelMemoryException;
import com.novelforge.common.exception.RequestCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * 外部模型调用：单次调用限时，瞬时失败退避重试，支持取消
 *
 * 超时直接失败，不参与重试；线程池饱和按瞬时失败处理
 */
@Component
public class ProviderCallRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProviderCallRunner.class);

    private final AsyncTaskExecutor executor;
    private final TransientRetryExecutor retryExecutor;

    public ProviderCallRunner(@Qualifier("providerCallExecutor") AsyncTaskExecutor executor,
                              TransientRetryExecutor retryExecutor) {
        this.executor = executor;
        this.retryExecutor = retryExecutor;
    }

    public <T> T call(String operation, long timeoutMs, CancellationToken token, Supplier<T> call) {
        return retryExecutor.callProvider(() -> callOnce(operation, timeoutMs, token, call));
    }

    private <T> T callOnce(String operation, long timeoutMs, CancellationToken token, Supplier<T> call) {
        token.throwIfCancelled();
        Callable<T> task = call::get;
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (TaskRejectedException e) {
            logger.warn("🚦 {} 调用线程池已满，稍后重试", operation);
            throw e;
        }
        token.attach(future);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            logger.error("⏰ {} 超时: timeout={}ms", operation, timeoutMs);
            throw new GenerationTimeoutException(operation, timeoutMs);
        } catch (CancellationException e) {
            throw new RequestCancelledException(token.getRequestId());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new RequestCancelledException(token.getRequestId());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new NovelMemoryException(operation + " 失败: " + cause.getMessage(), "PROVIDER_ERROR", cause);
        } finally {
            token.detach(future);
        }
    }
}
