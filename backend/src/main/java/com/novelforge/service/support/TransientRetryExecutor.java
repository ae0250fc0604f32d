package com.novelforge.service.support;

import com.novelforge.config.ResilienceConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * 瞬时故障重试（指数退避，最多3次），独立于一致性重试计数
 */
@Component
public class TransientRetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(TransientRetryExecutor.class);

    private final Retry providerRetry;
    private final Retry storageRetry;

    public TransientRetryExecutor(RetryRegistry retryRegistry) {
        this.providerRetry = retryRegistry.retry(ResilienceConfig.PROVIDER_RETRY);
        this.storageRetry = retryRegistry.retry(ResilienceConfig.STORAGE_RETRY);
        providerRetry.getEventPublisher().onRetry(event ->
            logger.warn("🔄 模型调用瞬时失败，第{}次重试，等待{}ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : ""));
        storageRetry.getEventPublisher().onRetry(event ->
            logger.warn("🔄 存储瞬时失败，第{}次重试，等待{}ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : ""));
    }

    public <T> T callProvider(Supplier<T> call) {
        return Retry.decorateSupplier(providerRetry, call).get();
    }

    public <T> T callStorage(Supplier<T> call) {
        return Retry.decorateSupplier(storageRetry, call).get();
    }
}
