package com.novelforge.config;

import com.novelforge.common.exception.StorageException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

/**
 * Resilience4j 重试配置
 *
 * 只对瞬时故障做指数退避重试；超时、校验失败、引用错误等直接向上抛出
 */
@Configuration
public class ResilienceConfig {

    public static final String PROVIDER_RETRY = "provider";
    public static final String STORAGE_RETRY = "storage";

    @Bean
    public RetryRegistry retryRegistry(MemoryProperties properties) {
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(Math.max(1, properties.getMaxTransientAttempts()))
            // 200ms → 400ms → 800ms
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                Math.max(1, properties.getBackoffInitialMs()), properties.getBackoffMultiplier()))
            .retryOnException(ResilienceConfig::isTransient)
            .build();

        RetryRegistry registry = RetryRegistry.of(config);
        registry.retry(PROVIDER_RETRY);
        registry.retry(STORAGE_RETRY);
        return registry;
    }

    public static boolean isTransient(Throwable e) {
        if (e instanceof StorageException) {
            return ((StorageException) e).isTransientFailure();
        }
        return e instanceof ResourceAccessException
            || e instanceof HttpServerErrorException
            || e instanceof HttpClientErrorException.TooManyRequests
            || e instanceof TransientDataAccessException
            || e instanceof TaskRejectedException;
    }
}
