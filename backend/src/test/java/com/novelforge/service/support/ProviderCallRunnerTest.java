package com.novelforge.service.support;

import com.novelforge.common.exception.GenerationTimeoutException;
import com.novelforge.common.exception.RequestCancelledException;
import com.novelforge.config.AsyncConfig;
import com.novelforge.config.MemoryProperties;
import com.novelforge.config.ResilienceConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderCallRunnerTest {

    private ThreadPoolTaskExecutor providerPool;
    private ProviderCallRunner runner;

    @BeforeEach
    void setUp() {
        AsyncConfig asyncConfig = new AsyncConfig();
        ReflectionTestUtils.setField(asyncConfig, "coreSize", 1);
        ReflectionTestUtils.setField(asyncConfig, "maxSize", 1);
        ReflectionTestUtils.setField(asyncConfig, "queueCapacity", 0);
        // 生产配置的线程数翻倍：core=2, max=2, 无队列
        providerPool = asyncConfig.providerCallExecutor();

        MemoryProperties properties = new MemoryProperties();
        properties.setBackoffInitialMs(1);
        TransientRetryExecutor retryExecutor =
            new TransientRetryExecutor(new ResilienceConfig().retryRegistry(properties));
        runner = new ProviderCallRunner(providerPool, retryExecutor);
    }

    @AfterEach
    void tearDown() {
        providerPool.shutdown();
    }

    @Test
    void slowCallTimesOutWithinTheDeadline() {
        long start = System.currentTimeMillis();

        assertThatThrownBy(() -> runner.call("生成", 100, CancellationToken.none(), () -> {
            sleepQuietly(2000);
            return "迟到的正文";
        })).isInstanceOf(GenerationTimeoutException.class);

        assertThat(System.currentTimeMillis() - start).isLessThan(1500);
    }

    @Test
    void saturatedPoolRejectsInsteadOfRunningOnTheCallerThread() throws Exception {
        CountDownLatch busy = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        for (int i = 0; i < 2; i++) {
            providerPool.submit(() -> {
                busy.countDown();
                release.await();
                return null;
            });
        }
        assertThat(busy.await(5, TimeUnit.SECONDS)).isTrue();

        AtomicInteger invocations = new AtomicInteger();
        long start = System.currentTimeMillis();
        try {
            assertThatThrownBy(() -> runner.call("生成", 100, CancellationToken.none(), () -> {
                invocations.incrementAndGet();
                sleepQuietly(2000);
                return "迟到的正文";
            })).isInstanceOf(TaskRejectedException.class);
        } finally {
            release.countDown();
        }

        assertThat(invocations.get()).isZero();
        assertThat(System.currentTimeMillis() - start).isLessThan(1500);
    }

    @Test
    void cancelledTokenStopsBeforeSubmitting() {
        CancellationToken token = new CancellationToken("req-1");
        token.cancel();
        AtomicInteger invocations = new AtomicInteger();

        assertThatThrownBy(() -> runner.call("生成", 1000, token, invocations::incrementAndGet))
            .isInstanceOf(RequestCancelledException.class);
        assertThat(invocations.get()).isZero();
    }

    @Test
    void rejectionIsTreatedAsTransient() {
        assertThat(ResilienceConfig.isTransient(new TaskRejectedException("满"))).isTrue();
    }

    private static void sleepQuietly(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
