package com.novelforge.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * 线程池配置
 *
 * novelTaskExecutor 跑生成请求主流程；providerCallExecutor 跑带超时的外部模型调用，
 * 两者分开，主流程阻塞等待时不会占满调用线程
 */
@Configuration
public class AsyncConfig {

    private static final Logger logger = LoggerFactory.getLogger(AsyncConfig.class);

    @Value("${novel.executor.core-size:4}")
    private int coreSize;

    @Value("${novel.executor.max-size:16}")
    private int maxSize;

    @Value("${novel.executor.queue-capacity:200}")
    private int queueCapacity;

    @Bean(name = "novelTaskExecutor")
    public ThreadPoolTaskExecutor novelTaskExecutor() {
        logger.info("🧵 初始化生成任务线程池: core={}, max={}, queue={}", coreSize, maxSize, queueCapacity);
        return buildExecutor("novel-task-", coreSize, maxSize, queueCapacity,
            new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * 饱和时直接拒绝，任务不在调用线程执行；拒绝按瞬时失败重试
     */
    @Bean(name = "providerCallExecutor")
    public ThreadPoolTaskExecutor providerCallExecutor() {
        return buildExecutor("provider-call-", coreSize * 2, maxSize * 2, queueCapacity,
            new ThreadPoolExecutor.AbortPolicy());
    }

    private ThreadPoolTaskExecutor buildExecutor(String prefix, int core, int max, int queue,
                                                 RejectedExecutionHandler rejectionPolicy) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(rejectionPolicy);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
