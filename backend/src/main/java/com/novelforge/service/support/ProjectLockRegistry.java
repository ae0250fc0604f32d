package com.novelforge.service.support;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 项目级写锁：同一项目的写入（提交、回滚、记忆追加）串行执行，读操作不加锁
 */
@Component
public class ProjectLockRegistry {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withWriteLock(String projectId, Supplier<T> work) {
        ReentrantLock lock = locks.computeIfAbsent(projectId, k -> new ReentrantLock(true));
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }
}
