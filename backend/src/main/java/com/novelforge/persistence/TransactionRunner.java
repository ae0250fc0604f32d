package com.novelforge.persistence;

import java.util.function.Supplier;

/**
 * 单项目事务：work 中的全部写入要么全部生效，要么全部丢弃
 */
public interface TransactionRunner {

    <T> T inTransaction(String projectId, Supplier<T> work);

    default void inTransaction(String projectId, Runnable work) {
        inTransaction(projectId, () -> {
            work.run();
            return null;
        });
    }
}
