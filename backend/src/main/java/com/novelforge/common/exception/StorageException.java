package com.novelforge.common.exception;

/**
 * 持久化层失败
 *
 * transientFailure=true 表示可以本地退避重试（连接抖动、锁等待超时等）
 */
public class StorageException extends NovelMemoryException {

    private final boolean transientFailure;

    public StorageException(String message, Throwable cause, boolean transientFailure) {
        super(message, "STORAGE_ERROR", cause);
        this.transientFailure = transientFailure;
    }

    public StorageException(String message, boolean transientFailure) {
        super(message, "STORAGE_ERROR");
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
