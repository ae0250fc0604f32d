package com.novelforge.common.exception;

/**
 * 外部调用超时，按失败处理，绝不视为部分成功
 */
public class GenerationTimeoutException extends NovelMemoryException {

    private final long timeoutMs;

    public GenerationTimeoutException(String operation, long timeoutMs) {
        super(operation + " 调用超时(" + timeoutMs + "ms)", "GENERATION_TIMEOUT");
        this.timeoutMs = timeoutMs;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }
}
