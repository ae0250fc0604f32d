package com.novelforge.common.exception;

/**
 * 调用方取消了进行中的生成请求
 */
public class RequestCancelledException extends NovelMemoryException {

    public RequestCancelledException(String requestId) {
        super("生成请求已取消: " + requestId, "REQUEST_CANCELLED");
    }
}
