package com.novelforge.common.exception;

/**
 * 记忆服务异常基类
 *
 * 所有业务异常都携带稳定的错误码，供全局异常处理器映射响应
 */
public class NovelMemoryException extends RuntimeException {

    private final String code;

    public NovelMemoryException(String message, String code) {
        super(message);
        this.code = code;
    }

    public NovelMemoryException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
