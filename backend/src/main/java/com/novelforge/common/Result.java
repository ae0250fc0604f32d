package com.novelforge.common;

/**
 * 统一响应结果类
 * @param <T> 响应数据类型
 */
public class Result<T> {
    private int code;
    private String message;
    private String errorCode;
    private T data;

    private Result(int code, String message, String errorCode, T data) {
        this.code = code;
        this.message = message;
        this.errorCode = errorCode;
        this.data = data;
    }

    /**
     * 成功响应
     */
    public static <T> Result<T> success(T data) {
        return new Result<>(200, "success", null, data);
    }

    /**
     * 成功响应（无数据）
     */
    public static <T> Result<T> success() {
        return new Result<>(200, "success", null, null);
    }

    /**
     * 错误响应（携带业务错误码和附加数据，例如一致性发现列表）
     */
    public static <T> Result<T> error(int code, String errorCode, String message, T data) {
        return new Result<>(code, message, errorCode, data);
    }

    // Getters and Setters
    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public T getData() {
        return data;
    }

    public void setData(T data) {
        this.data = data;
    }
}
