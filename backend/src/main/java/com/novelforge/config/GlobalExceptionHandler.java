package com.novelforge.config;

import com.novelforge.common.Result;
import com.novelforge.common.exception.ConsistencyBlockingException;
import com.novelforge.common.exception.EmbeddingException;
import com.novelforge.common.exception.GenerationTimeoutException;
import com.novelforge.common.exception.MissingNodeException;
import com.novelforge.common.exception.NotFoundException;
import com.novelforge.common.exception.NovelMemoryException;
import com.novelforge.common.exception.ProjectCorruptedException;
import com.novelforge.common.exception.ReferenceException;
import com.novelforge.common.exception.RequestCancelledException;
import com.novelforge.common.exception.StorageException;
import com.novelforge.common.exception.ValidationException;
import com.novelforge.model.ConsistencyFinding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 全局异常处理器
 * 按错误类别映射 HTTP 状态码，统一返回 Result 结构
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<Result<Void>> handleValidation(ValidationException e) {
        logger.warn("请求校验失败: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Result<Void>> handleArgumentNotValid(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
            .map(FieldError::getDefaultMessage)
            .collect(Collectors.joining("; "));
        logger.warn("参数校验失败: {}", message);
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", message, null);
    }

    /**
     * 处理参数缺失异常
     */
    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Result<Void>> handleMissingParameter(MissingServletRequestParameterException e) {
        logger.warn("参数缺失: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "缺少必要参数: " + e.getParameterName(), null);
    }

    /**
     * 处理参数类型错误异常
     */
    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Result<Void>> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        logger.warn("参数类型错误: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "参数 " + e.getName() + " 类型不正确", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Result<Void>> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("请求体无法解析: {}", e.getMessage());
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "请求体格式错误", null);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Result<Void>> handleNotFound(NotFoundException e) {
        logger.warn("资源不存在: {}", e.getMessage());
        return build(HttpStatus.NOT_FOUND, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(MissingNodeException.class)
    public ResponseEntity<Result<Void>> handleMissingNode(MissingNodeException e) {
        logger.warn("节点不存在: {}", e.getNodeRef());
        return build(HttpStatus.NOT_FOUND, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(ReferenceException.class)
    public ResponseEntity<Result<Void>> handleReference(ReferenceException e) {
        logger.warn("悬空引用: {}", e.getMessage());
        return build(HttpStatus.UNPROCESSABLE_ENTITY, e.getCode(), e.getMessage(), null);
    }

    /**
     * 阻断性一致性冲突：发现列表随响应返回
     */
    @ExceptionHandler(ConsistencyBlockingException.class)
    public ResponseEntity<Result<List<ConsistencyFinding>>> handleConsistency(ConsistencyBlockingException e) {
        logger.warn("⛔ 一致性阻断: requestId={}, findings={}", e.getRequestId(), e.getFindings().size());
        return build(HttpStatus.CONFLICT, e.getCode(), e.getMessage(), e.getFindings());
    }

    @ExceptionHandler(RequestCancelledException.class)
    public ResponseEntity<Result<Void>> handleCancelled(RequestCancelledException e) {
        logger.info("请求已取消: {}", e.getMessage());
        return build(HttpStatus.CONFLICT, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(EmbeddingException.class)
    public ResponseEntity<Result<Void>> handleEmbedding(EmbeddingException e) {
        logger.error("向量化失败: {}", e.getMessage(), e);
        return build(HttpStatus.BAD_GATEWAY, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Result<Void>> handleStorage(StorageException e) {
        logger.error("存储异常: {}", e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, e.getCode(), "数据操作失败，请稍后重试", null);
    }

    @ExceptionHandler(GenerationTimeoutException.class)
    public ResponseEntity<Result<Void>> handleTimeout(GenerationTimeoutException e) {
        logger.error("⏰ 调用超时: {}", e.getMessage());
        return build(HttpStatus.GATEWAY_TIMEOUT, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(ProjectCorruptedException.class)
    public ResponseEntity<Result<Void>> handleCorrupted(ProjectCorruptedException e) {
        logger.error("❌ 项目存储损坏: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(NovelMemoryException.class)
    public ResponseEntity<Result<Void>> handleMemory(NovelMemoryException e) {
        logger.error("业务异常: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, e.getCode(), e.getMessage(), null);
    }

    /**
     * 处理数据库操作异常
     */
    @ExceptionHandler(org.springframework.dao.DataAccessException.class)
    public ResponseEntity<Result<Void>> handleDataAccessException(Exception e) {
        logger.error("数据库操作异常: {}", e.getMessage(), e);
        return build(HttpStatus.SERVICE_UNAVAILABLE, "STORAGE_ERROR", "数据操作失败，请稍后重试", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Result<Void>> handleGeneralException(Exception e) {
        logger.error("系统异常: {}", e.getMessage(), e);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "系统内部错误，请联系管理员", null);
    }

    private <T> ResponseEntity<Result<T>> build(HttpStatus status, String errorCode, String message, T data) {
        return ResponseEntity.status(status).body(Result.error(status.value(), errorCode, message, data));
    }
}
