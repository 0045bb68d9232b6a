package com.dailyfit.config;

import com.dailyfit.common.Result;
import com.dailyfit.common.exception.GenerationFailedException;
import com.dailyfit.common.exception.ParseAmbiguityException;
import com.dailyfit.common.exception.UserNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 处理参数异常（返回400）
     */
    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Object> handleIllegalArgumentException(IllegalArgumentException e) {
        log.warn("参数错误: {}", e.getMessage());
        return Result.error(400, e.getMessage());
    }

    /**
     * 处理请求体校验失败（返回400）
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Object> handleValidationException(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("请求参数校验失败: {}", message);
        return Result.error(400, message);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<Object> handleNotReadable(HttpMessageNotReadableException e) {
        log.warn("请求体无法解析: {}", e.getMessage());
        return Result.error(400, "Malformed request body");
    }

    /**
     * 用户不存在（返回404）
     */
    @ExceptionHandler(UserNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Result<Object> handleUserNotFound(UserNotFoundException e) {
        log.warn("用户不存在: userId={}", e.getUserId());
        return Result.error(404, e.getMessage());
    }

    /**
     * 模型调用失败（返回502）
     */
    @ExceptionHandler(GenerationFailedException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Result<Object> handleGenerationFailed(GenerationFailedException e) {
        log.error("推荐生成失败", e);
        return Result.error(502, "Recommendation generation failed");
    }

    /**
     * 模型回复格式不符（返回502）
     */
    @ExceptionHandler(ParseAmbiguityException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Result<Object> handleParseAmbiguity(ParseAmbiguityException e) {
        log.error("模型回复解析失败: {}, raw={}", e.getMessage(), e.getRawText());
        return Result.error(502, "Recommendation generation returned an unusable reply");
    }

    /**
     * 处理所有异常
     */
    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Result<Object> handleException(Exception e) {
        log.error("系统异常", e);
        return Result.error(500, "Internal server error, please retry later");
    }
}
