package com.dailyfit.common.exception;

/**
 * 生成模型调用失败，包装底层原因（网络、配额、响应格式）
 */
public class GenerationFailedException extends RuntimeException {

    public GenerationFailedException(String message) {
        super(message);
    }

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
