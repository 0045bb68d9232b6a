package com.dailyfit.common.exception;

import lombok.Getter;

/**
 * 模型回复不符合 "|" 分隔协议
 */
@Getter
public class ParseAmbiguityException extends RuntimeException {

    private final String rawText;

    public ParseAmbiguityException(String message, String rawText) {
        super(message);
        this.rawText = rawText;
    }
}
