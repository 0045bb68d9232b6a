package com.dailyfit.common.exception;

import lombok.Getter;

/**
 * 用户不存在
 */
@Getter
public class UserNotFoundException extends RuntimeException {

    private final Long userId;

    public UserNotFoundException(Long userId) {
        super("User not found");
        this.userId = userId;
    }
}
