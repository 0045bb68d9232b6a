package com.dailyfit.util;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;

/**
 * 用户ID格式校验
 */
public final class UserIdParser {

    private UserIdParser() {
    }

    /**
     * 解析字符串形式的用户ID，必须为正整数
     *
     * @throws IllegalArgumentException 格式非法
     */
    public static Long parse(String raw) {
        String value = StringUtils.trimToEmpty(raw);
        // 超过 18 位可能溢出 long
        if (!NumberUtils.isDigits(value) || value.length() > 18) {
            throw new IllegalArgumentException("Invalid user ID");
        }
        long id = Long.parseLong(value);
        if (id <= 0) {
            throw new IllegalArgumentException("Invalid user ID");
        }
        return id;
    }
}
