package com.dailyfit.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 每日日志提交DTO
 */
@Data
public class DailyLogDTO {

    /**
     * 用户ID，字符串形式，服务端校验格式
     */
    @NotBlank(message = "userId is required")
    private String userId;

    @NotNull(message = "calories is required")
    private Integer calories;

    @NotNull(message = "activityLevel is required")
    private Integer activityLevel;

    /**
     * 记录时间 - 可选，默认提交时间
     */
    private LocalDateTime loggedAt;
}
