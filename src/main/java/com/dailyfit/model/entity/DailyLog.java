package com.dailyfit.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 每日活动日志，只追加不修改
 */
@Data
public class DailyLog {
    /**
     * 主键，同一用户内按插入顺序递增
     */
    private Long id;

    private Long userId;

    /**
     * 摄入热量
     */
    private Integer calories;

    /**
     * 活动水平，含义由调用方定义
     */
    private Integer activityLevel;

    /**
     * 记录时间，未提供时取提交时间
     */
    private LocalDateTime loggedAt;
}
