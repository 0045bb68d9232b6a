package com.dailyfit.model.dto.ai;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 近期日志的趋势统计
 */
@Data
@AllArgsConstructor
public class TrendSummary {

    public static final TrendSummary EMPTY = new TrendSummary(0.0, 0.0, 0);

    private final double averageCalories;

    private final double averageActivity;

    /**
     * 参与计算的日志条数
     */
    private final int sampleSize;
}
