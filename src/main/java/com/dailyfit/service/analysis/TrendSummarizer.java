package com.dailyfit.service.analysis;

import com.dailyfit.model.dto.ai.TrendSummary;
import com.dailyfit.model.entity.DailyLog;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 趋势统计器
 * 对最近 7 条日志求热量与活动水平的算术平均
 */
@Component
public class TrendSummarizer {

    /**
     * 统计窗口（条数）
     */
    public static final int WINDOW_SIZE = 7;

    /**
     * 存储顺序不保证时间顺序，先按记录时间升序（稳定排序，时间相同保持插入顺序），再取最后 7 条
     */
    public TrendSummary summarize(List<DailyLog> logs) {
        if (logs == null || logs.isEmpty()) {
            return TrendSummary.EMPTY;
        }

        List<DailyLog> sorted = new ArrayList<>(logs);
        sorted.sort(Comparator.comparing(DailyLog::getLoggedAt,
                Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder())));

        List<DailyLog> window = sorted.subList(Math.max(0, sorted.size() - WINDOW_SIZE), sorted.size());

        double avgCalories = window.stream()
                .mapToInt(l -> l.getCalories() != null ? l.getCalories() : 0)
                .average()
                .orElse(0.0);
        double avgActivity = window.stream()
                .mapToInt(l -> l.getActivityLevel() != null ? l.getActivityLevel() : 0)
                .average()
                .orElse(0.0);

        return new TrendSummary(avgCalories, avgActivity, window.size());
    }
}
