package com.dailyfit.model.vo;

import lombok.Data;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 用户档案视图对象
 */
@Data
public class UserProfileVO {

    private String id;
    private Double weight;
    private Double height;
    private Integer age;
    private String geography;

    private List<LogItem> dailyLogs;

    @Data
    public static class LogItem {
        private Integer calories;
        private Integer activityLevel;
        private LocalDateTime loggedAt;
    }
}
