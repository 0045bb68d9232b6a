package com.dailyfit.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

@Data
public class Recommendation {
    private Long id;
    private Long userId;
    private String task;
    private LocalDateTime dueDate;
    private Boolean done = Boolean.FALSE;
}
