package com.dailyfit.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * 用户实体类
 */
@Data
public class User {
    /**
     * 主键
     */
    private Long id;

    /**
     * 体重
     */
    private Double weight;

    /**
     * 身高
     */
    private Double height;

    /**
     * 年龄
     */
    private Integer age;

    /**
     * 地区（自由文本）
     */
    private String geography;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;
}
