package com.dailyfit.model.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

/**
 * 用户注册DTO
 */
@Data
public class OnboardingDTO {

    @NotNull(message = "weight is required")
    @Positive(message = "weight must be positive")
    private Double weight;

    @NotNull(message = "height is required")
    @Positive(message = "height must be positive")
    private Double height;

    @NotNull(message = "age is required")
    @Positive(message = "age must be positive")
    private Integer age;

    @NotBlank(message = "geography is required")
    private String geography;
}
