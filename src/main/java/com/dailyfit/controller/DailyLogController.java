package com.dailyfit.controller;

import com.dailyfit.common.Result;
import com.dailyfit.model.dto.DailyLogDTO;
import com.dailyfit.model.vo.RecommendationVO;
import com.dailyfit.service.DailyLogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * 每日日志控制器
 */
@Slf4j
@RestController
@RequestMapping("/api/log")
@RequiredArgsConstructor
public class DailyLogController {

    private final DailyLogService dailyLogService;

    /**
     * 提交今日日志，同步返回次日推荐
     * POST /api/log
     */
    @PostMapping
    public Result<List<RecommendationVO>> submitLog(@RequestBody @Validated DailyLogDTO dto) {
        List<RecommendationVO> recommendations = dailyLogService.submitLog(dto);
        return Result.success("Daily log submitted, " + recommendations.size() + " recommendations generated",
                recommendations);
    }
}
