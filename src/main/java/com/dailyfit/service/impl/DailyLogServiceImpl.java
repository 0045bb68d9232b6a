package com.dailyfit.service.impl;

import com.dailyfit.model.dto.DailyLogDTO;
import com.dailyfit.model.entity.DailyLog;
import com.dailyfit.model.entity.Recommendation;
import com.dailyfit.model.vo.RecommendationVO;
import com.dailyfit.service.DailyLogService;
import com.dailyfit.service.RecommendationService;
import com.dailyfit.store.ActivityStore;
import com.dailyfit.util.UserIdParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 每日日志服务实现
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyLogServiceImpl implements DailyLogService {

    private final RecommendationService recommendationService;
    private final ActivityStore activityStore;
    private final Clock clock;

    @Override
    public List<RecommendationVO> submitLog(DailyLogDTO dto) {
        Long userId = UserIdParser.parse(dto.getUserId());

        // 记录时间默认提交时间
        DailyLog dailyLog = new DailyLog();
        dailyLog.setUserId(userId);
        dailyLog.setCalories(dto.getCalories());
        dailyLog.setActivityLevel(dto.getActivityLevel());
        dailyLog.setLoggedAt(dto.getLoggedAt() != null ? dto.getLoggedAt() : LocalDateTime.now(clock));

        // 流水线全部成功后才写库
        List<Recommendation> recommendations = recommendationService.generateRecommendations(userId, dailyLog);
        activityStore.saveSubmission(userId, dailyLog, recommendations);
        recommendationService.evictCache(userId);

        log.info("用户{}提交日志: 热量={}, 活动水平={}", userId, dailyLog.getCalories(), dailyLog.getActivityLevel());
        return recommendations.stream()
                .map(RecommendationVO::from)
                .collect(Collectors.toList());
    }
}
