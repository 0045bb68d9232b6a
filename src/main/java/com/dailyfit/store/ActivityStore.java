package com.dailyfit.store;

import com.dailyfit.common.exception.UserNotFoundException;
import com.dailyfit.mapper.DailyLogMapper;
import com.dailyfit.mapper.RecommendationMapper;
import com.dailyfit.mapper.UserMapper;
import com.dailyfit.model.dto.ai.UserSnapshot;
import com.dailyfit.model.entity.DailyLog;
import com.dailyfit.model.entity.Recommendation;
import com.dailyfit.model.entity.User;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * 活动数据存储
 * 职责：在 Mapper 之上组装用户快照，并把一次提交的两次写入放进同一事务
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActivityStore {

    static final String DEFAULT_GEOGRAPHY = "Unknown";

    private final UserMapper userMapper;
    private final DailyLogMapper dailyLogMapper;
    private final RecommendationMapper recommendationMapper;

    /**
     * 查询用户快照（含全部日志，按插入顺序）
     */
    public Optional<UserSnapshot> findUser(Long userId) {
        User user = userMapper.selectById(userId);
        if (user == null) {
            return Optional.empty();
        }
        List<DailyLog> logs = dailyLogMapper.selectByUserId(userId);
        return Optional.of(toSnapshot(user, logs));
    }

    public User createUser(User user) {
        userMapper.insert(user);
        log.info("新用户注册: userId={}", user.getId());
        return user;
    }

    /**
     * 保存一次日志提交：追加日志 + 插入推荐，同一事务
     * 用户在流水线期间被删除时不写入任何数据
     */
    @Transactional(rollbackFor = Exception.class)
    public void saveSubmission(Long userId, DailyLog dailyLog, List<Recommendation> recommendations) {
        if (userMapper.selectIdForUpdate(userId) == null) {
            throw new UserNotFoundException(userId);
        }
        dailyLog.setUserId(userId);
        dailyLogMapper.insert(dailyLog);
        for (Recommendation rec : recommendations) {
            rec.setUserId(userId);
            recommendationMapper.insert(rec);
        }
        log.info("用户{}提交已保存: 推荐{}条, 日志时间={}", userId, recommendations.size(), dailyLog.getLoggedAt());
    }

    public List<Recommendation> findRecommendations(Long userId) {
        return recommendationMapper.selectByUserId(userId);
    }

    private UserSnapshot toSnapshot(User user, List<DailyLog> logs) {
        return UserSnapshot.builder()
                .id(user.getId())
                .weight(user.getWeight() != null ? user.getWeight() : 0.0)
                .height(user.getHeight() != null ? user.getHeight() : 0.0)
                .age(user.getAge() != null ? user.getAge() : 0)
                .geography(StringUtils.defaultIfBlank(user.getGeography(), DEFAULT_GEOGRAPHY))
                .dailyLogs(logs != null ? List.copyOf(logs) : List.of())
                .build();
    }
}
