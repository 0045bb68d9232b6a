package com.dailyfit.service.impl;

import com.dailyfit.common.exception.UserNotFoundException;
import com.dailyfit.model.dto.OnboardingDTO;
import com.dailyfit.model.dto.ai.UserSnapshot;
import com.dailyfit.model.entity.User;
import com.dailyfit.model.vo.UserProfileVO;
import com.dailyfit.service.UserService;
import com.dailyfit.store.ActivityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserServiceImpl implements UserService {

    private final ActivityStore activityStore;
    private final Clock clock;

    @Override
    public Long onboard(OnboardingDTO dto) {
        User user = new User();
        user.setWeight(dto.getWeight());
        user.setHeight(dto.getHeight());
        user.setAge(dto.getAge());
        user.setGeography(dto.getGeography().trim());
        user.setCreatedAt(LocalDateTime.now(clock));
        return activityStore.createUser(user).getId();
    }

    @Override
    public UserProfileVO getProfile(Long userId) {
        UserSnapshot snapshot = activityStore.findUser(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        UserProfileVO vo = new UserProfileVO();
        vo.setId(String.valueOf(snapshot.getId()));
        vo.setWeight(snapshot.getWeight());
        vo.setHeight(snapshot.getHeight());
        vo.setAge(snapshot.getAge());
        vo.setGeography(snapshot.getGeography());
        vo.setDailyLogs(snapshot.getDailyLogs().stream().map(l -> {
            UserProfileVO.LogItem item = new UserProfileVO.LogItem();
            item.setCalories(l.getCalories());
            item.setActivityLevel(l.getActivityLevel());
            item.setLoggedAt(l.getLoggedAt());
            return item;
        }).collect(Collectors.toList()));
        return vo;
    }
}
