package com.dailyfit.controller;

import com.dailyfit.common.Result;
import com.dailyfit.model.dto.OnboardingDTO;
import com.dailyfit.model.vo.OnboardingVO;
import com.dailyfit.model.vo.UserProfileVO;
import com.dailyfit.service.UserService;
import com.dailyfit.util.UserIdParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * 用户注册与档案
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;

    /**
     * 用户注册
     * POST /api/onboarding
     */
    @PostMapping("/onboarding")
    public Result<OnboardingVO> onboard(@RequestBody @Validated OnboardingDTO dto) {
        Long userId = userService.onboard(dto);
        return Result.success("User onboarded successfully", new OnboardingVO(String.valueOf(userId)));
    }

    /**
     * 获取用户档案
     * GET /api/profile/{userId}
     */
    @GetMapping("/profile/{userId}")
    public Result<UserProfileVO> getProfile(@PathVariable String userId) {
        return Result.success(userService.getProfile(UserIdParser.parse(userId)));
    }
}
