package com.dailyfit.service;

import com.dailyfit.model.dto.OnboardingDTO;
import com.dailyfit.model.vo.UserProfileVO;

public interface UserService {

    /**
     * 注册新用户
     *
     * @return 新用户ID
     */
    Long onboard(OnboardingDTO dto);

    /**
     * 获取用户档案及日志
     */
    UserProfileVO getProfile(Long userId);
}
