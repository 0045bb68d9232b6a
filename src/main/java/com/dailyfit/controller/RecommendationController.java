package com.dailyfit.controller;

import com.dailyfit.common.Result;
import com.dailyfit.model.vo.RecommendationListVO;
import com.dailyfit.service.RecommendationService;
import com.dailyfit.util.UserIdParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 推荐查询接口
 */
@RestController
@RequestMapping("/api/recommendations")
@Slf4j
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationService recommendationService;

    /**
     * 获取用户全部推荐
     */
    @GetMapping("/{userId}")
    public Result<RecommendationListVO> list(@PathVariable String userId) {
        Long id = UserIdParser.parse(userId);
        log.info("用户 {} 查询推荐列表", id);
        return Result.success(new RecommendationListVO(recommendationService.listRecommendations(id)));
    }
}
