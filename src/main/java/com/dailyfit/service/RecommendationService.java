package com.dailyfit.service;

import com.dailyfit.model.entity.DailyLog;
import com.dailyfit.model.entity.Recommendation;
import com.dailyfit.model.vo.RecommendationVO;

import java.util.List;

/**
 * 次日推荐服务
 */
public interface RecommendationService {

    /**
     * 推荐生成流水线：查询用户 -> 趋势统计 -> 组装 Prompt 并调用模型 -> 解析
     * 只生成不持久化，持久化由调用方负责
     *
     * @param userId  用户ID
     * @param todayLog 本次提交的日志（尚未入库）
     * @return 待保存的推荐列表
     */
    List<Recommendation> generateRecommendations(Long userId, DailyLog todayLog);

    /**
     * 查询用户全部推荐（优先从 Redis 缓存读取）
     * @param userId 用户ID
     */
    List<RecommendationVO> listRecommendations(Long userId);

    /**
     * 新推荐提交后使缓存失效（自增版本号，列表缓存按版本分 key）
     */
    void evictCache(Long userId);
}
