package com.dailyfit.service;

import com.dailyfit.model.dto.DailyLogDTO;
import com.dailyfit.model.vo.RecommendationVO;

import java.util.List;

/**
 * 每日日志服务接口
 */
public interface DailyLogService {

    /**
     * 提交日志：生成次日推荐，并在同一事务内保存推荐与日志
     *
     * @param dto 日志数据
     * @return 本次生成的推荐
     */
    List<RecommendationVO> submitLog(DailyLogDTO dto);
}
