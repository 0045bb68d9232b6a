package com.dailyfit.mapper;

import com.dailyfit.model.entity.Recommendation;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface RecommendationMapper {
    /**
     * 插入推荐
     * @param rec
     */
    int insert(Recommendation rec);

    /**
     * 查询用户全部推荐（按截止时间、主键升序）
     * @param userId 用户ID
     * @return 推荐列表
     */
    List<Recommendation> selectByUserId(@Param("userId") Long userId);
}
