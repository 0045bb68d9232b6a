package com.dailyfit.mapper;

import com.dailyfit.model.entity.DailyLog;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * 每日日志Mapper
 */
@Mapper
public interface DailyLogMapper {

    /**
     * 追加日志
     */
    int insert(DailyLog log);

    /**
     * 查询用户全部日志（按插入顺序）
     */
    List<DailyLog> selectByUserId(@Param("userId") Long userId);
}
