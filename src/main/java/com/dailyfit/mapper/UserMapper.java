package com.dailyfit.mapper;

import com.dailyfit.model.entity.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * 用户Mapper接口
 */
@Mapper
public interface UserMapper {

    /**
     * 根据用户ID查询用户
     */
    User selectById(@Param("id") Long id);

    /**
     * 锁定用户行，用于事务内写入前校验，不存在返回 null
     */
    Long selectIdForUpdate(@Param("id") Long id);

    /**
     * 插入用户，回填主键
     */
    int insert(User user);
}
