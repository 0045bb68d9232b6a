package com.dailyfit.model.dto.ai;

import com.dailyfit.model.entity.DailyLog;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 用户只读快照，由存储层一次性构建，流水线内不再做字段查找
 */
@Value
@Builder
public class UserSnapshot {

    Long id;

    double weight;

    double height;

    int age;

    String geography;

    /**
     * 按插入顺序排列，不保证按时间排序
     */
    List<DailyLog> dailyLogs;
}
