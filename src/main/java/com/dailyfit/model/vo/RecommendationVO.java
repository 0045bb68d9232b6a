package com.dailyfit.model.vo;

import com.dailyfit.model.entity.Recommendation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationVO {

    private String task;

    /**
     * 截止时间，库里存的是 UTC，输出带偏移量
     */
    private OffsetDateTime dueDate;

    private Boolean done;

    public static RecommendationVO from(Recommendation rec) {
        OffsetDateTime due = rec.getDueDate() != null ? rec.getDueDate().atOffset(ZoneOffset.UTC) : null;
        return new RecommendationVO(rec.getTask(), due, Boolean.TRUE.equals(rec.getDone()));
    }
}
