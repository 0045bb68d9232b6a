package com.dailyfit.service.parser;

import com.dailyfit.common.exception.ParseAmbiguityException;
import com.dailyfit.model.entity.Recommendation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 推荐解析器
 * 将模型回复按 "|" 切分为独立任务，每条任务对应一个待持久化的 Recommendation
 */
@Slf4j
@Component
public class RecommendationParser {

    public static final String DELIMITER = "|";

    /**
     * 截止时间 = 调用时刻 + 24 小时（不是次日零点）
     */
    public static final Duration DUE_OFFSET = Duration.ofHours(24);

    private final Clock clock;
    private final boolean strictFormat;

    public RecommendationParser(Clock clock,
                                @Value("${app.recommendation.strict-format:false}") boolean strictFormat) {
        this.clock = clock;
        this.strictFormat = strictFormat;
    }

    public List<Recommendation> parse(String rawText, Long userId) {
        if (StringUtils.isBlank(rawText)) {
            throw new ParseAmbiguityException("Generation returned an empty reply", rawText);
        }

        if (!rawText.contains(DELIMITER)) {
            if (strictFormat) {
                throw new ParseAmbiguityException("Generation reply does not follow the pipe-delimited format", rawText);
            }
            log.warn("模型回复不含分隔符 '|'，整段作为单条任务: userId={}, length={}", userId, rawText.length());
        }

        LocalDateTime dueDate = LocalDateTime.now(clock).plus(DUE_OFFSET);
        List<Recommendation> result = new ArrayList<>();
        for (String segment : StringUtils.splitPreserveAllTokens(rawText, DELIMITER)) {
            String task = segment.trim();
            // 连续分隔符或首尾分隔符产生的空段直接丢弃
            if (task.isEmpty()) {
                continue;
            }
            Recommendation rec = new Recommendation();
            rec.setUserId(userId);
            rec.setTask(task);
            rec.setDueDate(dueDate);
            rec.setDone(Boolean.FALSE);
            result.add(rec);
        }

        if (result.isEmpty()) {
            throw new ParseAmbiguityException("Generation reply contains no tasks", rawText);
        }
        return result;
    }
}
