package com.dailyfit.service.manager;

import com.dailyfit.model.dto.ai.TrendSummary;
import com.dailyfit.model.dto.ai.UserSnapshot;
import com.dailyfit.model.entity.DailyLog;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Prompt 模板管理器
 * 职责：管理 System/User Prompt 模板，将用户快照、今日日志与趋势统计渲染成最终字符串
 */
@Component
public class PromptTemplateManager {

    /**
     * 输出格式协议，RecommendationParser 依赖此约定按 "|" 切分
     */
    public static final String FORMAT_CONTRACT =
            "Format your response as tasks separated by a single pipe character (|) with no other text.";

    // ================= System Prompt (人设) =================

    private static final String SYSTEM_PROMPT_TEMPLATE = """
            You are an expert fitness coach, nutritionist, and wellness advisor.
            Your goal is to help users transform their lives through personalized fitness guidance,
            nutrition advice, and healthy lifestyle recommendations. You have extensive knowledge of:
            - Exercise physiology and workout programming
            - Nutrition and dietary planning
            - Behavior change psychology
            - Injury prevention and recovery
            - Wellness and stress management
            Always provide evidence-based, safe, and personalized recommendations.""";

    // ================= User Prompt =================

    private static final String USER_PROMPT_TEMPLATE = """
            Based on today's activity log, recent trends, and the user profile, create tomorrow's plan:

            User Profile:
            - Age: %d
            - Weight: %s
            - Height: %s
            - Location: %s

            Today's Activity:
            - Calories: %d
            - Activity Level: %d

            7-Day Trends:
            - Average Calories: %d
            - Average Activity Level: %.1f

            Provide 3-4 specific, actionable tasks for tomorrow.
            Requirements:
            - Include at least one exercise task
            - Include at least one nutrition task
            - Every task must be achievable within 24 hours
            - Keep each task to a single short sentence

            %s
            Example: Take a 30-minute brisk walk after lunch|Eat a salad with lean protein for dinner|Drink 8 glasses of water
            """;

    public String buildSystemPrompt() {
        return SYSTEM_PROMPT_TEMPLATE;
    }

    /**
     * 构建 User Prompt，输入相同则输出相同
     */
    public String buildUserPrompt(UserSnapshot user, DailyLog todayLog, TrendSummary trend) {
        return String.format(Locale.ROOT, USER_PROMPT_TEMPLATE,
                user.getAge(),
                user.getWeight(),
                user.getHeight(),
                user.getGeography(),
                valueOrZero(todayLog.getCalories()),
                valueOrZero(todayLog.getActivityLevel()),
                Math.round(trend.getAverageCalories()),
                trend.getAverageActivity(),
                FORMAT_CONTRACT);
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
