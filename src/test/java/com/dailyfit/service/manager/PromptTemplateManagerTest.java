package com.dailyfit.service.manager;

import com.dailyfit.model.dto.ai.TrendSummary;
import com.dailyfit.model.dto.ai.UserSnapshot;
import com.dailyfit.model.entity.DailyLog;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptTemplateManagerTest {

    private final PromptTemplateManager manager = new PromptTemplateManager();

    private static UserSnapshot user() {
        return UserSnapshot.builder()
                .id(7L)
                .weight(72.5)
                .height(178.0)
                .age(31)
                .geography("Singapore")
                .dailyLogs(List.of())
                .build();
    }

    private static DailyLog today(int calories, int activity) {
        DailyLog l = new DailyLog();
        l.setCalories(calories);
        l.setActivityLevel(activity);
        return l;
    }

    @Test
    void prompt_should_contain_pipe_format_contract() {
        String prompt = manager.buildUserPrompt(user(), today(2100, 3), TrendSummary.EMPTY);

        assertThat(prompt).contains(PromptTemplateManager.FORMAT_CONTRACT);
        assertThat(prompt).contains("single pipe character (|)");
    }

    @Test
    void prompt_should_render_profile_today_and_trend_blocks() {
        String prompt = manager.buildUserPrompt(user(), today(2100, 3), new TrendSummary(1999.6, 2.46, 4));

        assertThat(prompt)
                .contains("- Age: 31")
                .contains("- Weight: 72.5")
                .contains("- Height: 178.0")
                .contains("- Location: Singapore")
                .contains("- Calories: 2100")
                .contains("- Activity Level: 3")
                .contains("Average Calories: 2000")
                .contains("Average Activity Level: 2.5");
    }

    @Test
    void empty_trend_should_render_zero_averages() {
        String prompt = manager.buildUserPrompt(user(), today(1800, 2), TrendSummary.EMPTY);

        assertThat(prompt).contains("Average Calories: 0\n");
        assertThat(prompt).contains("Average Activity Level: 0.0");
    }

    @Test
    void prompt_should_require_exercise_and_nutrition_tasks() {
        String prompt = manager.buildUserPrompt(user(), today(1800, 2), TrendSummary.EMPTY);

        assertThat(prompt)
                .contains("3-4 specific, actionable tasks")
                .contains("at least one exercise task")
                .contains("at least one nutrition task")
                .contains("within 24 hours");
    }

    @Test
    void same_input_should_produce_same_prompt() {
        TrendSummary trend = new TrendSummary(2200, 3.3, 7);

        assertThat(manager.buildUserPrompt(user(), today(2000, 3), trend))
                .isEqualTo(manager.buildUserPrompt(user(), today(2000, 3), trend));
    }

    @Test
    void system_prompt_should_describe_coach_persona() {
        assertThat(manager.buildSystemPrompt()).contains("fitness coach");
    }
}
