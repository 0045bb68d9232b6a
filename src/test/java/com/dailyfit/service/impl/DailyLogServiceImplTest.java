package com.dailyfit.service.impl;

import com.dailyfit.common.exception.GenerationFailedException;
import com.dailyfit.common.exception.UserNotFoundException;
import com.dailyfit.model.dto.DailyLogDTO;
import com.dailyfit.model.entity.DailyLog;
import com.dailyfit.model.entity.Recommendation;
import com.dailyfit.model.vo.RecommendationVO;
import com.dailyfit.service.RecommendationService;
import com.dailyfit.store.ActivityStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DailyLogServiceImplTest {

    @Mock
    RecommendationService recommendationService;

    @Mock
    ActivityStore activityStore;

    DailyLogServiceImpl service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T21:15:00Z"), ZoneOffset.UTC);
        service = new DailyLogServiceImpl(recommendationService, activityStore, clock);
    }

    private static DailyLogDTO dto(String userId) {
        DailyLogDTO dto = new DailyLogDTO();
        dto.setUserId(userId);
        dto.setCalories(1900);
        dto.setActivityLevel(2);
        return dto;
    }

    private static Recommendation rec(String task) {
        Recommendation r = new Recommendation();
        r.setUserId(12L);
        r.setTask(task);
        r.setDueDate(LocalDateTime.of(2026, 10, 20, 21, 15));
        return r;
    }

    @Test
    void submit_should_generate_then_persist_log_and_recommendations_together() {
        List<Recommendation> recs = List.of(rec("Walk 30 min"), rec("Add a portion of greens"));
        when(recommendationService.generateRecommendations(eq(12L), any(DailyLog.class))).thenReturn(recs);

        List<RecommendationVO> result = service.submitLog(dto("12"));

        ArgumentCaptor<DailyLog> logCaptor = ArgumentCaptor.forClass(DailyLog.class);
        verify(activityStore).saveSubmission(eq(12L), logCaptor.capture(), same(recs));
        DailyLog saved = logCaptor.getValue();
        assertThat(saved.getCalories()).isEqualTo(1900);
        assertThat(saved.getActivityLevel()).isEqualTo(2);
        // 未提供时间，取提交时间
        assertThat(saved.getLoggedAt()).isEqualTo(LocalDateTime.of(2026, 10, 19, 21, 15));

        verify(recommendationService).evictCache(12L);
        assertThat(result).extracting(RecommendationVO::getTask)
                .containsExactly("Walk 30 min", "Add a portion of greens");
    }

    @Test
    void supplied_timestamp_should_be_kept() {
        DailyLogDTO dto = dto("12");
        dto.setLoggedAt(LocalDateTime.of(2026, 10, 18, 7, 0));
        when(recommendationService.generateRecommendations(eq(12L), any(DailyLog.class)))
                .thenReturn(List.of(rec("A")));

        service.submitLog(dto);

        ArgumentCaptor<DailyLog> logCaptor = ArgumentCaptor.forClass(DailyLog.class);
        verify(activityStore).saveSubmission(eq(12L), logCaptor.capture(), anyList());
        assertThat(logCaptor.getValue().getLoggedAt()).isEqualTo(LocalDateTime.of(2026, 10, 18, 7, 0));
    }

    @Test
    void invalid_user_id_should_be_rejected_before_pipeline() {
        assertThatThrownBy(() -> service.submitLog(dto("abc")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid user ID");
        verifyNoInteractions(recommendationService, activityStore);
    }

    @Test
    void generation_failure_should_persist_nothing() {
        when(recommendationService.generateRecommendations(eq(12L), any(DailyLog.class)))
                .thenThrow(new GenerationFailedException("timeout"));

        assertThatThrownBy(() -> service.submitLog(dto("12"))).isInstanceOf(GenerationFailedException.class);

        verify(activityStore, never()).saveSubmission(any(), any(), any());
        verify(recommendationService, never()).evictCache(anyLong());
    }

    @Test
    void unknown_user_should_persist_nothing() {
        when(recommendationService.generateRecommendations(eq(99L), any(DailyLog.class)))
                .thenThrow(new UserNotFoundException(99L));

        assertThatThrownBy(() -> service.submitLog(dto("99"))).isInstanceOf(UserNotFoundException.class);

        verifyNoInteractions(activityStore);
    }
}
