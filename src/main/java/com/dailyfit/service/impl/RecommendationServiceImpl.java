package com.dailyfit.service.impl;

import com.dailyfit.common.exception.GenerationFailedException;
import com.dailyfit.common.exception.UserNotFoundException;
import com.dailyfit.model.dto.ai.TrendSummary;
import com.dailyfit.model.dto.ai.UserSnapshot;
import com.dailyfit.model.entity.DailyLog;
import com.dailyfit.model.entity.Recommendation;
import com.dailyfit.model.vo.RecommendationVO;
import com.dailyfit.service.RecommendationService;
import com.dailyfit.service.analysis.TrendSummarizer;
import com.dailyfit.service.manager.PromptTemplateManager;
import com.dailyfit.service.parser.RecommendationParser;
import com.dailyfit.store.ActivityStore;
import com.dailyfit.util.OpenAiClient;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 次日推荐实现
 * 采用 查询 -> 趋势统计 -> Prompt 渲染与模型调用 -> 解析 的流水线
 */
@Slf4j
@Service
public class RecommendationServiceImpl implements RecommendationService {

    private static final String CACHE_KEY_PREFIX = "recommend:list:";

    /**
     * 每个用户一个版本号，提交后自增；列表缓存 key 带版本，旧版本的回写不会再被读到
     */
    private static final String CACHE_VERSION_PREFIX = "recommend:ver:";

    // 依赖组件
    private final ActivityStore activityStore;

    // AI 核心组件
    private final TrendSummarizer trendSummarizer;          // Step 2: 趋势统计
    private final PromptTemplateManager promptTemplateManager; // Step 3: 模板渲染
    private final OpenAiClient openAiClient;
    private final RecommendationParser recommendationParser;  // Step 4: 解析

    private final ObjectMapper objectMapper;
    private final StringRedisTemplate stringRedisTemplate;

    private final String model;
    private final double temperature;
    private final Duration cacheTtl;

    public RecommendationServiceImpl(ActivityStore activityStore,
                                     TrendSummarizer trendSummarizer,
                                     PromptTemplateManager promptTemplateManager,
                                     OpenAiClient openAiClient,
                                     RecommendationParser recommendationParser,
                                     ObjectMapper objectMapper,
                                     StringRedisTemplate stringRedisTemplate,
                                     @Value("${app.ai.openai.model:gpt-4o-mini}") String model,
                                     @Value("${app.ai.openai.temperature:0.7}") double temperature,
                                     @Value("${app.recommendation.cache-ttl-minutes:10}") long cacheTtlMinutes) {
        this.activityStore = activityStore;
        this.trendSummarizer = trendSummarizer;
        this.promptTemplateManager = promptTemplateManager;
        this.openAiClient = openAiClient;
        this.recommendationParser = recommendationParser;
        this.objectMapper = objectMapper;
        this.stringRedisTemplate = stringRedisTemplate;
        this.model = model;
        this.temperature = temperature;
        this.cacheTtl = Duration.ofMinutes(cacheTtlMinutes);
    }

    @Override
    public List<Recommendation> generateRecommendations(Long userId, DailyLog todayLog) {
        // Step 1: 查询用户快照
        UserSnapshot user = activityStore.findUser(userId)
                .orElseThrow(() -> new UserNotFoundException(userId));

        // Step 2: 趋势统计 (本次日志尚未入库，不参与统计)
        TrendSummary trend = trendSummarizer.summarize(user.getDailyLogs());

        // Step 3: 渲染 Prompt 并调用模型，失败不重试
        String systemPrompt = promptTemplateManager.buildSystemPrompt();
        String userPrompt = promptTemplateManager.buildUserPrompt(user, todayLog, trend);
        log.info("AI Prompt生成完毕，UserId={}, 样本数={}, 平均热量={}", userId, trend.getSampleSize(),
                Math.round(trend.getAverageCalories()));

        String rawResponse;
        try {
            rawResponse = openAiClient.chat(systemPrompt, userPrompt, model, temperature);
        } catch (GenerationFailedException e) {
            log.error("AI生成失败，UserId={}: {}", userId, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("AI调用出现未预期异常，UserId={}", userId, e);
            throw new GenerationFailedException("Generation failed: " + e.getMessage(), e);
        }

        // Step 4: 解析并挂上用户ID
        List<Recommendation> recommendations = recommendationParser.parse(rawResponse, userId);
        log.info("用户{}生成推荐{}条", userId, recommendations.size());
        return recommendations;
    }

    @Override
    public List<RecommendationVO> listRecommendations(Long userId) {
        // 版本号必须在查库之前读取
        String version = readVersion(userId);
        String cacheKey = version != null ? CACHE_KEY_PREFIX + userId + ":" + version : null;
        if (cacheKey != null) {
            List<RecommendationVO> cached = readCache(cacheKey);
            if (cached != null) {
                return cached;
            }
        }

        List<RecommendationVO> result = activityStore.findRecommendations(userId).stream()
                .map(RecommendationVO::from)
                .collect(Collectors.toList());
        if (cacheKey != null) {
            writeCache(cacheKey, result);
        }
        return result;
    }

    @Override
    public void evictCache(Long userId) {
        try {
            stringRedisTemplate.opsForValue().increment(CACHE_VERSION_PREFIX + userId);
        } catch (Exception e) {
            log.warn("推荐缓存版本自增失败，UserId={}", userId, e);
        }
    }

    // ================= 缓存辅助 =================

    /**
     * Redis 不可用时返回 null，本次请求不走缓存
     */
    private String readVersion(Long userId) {
        try {
            String version = stringRedisTemplate.opsForValue().get(CACHE_VERSION_PREFIX + userId);
            return StringUtils.defaultIfBlank(version, "0");
        } catch (Exception e) {
            log.warn("读取推荐缓存版本失败，回源数据库: UserId={}", userId, e);
            return null;
        }
    }

    private List<RecommendationVO> readCache(String cacheKey) {
        try {
            String json = stringRedisTemplate.opsForValue().get(cacheKey);
            if (StringUtils.isBlank(json)) {
                return null;
            }
            return objectMapper.readValue(json, new TypeReference<List<RecommendationVO>>() {
            });
        } catch (Exception e) {
            log.warn("读取推荐缓存失败，回源数据库: key={}", cacheKey, e);
            return null;
        }
    }

    private void writeCache(String cacheKey, List<RecommendationVO> value) {
        try {
            stringRedisTemplate.opsForValue().set(cacheKey, objectMapper.writeValueAsString(value), cacheTtl);
        } catch (Exception e) {
            log.warn("写入推荐缓存失败: key={}", cacheKey, e);
        }
    }
}
