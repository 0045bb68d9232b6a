package com.dailyfit.util;

import com.dailyfit.common.exception.ConfigurationException;
import com.dailyfit.common.exception.GenerationFailedException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import com.github.tomakehurst.wiremock.stubbing.Scenario;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OpenAiClientTest {

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    private static final String PATH = "/v1/chat/completions";

    private final ObjectMapper om = new ObjectMapper();

    private OpenAiClient client(int maxAttempts, long callTimeoutMs) {
        return new OpenAiClient("sk-test", wm.baseUrl() + PATH,
                1000, 2000, 2000, callTimeoutMs,
                maxAttempts, 0, 400, om);
    }

    /**
     * 用 ObjectMapper 组装合法的 chat completions 响应，避免手写转义
     */
    private String completion(String content) throws Exception {
        ObjectNode root = om.createObjectNode();
        ObjectNode message = root.putArray("choices").addObject().putObject("message");
        message.put("role", "assistant");
        message.put("content", content);
        return om.writeValueAsString(root);
    }

    @Test
    void blank_key_should_fail_at_construction() {
        assertThatThrownBy(() -> new OpenAiClient("  ", wm.baseUrl() + PATH, 1000, 1000, 1000, 1000, 1, 0, 400, om))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> new OpenAiClient(null, wm.baseUrl() + PATH, 1000, 1000, 1000, 1000, 1, 0, 400, om))
                .isInstanceOf(ConfigurationException.class);
        wm.verify(0, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void chat_should_send_bearer_key_model_and_messages_and_return_content() throws Exception {
        wm.stubFor(post(urlEqualTo(PATH))
                .willReturn(okJson(completion("Jog 20 min|Eat a salad"))));

        String text = client(1, 5000).chat("coach persona", "plan my day", "gpt-4o-mini", 0.7);

        assertThat(text).isEqualTo("Jog 20 min|Eat a salad");
        wm.verify(1, postRequestedFor(urlEqualTo(PATH))
                .withHeader("Authorization", equalTo("Bearer sk-test"))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini")))
                .withRequestBody(matchingJsonPath("$.temperature", equalTo("0.7")))
                .withRequestBody(matchingJsonPath("$.max_tokens", equalTo("400")))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("system")))
                .withRequestBody(matchingJsonPath("$.messages[1].content", equalTo("plan my day"))));
    }

    @Test
    void generate_should_send_single_user_message() throws Exception {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(completion("A|B"))));

        assertThat(client(1, 5000).generate("prompt", null, null)).isEqualTo("A|B");

        wm.verify(postRequestedFor(urlEqualTo(PATH))
                .withRequestBody(matchingJsonPath("$.messages[0].role", equalTo("user")))
                .withRequestBody(matchingJsonPath("$.model", equalTo("gpt-4o-mini"))));
    }

    @Test
    void server_error_should_not_be_retried_by_default() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(serverError().withBody("{\"error\":{\"message\":\"boom\"}}")));

        assertThatThrownBy(() -> client(1, 5000).chat(null, "p"))
                .isInstanceOf(GenerationFailedException.class)
                .hasMessageContaining("HTTP 500");

        wm.verify(1, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void rate_limit_should_be_retried_up_to_configured_attempts() throws Exception {
        wm.stubFor(post(urlEqualTo(PATH)).inScenario("retry")
                .whenScenarioStateIs(Scenario.STARTED)
                .willReturn(aResponse().withStatus(429))
                .willSetStateTo("second"));
        wm.stubFor(post(urlEqualTo(PATH)).inScenario("retry")
                .whenScenarioStateIs("second")
                .willReturn(okJson(completion("Rest|Hydrate"))));

        assertThat(client(2, 5000).chat(null, "p")).isEqualTo("Rest|Hydrate");

        wm.verify(2, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void client_error_should_fail_without_retry() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(aResponse().withStatus(401)));

        assertThatThrownBy(() -> client(3, 5000).chat(null, "p"))
                .isInstanceOf(GenerationFailedException.class)
                .hasMessageContaining("HTTP 401");

        wm.verify(1, postRequestedFor(urlEqualTo(PATH)));
    }

    @Test
    void error_payload_should_fail() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"error\":{\"message\":\"quota exceeded\"}}")));

        assertThatThrownBy(() -> client(1, 5000).chat(null, "p"))
                .isInstanceOf(GenerationFailedException.class)
                .hasMessageContaining("quota exceeded");
    }

    @Test
    void malformed_or_empty_payload_should_fail() {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson("{\"choices\":[]}")));
        assertThatThrownBy(() -> client(1, 5000).chat(null, "p"))
                .isInstanceOf(GenerationFailedException.class);

        wm.stubFor(post(urlEqualTo(PATH)).willReturn(ok("not json").withHeader("Content-Type", "text/plain")));
        assertThatThrownBy(() -> client(1, 5000).chat(null, "p"))
                .isInstanceOf(GenerationFailedException.class);
    }

    @Test
    void slow_response_should_hit_call_timeout() throws Exception {
        wm.stubFor(post(urlEqualTo(PATH)).willReturn(okJson(completion("late")).withFixedDelay(1500)));

        assertThatThrownBy(() -> client(1, 300).chat(null, "p"))
                .isInstanceOf(GenerationFailedException.class)
                .hasCauseInstanceOf(java.io.IOException.class);
    }

    @Test
    void blank_prompt_should_be_rejected_before_request() {
        assertThatThrownBy(() -> client(1, 5000).chat("sys", " "))
                .isInstanceOf(IllegalArgumentException.class);
        wm.verify(0, postRequestedFor(urlEqualTo(PATH)));
    }
}
