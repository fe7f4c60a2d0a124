package org.nowstart.cadence.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.AnthropicMessageRequest;
import org.nowstart.cadence.data.dto.AnthropicMessageResponse;
import org.nowstart.cadence.data.dto.ExternalJudgment;
import org.nowstart.cadence.data.dto.JudgmentRequest;
import org.nowstart.cadence.data.property.JudgmentProperties;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.ExternalJudgmentProvider;
import org.nowstart.cadence.repository.AnthropicFeignClient;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Language-model judgment over a text batch. One limiter is shared by every caller.
 */
@Slf4j
@Service
public class AnthropicJudgmentService implements ExternalJudgmentProvider {

    private static final String FENCE = "```";

    private final AnthropicFeignClient anthropicFeignClient;
    private final JudgmentProperties judgmentProperties;
    private final ObjectMapper objectMapper;
    private final SlidingWindowRateLimiter rateLimiter;

    @Autowired
    public AnthropicJudgmentService(
            AnthropicFeignClient anthropicFeignClient,
            JudgmentProperties judgmentProperties,
            ObjectMapper objectMapper
    ) {
        this(
                anthropicFeignClient,
                judgmentProperties,
                objectMapper,
                new SlidingWindowRateLimiter(judgmentProperties.maxCalls(), judgmentProperties.window())
        );
    }

    AnthropicJudgmentService(
            AnthropicFeignClient anthropicFeignClient,
            JudgmentProperties judgmentProperties,
            ObjectMapper objectMapper,
            SlidingWindowRateLimiter rateLimiter
    ) {
        this.anthropicFeignClient = anthropicFeignClient;
        this.judgmentProperties = judgmentProperties;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public boolean isConfigured() {
        return judgmentProperties.hasApiKey();
    }

    @Override
    public CollaboratorResult<ExternalJudgment> judge(JudgmentRequest request) {
        if (!isConfigured()) {
            return CollaboratorResult.failure("No judgment api key configured");
        }

        String text;
        try {
            rateLimiter.acquire();
            AnthropicMessageResponse response = anthropicFeignClient.createMessage(
                    AnthropicMessageRequest.of(judgmentProperties.model(), request));
            text = response == null ? null : response.firstText();
        } catch (FeignException e) {
            log.warn("Judgment call failed. status={}", e.status(), e);
            return CollaboratorResult.failure("judgment call failed (status " + e.status() + ")");
        } catch (Exception e) {
            log.warn("Judgment call failed.", e);
            return CollaboratorResult.failure("judgment call failed (" + e.getMessage() + ")");
        }

        if (text == null || text.isBlank()) {
            return CollaboratorResult.failure("empty judgment reply");
        }
        return parse(text, request.scoreField());
    }

    CollaboratorResult<ExternalJudgment> parse(String reply, String scoreField) {
        try {
            JsonNode root = objectMapper.readTree(stripFences(reply));
            JsonNode score = root == null ? null : root.get(scoreField);
            JsonNode confidence = root == null ? null : root.get("confidence");
            if (score == null || !score.isNumber() || confidence == null || !confidence.isNumber()) {
                return CollaboratorResult.failure("unparseable judgment reply (missing " + scoreField + " or confidence)");
            }
            JsonNode reasoning = root.get("reasoning");
            return CollaboratorResult.success(new ExternalJudgment(
                    score.asDouble(),
                    confidence.asDouble(),
                    reasoning == null || reasoning.isNull() ? "" : reasoning.asText()
            ));
        } catch (JsonProcessingException e) {
            log.warn("Unparseable judgment reply. reply={}", reply, e);
            return CollaboratorResult.failure("unparseable judgment reply");
        }
    }

    static String stripFences(String reply) {
        String raw = reply.strip();
        if (!raw.startsWith(FENCE)) {
            return raw;
        }
        int firstNewline = raw.indexOf('\n');
        raw = firstNewline < 0 ? "" : raw.substring(firstNewline + 1);
        if (raw.endsWith(FENCE)) {
            raw = raw.substring(0, raw.lastIndexOf(FENCE));
        }
        return raw.strip();
    }
}
