package org.nowstart.cadence.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cadence.judgment")
public record JudgmentProperties(
        // Anthropic Messages API 기본 URL
        @NotBlank @DefaultValue("https://api.anthropic.com") String baseUrl,
        // Anthropic API Key (없으면 감성/지정학 소스는 대체 신호 반환)
        @DefaultValue("") String apiKey,
        // 판단에 사용할 모델
        @NotBlank @DefaultValue("claude-haiku-4-5-20251001") String model,
        // anthropic-version 헤더 값
        @NotBlank @DefaultValue("2023-06-01") String apiVersion,
        // 윈도우당 최대 호출 수
        @Positive @DefaultValue("10") int maxCalls,
        // 호출 제한 윈도우 길이
        @NotNull @DefaultValue("60s") Duration window
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }
}
