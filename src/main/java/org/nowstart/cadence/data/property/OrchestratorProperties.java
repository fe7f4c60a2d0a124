package org.nowstart.cadence.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cadence.orchestrator")
public record OrchestratorProperties(
        // 기본 DCA 금액(USD), 최종 주문 금액 = 기본 금액 x 배수
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("100") BigDecimal baseDcaUsd,
        // 소스별 가중치(미설정 소스는 기본 가중치 사용)
        Map<String, BigDecimal> weights,
        // 비활성화할 소스 목록
        @DefaultValue("") List<String> disabledSources,
        // true면 지급일(15일, 말일)에만 매수 실행
        @DefaultValue("true") boolean payDatesOnly,
        // 기본 DCA 금액(CAD), 설정 시 USD/CAD 환율로 환산해 baseDcaUsd 대신 사용
        @DecimalMin(value = "0", inclusive = false) BigDecimal baseDcaCad,
        // 환율 조회 실패 시 사용할 USD/CAD 고정 환율
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("1.36") BigDecimal fallbackUsdCadRate,
        // 환율 API 기본 URL
        @NotBlank @DefaultValue("https://api.exchangerate-api.com") String fxBaseUrl
) {

    public static final Map<String, BigDecimal> DEFAULT_WEIGHTS = Map.of(
            "technical", new BigDecimal("0.30"),
            "cycle", new BigDecimal("0.30"),
            "sentiment", new BigDecimal("0.25"),
            "geopolitical", new BigDecimal("0.15")
    );

    public OrchestratorProperties {
        weights = weights == null ? Map.of() : Map.copyOf(weights);
        disabledSources = disabledSources == null
                ? List.of()
                : disabledSources.stream().filter(source -> source != null && !source.isBlank()).toList();
        weights.forEach((source, weight) -> {
            if (weight == null || weight.signum() < 0) {
                throw new IllegalArgumentException("weight for " + source + " must be >= 0");
            }
        });
    }

    public double weightOf(String source) {
        BigDecimal configured = weights.get(source);
        if (configured != null) {
            return configured.doubleValue();
        }
        BigDecimal fallback = DEFAULT_WEIGHTS.get(source);
        return fallback == null ? 0.0 : fallback.doubleValue();
    }

    public boolean isEnabled(String source) {
        return !disabledSources.contains(source);
    }
}
