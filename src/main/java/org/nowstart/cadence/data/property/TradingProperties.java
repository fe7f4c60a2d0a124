package org.nowstart.cadence.data.property;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cadence.trading")
public record TradingProperties(
        // Kraken REST API 기본 URL
        @NotBlank @DefaultValue("https://api.kraken.com") String baseUrl,
        // Kraken API Key (주문 인증용)
        @DefaultValue("") String apiKey,
        // Kraken API Secret (base64, API-Sign 서명용)
        @DefaultValue("") String apiSecret,
        // 매수 대상 페어
        @NotBlank @DefaultValue("XBTUSD") String symbol,
        // 모의 실행 여부(true면 주문 없이 원장만 기록)
        @DefaultValue("true") boolean dryRun,
        // 테스트넷 모드(Kraken은 샌드박스가 없으므로 dryRun 강제)
        @DefaultValue("true") boolean testnet,
        // 킬 스위치(true면 모든 주문 차단)
        @DefaultValue("false") boolean killSwitch,
        // 1회 주문 최대 금액(USD)
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("500") BigDecimal maxOrderUsd,
        // 일일 누적 주문 최대 금액(USD)
        @NotNull @DecimalMin(value = "0", inclusive = false) @DefaultValue("1000") BigDecimal maxDailyUsd,
        // 레버리지 배수(1 = 현물)
        @Min(1) @DefaultValue("1") int leverage,
        // 일일 지출 원장 파일 경로
        @NotBlank @DefaultValue("data/daily_ledger.json") String ledgerPath,
        // 거래 기록 파일 경로
        @NotBlank @DefaultValue("data/trade_history.json") String tradeLogPath,
        // 원장 날짜 계산 기준 시간대
        @NotNull @DefaultValue("America/Los_Angeles") ZoneId zone
) {

    public boolean simulated() {
        return dryRun || testnet;
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }
}
