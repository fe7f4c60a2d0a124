package org.nowstart.cadence.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cadence.agents")
public record AgentProperties(
        @Valid @NotNull @DefaultValue Technical technical,
        @Valid @NotNull @DefaultValue Cycle cycle,
        @Valid @NotNull @DefaultValue Sentiment sentiment,
        @Valid @NotNull @DefaultValue Geopolitical geopolitical
) {

    public record Technical(
            // 기술적 분석 대상 페어
            @NotBlank @DefaultValue("XBTUSD") String symbol,
            // 일봉 캔들 수
            @Positive @DefaultValue("400") int dailyCandles,
            // 주봉 캔들 수
            @Positive @DefaultValue("200") int weeklyCandles,
            // RSI 기간
            @Positive @DefaultValue("14") int rsiPeriod,
            // 단기/장기 이동평균 길이
            @Positive @DefaultValue("50") int maFast,
            @Positive @DefaultValue("200") int maSlow,
            // 이동평균 괴리율 스케일(%)
            @Positive @DefaultValue("5.0") double maScalePct
    ) {
    }

    public record Cycle(
            // 가장 최근 사이클 시작일(반감기)
            @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) @DefaultValue("2024-04-19") LocalDate lastCycleStart,
            // 평균 사이클 길이(일)
            @Positive @DefaultValue("1458") int averageCycleDays,
            // 온체인 지표 실시간 조회 여부(false면 월별 조회 테이블만 사용)
            @DefaultValue("true") boolean liveMetric,
            // CoinMetrics 커뮤니티 API 기본 URL
            @NotBlank @DefaultValue("https://community-api.coinmetrics.io") String metricBaseUrl
    ) {
    }

    public record Sentiment(
            // Reddit 공개 JSON API 기본 URL
            @NotBlank @DefaultValue("https://www.reddit.com") String baseUrl,
            // 수집할 서브레딧 목록
            @NotNull @DefaultValue({"Bitcoin", "CryptoCurrency", "BitcoinMarkets"}) List<String> subreddits,
            // 최대 수집 게시글 수
            @Positive @DefaultValue("50") int maxPosts,
            // 정렬 기준(hot, new, top)
            @NotBlank @DefaultValue("hot") String sort,
            // 표본 신뢰도 만점 기준 게시글 수
            @Positive @DefaultValue("25") int sampleThreshold
    ) {
    }

    public record Geopolitical(
            // Google News RSS 기본 URL
            @NotBlank @DefaultValue("https://news.google.com") String baseUrl,
            // Google News 검색어 목록(OR 결합)
            @NotNull @DefaultValue({
                    "bitcoin regulation",
                    "bitcoin sanctions",
                    "banking crisis",
                    "currency devaluation",
                    "central bank digital currency",
                    "capital controls crypto"
            }) List<String> queries,
            // 최대 헤드라인 수
            @Positive @DefaultValue("30") int maxHeadlines,
            // 표본 신뢰도 만점 기준 헤드라인 수
            @Positive @DefaultValue("15") int sampleThreshold
    ) {
    }
}
