package org.nowstart.cadence.data.property;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

public final class TestProperties {

    public static final ZoneId PACIFIC = ZoneId.of("America/Los_Angeles");

    private TestProperties() {
    }

    public static TradingProperties trading(boolean dryRun, boolean killSwitch, String maxOrder, String maxDaily) {
        return new TradingProperties(
                "https://api.kraken.com",
                "key",
                "c2VjcmV0",
                "XBTUSD",
                dryRun,
                false,
                killSwitch,
                new BigDecimal(maxOrder),
                new BigDecimal(maxDaily),
                1,
                "data/daily_ledger.json",
                "data/trade_history.json",
                PACIFIC
        );
    }

    public static TradingProperties trading() {
        return trading(true, false, "500", "1000");
    }

    public static OrchestratorProperties orchestrator(Map<String, BigDecimal> weights, List<String> disabled, boolean payDatesOnly) {
        return new OrchestratorProperties(
                new BigDecimal("100"),
                weights,
                disabled,
                payDatesOnly,
                null,
                new BigDecimal("1.36"),
                "https://api.exchangerate-api.com"
        );
    }

    public static OrchestratorProperties orchestratorInCad(String baseDcaCad) {
        return new OrchestratorProperties(
                new BigDecimal("100"),
                Map.of(),
                List.of(),
                true,
                new BigDecimal(baseDcaCad),
                new BigDecimal("1.36"),
                "https://api.exchangerate-api.com"
        );
    }

    public static OrchestratorProperties orchestrator() {
        return orchestrator(Map.of(), List.of(), true);
    }

    public static ScheduleProperties schedule() {
        return new ScheduleProperties(
                LocalDate.of(2026, 2, 15),
                LocalTime.of(9, 0),
                PACIFIC,
                "data/scheduled_buys.json",
                "0 5 9 * * *"
        );
    }

    public static AgentProperties agents(boolean liveMetric) {
        return new AgentProperties(
                new AgentProperties.Technical("XBTUSD", 400, 200, 14, 50, 200, 5.0),
                new AgentProperties.Cycle(LocalDate.of(2024, 4, 19), 1458, liveMetric, "https://community-api.coinmetrics.io"),
                new AgentProperties.Sentiment(
                        "https://www.reddit.com",
                        List.of("Bitcoin", "CryptoCurrency", "BitcoinMarkets"),
                        50,
                        "hot",
                        25
                ),
                new AgentProperties.Geopolitical(
                        "https://news.google.com",
                        List.of("bitcoin regulation", "banking crisis"),
                        30,
                        15
                )
        );
    }

    public static AgentProperties agents() {
        return agents(false);
    }

    public static JudgmentProperties judgment(String apiKey) {
        return new JudgmentProperties(
                "https://api.anthropic.com",
                apiKey,
                "claude-haiku-4-5-20251001",
                "2023-06-01",
                10,
                Duration.ofSeconds(60)
        );
    }
}
