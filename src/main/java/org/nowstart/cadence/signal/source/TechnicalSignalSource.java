package org.nowstart.cadence.signal.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.property.AgentProperties;
import org.nowstart.cadence.data.type.Timeframe;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.PriceSeriesProvider;
import org.nowstart.cadence.signal.core.IndicatorScore;
import org.nowstart.cadence.signal.core.ScoreMath;
import org.nowstart.cadence.signal.core.Signal;
import org.nowstart.cadence.signal.core.SignalSource;
import org.nowstart.cadence.signal.indicator.IndicatorScorer;
import org.nowstart.cadence.signal.indicator.MacdScorer;
import org.nowstart.cadence.signal.indicator.MovingAverageCrossoverScorer;
import org.nowstart.cadence.signal.indicator.RsiScorer;
import org.springframework.stereotype.Component;

/**
 * Multi-timeframe technical view: RSI, moving-average crossover and MACD on daily and weekly closes.
 */
@Slf4j
@Component
public class TechnicalSignalSource implements SignalSource {

    public static final String NAME = "technical";

    static final double DAILY_WEIGHT = 0.60;
    static final double WEEKLY_WEIGHT = 0.40;

    private static final Map<String, Double> INDICATOR_WEIGHTS = Map.of(
            RsiScorer.NAME, 0.30,
            MovingAverageCrossoverScorer.NAME, 0.35,
            MacdScorer.NAME, 0.35
    );

    private final PriceSeriesProvider priceSeriesProvider;
    private final AgentProperties.Technical properties;
    private final List<IndicatorScorer> scorers;

    public TechnicalSignalSource(PriceSeriesProvider priceSeriesProvider, AgentProperties agentProperties) {
        this.priceSeriesProvider = priceSeriesProvider;
        this.properties = agentProperties.technical();
        this.scorers = List.of(
                new RsiScorer(properties.rsiPeriod()),
                new MovingAverageCrossoverScorer(properties.maFast(), properties.maSlow(), properties.maScalePct()),
                new MacdScorer()
        );
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Signal produceSignal() {
        CollaboratorResult<double[]> daily = priceSeriesProvider.closingPrices(
                properties.symbol(), Timeframe.DAILY, properties.dailyCandles());
        if (!daily.isSuccess()) {
            log.warn("Daily price series unavailable. symbol={}, reason={}", properties.symbol(), daily.failureReason());
            return Signal.fallback(NAME, "price data unavailable (" + daily.failureReason() + ")");
        }
        CollaboratorResult<double[]> weekly = priceSeriesProvider.closingPrices(
                properties.symbol(), Timeframe.WEEKLY, properties.weeklyCandles());
        if (!weekly.isSuccess()) {
            log.warn("Weekly price series unavailable. symbol={}, reason={}", properties.symbol(), weekly.failureReason());
            return Signal.fallback(NAME, "price data unavailable (" + weekly.failureReason() + ")");
        }
        return score(daily.value(), weekly.value());
    }

    /**
     * Pure scoring over already fetched daily and weekly closes.
     */
    public Signal score(double[] dailyClose, double[] weeklyClose) {
        List<IndicatorScore> dailyScores = scoreAll(dailyClose);
        List<IndicatorScore> weeklyScores = scoreAll(weeklyClose);

        double dailyComposite = weightedMean(dailyScores);
        double weeklyComposite = weightedMean(weeklyScores);
        double finalScore = ScoreMath.round4(
                ScoreMath.clipScore(DAILY_WEIGHT * dailyComposite + WEEKLY_WEIGHT * weeklyComposite));

        List<IndicatorScore> all = new ArrayList<>(dailyScores);
        all.addAll(weeklyScores);
        double confidence = ScoreMath.round4(confidence(all, dailyComposite, weeklyComposite));

        StringBuilder rationale = new StringBuilder();
        rationale.append(String.format(Locale.ROOT, "Daily composite: %+.2f%n", dailyComposite));
        dailyScores.forEach(score -> rationale.append("  ").append(score.detail()).append(System.lineSeparator()));
        rationale.append(String.format(Locale.ROOT, "Weekly composite: %+.2f%n", weeklyComposite));
        weeklyScores.forEach(score -> rationale.append("  ").append(score.detail()).append(System.lineSeparator()));
        rationale.append(String.format(
                Locale.ROOT,
                "Final: %.0f%% daily + %.0f%% weekly = %+.2f",
                DAILY_WEIGHT * 100.0,
                WEEKLY_WEIGHT * 100.0,
                finalScore
        ));
        return Signal.of(NAME, finalScore, confidence, rationale.toString());
    }

    static double weightedMean(List<IndicatorScore> scores) {
        double total = 0.0;
        double weights = 0.0;
        for (IndicatorScore score : scores) {
            double weight = INDICATOR_WEIGHTS.getOrDefault(score.name(), 0.0);
            total += weight * score.score();
            weights += weight;
        }
        return weights == 0.0 ? 0.0 : total / weights;
    }

    static double confidence(List<IndicatorScore> scores, double daily, double weekly) {
        int positive = 0;
        int negative = 0;
        double magnitude = 0.0;
        for (IndicatorScore score : scores) {
            if (score.score() > 0.0) {
                positive++;
            } else if (score.score() < 0.0) {
                negative++;
            }
            magnitude += Math.abs(score.score());
        }
        int nonZero = positive + negative;
        double agreement = nonZero == 0 ? 0.5 : (double) Math.max(positive, negative) / nonZero;
        double meanMagnitude = scores.isEmpty() ? 0.0 : magnitude / scores.size();

        double alignment;
        if (daily == 0.0 || weekly == 0.0) {
            alignment = 0.5;
        } else if (Math.signum(daily) == Math.signum(weekly)) {
            alignment = 1.0;
        } else {
            alignment = 0.2;
        }
        return ScoreMath.clipUnit(0.45 * agreement + 0.30 * meanMagnitude + 0.25 * alignment);
    }

    private List<IndicatorScore> scoreAll(double[] close) {
        return scorers.stream().map(scorer -> scorer.score(close)).toList();
    }
}
