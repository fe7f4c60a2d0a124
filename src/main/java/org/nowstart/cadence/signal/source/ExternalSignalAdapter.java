package org.nowstart.cadence.signal.source;

import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.ExternalJudgment;
import org.nowstart.cadence.data.dto.JudgmentRequest;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.ExternalJudgmentProvider;
import org.nowstart.cadence.signal.core.ScoreMath;
import org.nowstart.cadence.signal.core.Signal;
import org.nowstart.cadence.signal.core.SignalSource;

/**
 * Turns a batch of fetched text items into a signal by asking an external judgment service
 * for a raw score, then transforming that score and deriving confidence from sample size.
 *
 * <p>Every failure along the way (missing credentials, empty or failed feed, failed judgment)
 * ends in a neutral fallback signal instead of an exception.
 */
@Slf4j
public abstract class ExternalSignalAdapter<T> implements SignalSource {

    private final ExternalJudgmentProvider judgmentProvider;

    protected ExternalSignalAdapter(ExternalJudgmentProvider judgmentProvider) {
        this.judgmentProvider = judgmentProvider;
    }

    @Override
    public Signal produceSignal() {
        if (!judgmentProvider.isConfigured()) {
            return Signal.fallback(name(), "No judgment api key configured");
        }
        CollaboratorResult<List<T>> items = fetchItems();
        if (!items.isSuccess()) {
            log.warn("Feed fetch failed. source={}, reason={}", name(), items.failureReason());
            return Signal.fallback(name(), "Feed unavailable (" + items.failureReason() + ")");
        }
        if (items.value().isEmpty()) {
            return Signal.fallback(name(), emptyFeedReason());
        }
        return scoreItems(items.value());
    }

    /**
     * Scores a pre-fetched batch without touching the feed.
     */
    public Signal scoreItems(List<T> items) {
        if (!judgmentProvider.isConfigured()) {
            return Signal.fallback(name(), "No judgment api key configured");
        }
        if (items == null || items.isEmpty()) {
            return Signal.fallback(name(), "Empty item list");
        }

        JudgmentRequest request = new JudgmentRequest(systemPrompt(), userPrompt(items), scoreField(), maxTokens());
        CollaboratorResult<ExternalJudgment> judgment = judgmentProvider.judge(request);
        if (!judgment.isSuccess()) {
            log.warn("Judgment failed. source={}, reason={}", name(), judgment.failureReason());
            return Signal.fallback(name(), "Judgment failed (" + judgment.failureReason() + ")");
        }

        ExternalJudgment raw = judgment.value();
        double score = ScoreMath.round4(transform(raw.score()));
        double confidence = ScoreMath.round4(confidence(raw.score(), raw.confidence(), items.size(), sampleThreshold()));
        return Signal.of(name(), score, confidence, rationale(items.size(), raw, score, confidence));
    }

    static double confidence(double rawScore, double rawConfidence, int sampleCount, int threshold) {
        double sample = Math.min((double) sampleCount / threshold, 1.0);
        return ScoreMath.clipUnit(0.50 * rawConfidence + 0.30 * sample + 0.20 * Math.abs(rawScore));
    }

    protected abstract CollaboratorResult<List<T>> fetchItems();

    protected abstract String emptyFeedReason();

    protected abstract String systemPrompt();

    protected abstract String userPrompt(List<T> items);

    protected abstract String scoreField();

    protected abstract int maxTokens();

    protected abstract int sampleThreshold();

    /**
     * Maps the raw judgment score onto the signal score.
     */
    protected abstract double transform(double rawScore);

    protected abstract String rationale(int sampleCount, ExternalJudgment raw, double score, double confidence);
}
