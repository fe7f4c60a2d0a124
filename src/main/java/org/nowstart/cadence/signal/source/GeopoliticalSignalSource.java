package org.nowstart.cadence.signal.source;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.nowstart.cadence.data.dto.ExternalJudgment;
import org.nowstart.cadence.data.dto.Headline;
import org.nowstart.cadence.data.property.AgentProperties;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.ExternalJudgmentProvider;
import org.nowstart.cadence.port.HeadlineProvider;
import org.nowstart.cadence.signal.core.ScoreMath;
import org.springframework.stereotype.Component;

/**
 * Macro and geopolitical risk read from news headlines. The judged score is used directly.
 */
@Component
public class GeopoliticalSignalSource extends ExternalSignalAdapter<Headline> {

    public static final String NAME = "geopolitical";

    private static final String SYSTEM_PROMPT = """
            You are a geopolitical analyst specialising in how macro events affect Bitcoin.
            You will receive recent news headlines. Assess the overall geopolitical environment \
            for Bitcoin based on these headlines.

            Focus on events that historically drive BTC capital flows:
            - Banking instability or bank failures (positive for BTC, flight to alternative assets)
            - Currency devaluation or capital controls (positive, drives BTC demand as a hedge)
            - Regulatory clarity or pro-crypto legislation (positive, reduces uncertainty)
            - War, sanctions, or geopolitical tension (mildly positive, safe-haven flows that can disrupt markets)
            - Regulatory crackdowns, bans, or enforcement actions (negative, reduces access and demand)
            - Central bank hawkishness or rate hikes (negative, strengthens fiat and reduces risk appetite)

            Return ONLY valid JSON with exactly these fields:
            {
              "score": <float from -1.0 (very negative for BTC) to 1.0 (very positive for BTC)>,
              "confidence": <float from 0.0 to 1.0>,
              "reasoning": "<2-3 sentence summary of the key geopolitical factors>"
            }

            If headlines are irrelevant or too few to judge, set confidence below 0.3.""";

    private final HeadlineProvider headlineProvider;
    private final AgentProperties.Geopolitical properties;

    public GeopoliticalSignalSource(
            ExternalJudgmentProvider judgmentProvider,
            HeadlineProvider headlineProvider,
            AgentProperties agentProperties
    ) {
        super(judgmentProvider);
        this.headlineProvider = headlineProvider;
        this.properties = agentProperties.geopolitical();
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected CollaboratorResult<List<Headline>> fetchItems() {
        return headlineProvider.headlines(properties.queries(), properties.maxHeadlines());
    }

    @Override
    protected String emptyFeedReason() {
        return "No headlines returned from Google News";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String userPrompt(List<Headline> headlines) {
        String block = headlines.stream()
                .map(headline -> "[" + headline.source() + "] (" + headline.publishedAt() + ")\n"
                        + headline.title() + "\n" + headline.description())
                .collect(Collectors.joining("\n\n"));
        return "Here are " + headlines.size() + " recent headlines related to Bitcoin, "
                + "regulation, macro-economics, and geopolitics:\n\n"
                + block
                + "\n\nAssess the overall geopolitical environment for Bitcoin and return JSON.";
    }

    @Override
    protected String scoreField() {
        return "score";
    }

    @Override
    protected int maxTokens() {
        return 300;
    }

    @Override
    protected int sampleThreshold() {
        return properties.sampleThreshold();
    }

    @Override
    protected double transform(double rawScore) {
        return ScoreMath.clipScore(rawScore);
    }

    @Override
    protected String rationale(int sampleCount, ExternalJudgment raw, double score, double confidence) {
        return String.format(
                Locale.ROOT,
                "Headlines analysed: %d%nGeopolitical score: %+.2f%nLLM reasoning: %s%nConfidence: %.2f",
                sampleCount,
                score,
                raw.rationale(),
                confidence
        );
    }
}
