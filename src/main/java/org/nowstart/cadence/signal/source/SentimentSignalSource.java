package org.nowstart.cadence.signal.source;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import org.nowstart.cadence.data.dto.ExternalJudgment;
import org.nowstart.cadence.data.dto.SocialPost;
import org.nowstart.cadence.data.property.AgentProperties;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.ExternalJudgmentProvider;
import org.nowstart.cadence.port.SocialPostProvider;
import org.nowstart.cadence.signal.core.ScoreMath;
import org.springframework.stereotype.Component;

/**
 * Contrarian crowd-mood signal: extreme fear reads bullish, extreme greed bearish.
 */
@Component
public class SentimentSignalSource extends ExternalSignalAdapter<SocialPost> {

    public static final String NAME = "sentiment";

    static final double CONTRARIAN_FACTOR = -0.8;

    private static final String SYSTEM_PROMPT = """
            You are a Bitcoin market sentiment analyst. You will be given a batch of recent \
            Reddit posts from Bitcoin-related subreddits. Assess the overall market sentiment \
            expressed in these posts.

            Return ONLY valid JSON with exactly these fields:
            {
              "sentiment": <float from -1.0 (extreme fear) to 1.0 (extreme greed)>,
              "confidence": <float from 0.0 to 1.0 indicating how confident you are>,
              "reasoning": "<1-2 sentence summary of the sentiment you detected>"
            }

            Guidelines:
            - Extreme fear or panic selling language: sentiment near -1.0
            - Cautious or worried tone: sentiment -0.3 to -0.7
            - Neutral or mixed: sentiment near 0.0
            - Optimistic or bullish: sentiment +0.3 to +0.7
            - Euphoria, FOMO or moon language: sentiment near +1.0
            - If posts are few or uninformative, set confidence low (0.2-0.4)
            - Weight highly-upvoted posts more heavily than low-score posts
            - Consider both post titles and body text for sentiment cues""";

    private final SocialPostProvider socialPostProvider;
    private final AgentProperties.Sentiment properties;

    public SentimentSignalSource(
            ExternalJudgmentProvider judgmentProvider,
            SocialPostProvider socialPostProvider,
            AgentProperties agentProperties
    ) {
        super(judgmentProvider);
        this.socialPostProvider = socialPostProvider;
        this.properties = agentProperties.sentiment();
    }

    @Override
    public String name() {
        return NAME;
    }

    static String label(double sentiment) {
        if (sentiment <= -0.6) {
            return "extreme fear";
        }
        if (sentiment <= -0.3) {
            return "fear";
        }
        if (sentiment <= 0.3) {
            return "neutral";
        }
        if (sentiment <= 0.6) {
            return "greed";
        }
        return "extreme greed";
    }

    @Override
    protected CollaboratorResult<List<SocialPost>> fetchItems() {
        return socialPostProvider.recentPosts(properties.subreddits(), properties.maxPosts(), properties.sort());
    }

    @Override
    protected String emptyFeedReason() {
        return "No Reddit posts returned";
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected String userPrompt(List<SocialPost> posts) {
        String block = posts.stream().map(this::formatPost).collect(Collectors.joining("\n\n"));
        return "Here are " + posts.size() + " recent Bitcoin-related Reddit posts:\n\n"
                + block
                + "\n\nAnalyse the overall sentiment and return JSON.";
    }

    @Override
    protected String scoreField() {
        return "sentiment";
    }

    @Override
    protected int maxTokens() {
        return 256;
    }

    @Override
    protected int sampleThreshold() {
        return properties.sampleThreshold();
    }

    @Override
    protected double transform(double rawScore) {
        return ScoreMath.clipScore(CONTRARIAN_FACTOR * rawScore);
    }

    @Override
    protected String rationale(int sampleCount, ExternalJudgment raw, double score, double confidence) {
        return String.format(
                Locale.ROOT,
                "Reddit posts analysed: %d%nRaw sentiment: %+.2f (%s)%nLLM reasoning: %s%nContrarian signal: %+.2f%nConfidence: %.2f",
                sampleCount,
                raw.score(),
                label(raw.score()),
                raw.rationale(),
                score,
                confidence
        );
    }

    private String formatPost(SocialPost post) {
        String header = String.format(
                Locale.ROOT,
                "r/%s | u/%s | score:%d | comments:%d | %s",
                post.community(),
                post.author(),
                post.score(),
                post.comments(),
                post.createdAt()
        );
        if (post.body() == null || post.body().isBlank()) {
            return header + "\n" + post.title();
        }
        return header + "\n" + post.title() + "\n" + post.body();
    }
}
