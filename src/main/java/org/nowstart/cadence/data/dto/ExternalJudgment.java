package org.nowstart.cadence.data.dto;

import org.nowstart.cadence.signal.core.ScoreMath;

public record ExternalJudgment(
        double score,
        double confidence,
        String rationale
) {

    public ExternalJudgment {
        score = ScoreMath.clipScore(score);
        confidence = ScoreMath.clipUnit(confidence);
        rationale = rationale == null ? "" : rationale;
    }
}
