package org.nowstart.cadence.port;

import org.nowstart.cadence.data.dto.ExternalJudgment;
import org.nowstart.cadence.data.dto.JudgmentRequest;

public interface ExternalJudgmentProvider {

    /**
     * False when credentials for the judgment service are missing.
     */
    boolean isConfigured();

    CollaboratorResult<ExternalJudgment> judge(JudgmentRequest request);
}
