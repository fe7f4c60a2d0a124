package org.nowstart.cadence.port;

import java.util.List;
import org.nowstart.cadence.data.dto.Headline;

public interface HeadlineProvider {

    CollaboratorResult<List<Headline>> headlines(List<String> queries, int maxHeadlines);
}
