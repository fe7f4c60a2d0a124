package org.nowstart.cadence.port;

import java.util.List;
import org.nowstart.cadence.data.dto.SocialPost;

public interface SocialPostProvider {

    /**
     * Recent non-pinned posts across the given communities, at most {@code maxPosts} in total.
     */
    CollaboratorResult<List<SocialPost>> recentPosts(List<String> communities, int maxPosts, String sort);
}
