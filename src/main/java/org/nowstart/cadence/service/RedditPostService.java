package org.nowstart.cadence.service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.RedditListingResponse;
import org.nowstart.cadence.data.dto.SocialPost;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.SocialPostProvider;
import org.nowstart.cadence.repository.RedditFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class RedditPostService implements SocialPostProvider {

    static final int MIN_PER_COMMUNITY = 10;
    static final int MAX_BODY_LENGTH = 500;

    private final RedditFeignClient redditFeignClient;

    @Override
    public CollaboratorResult<List<SocialPost>> recentPosts(List<String> communities, int maxPosts, String sort) {
        if (communities == null || communities.isEmpty()) {
            return CollaboratorResult.failure("no subreddits configured");
        }

        int perCommunity = Math.max(maxPosts / communities.size(), MIN_PER_COMMUNITY);
        List<SocialPost> posts = new ArrayList<>();
        int failures = 0;
        for (String community : communities) {
            try {
                RedditListingResponse listing = redditFeignClient.getListing(community, sort, perCommunity, 1);
                posts.addAll(toPosts(community, listing));
            } catch (Exception e) {
                failures++;
                log.warn("Reddit fetch failed. subreddit={}", community, e);
            }
        }

        if (failures == communities.size()) {
            return CollaboratorResult.failure("all subreddit fetches failed");
        }
        return CollaboratorResult.success(posts.size() > maxPosts ? List.copyOf(posts.subList(0, maxPosts)) : List.copyOf(posts));
    }

    static List<SocialPost> toPosts(String community, RedditListingResponse listing) {
        if (listing == null || listing.data() == null || listing.data().children() == null) {
            return List.of();
        }
        List<SocialPost> posts = new ArrayList<>();
        for (RedditListingResponse.Child child : listing.data().children()) {
            RedditListingResponse.RedditPost post = child == null ? null : child.data();
            if (post == null || post.stickied()) {
                continue;
            }
            String body = post.selftext() == null ? "" : post.selftext();
            if (body.length() > MAX_BODY_LENGTH) {
                body = body.substring(0, MAX_BODY_LENGTH);
            }
            posts.add(new SocialPost(
                    community,
                    post.author() == null ? "[deleted]" : post.author(),
                    post.title() == null ? "" : post.title(),
                    body,
                    Instant.ofEpochSecond((long) post.created_utc()),
                    post.score(),
                    post.num_comments()
            ));
        }
        return posts;
    }
}
