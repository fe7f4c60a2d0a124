package org.nowstart.cadence.service;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.cadence.data.dto.Headline;
import org.nowstart.cadence.data.dto.RssFeed;
import org.nowstart.cadence.port.CollaboratorResult;
import org.nowstart.cadence.port.HeadlineProvider;
import org.nowstart.cadence.repository.GoogleNewsFeignClient;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class GoogleNewsService implements HeadlineProvider {

    private static final XmlMapper XML_MAPPER = XmlMapper.builder()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final GoogleNewsFeignClient googleNewsFeignClient;

    @Override
    public CollaboratorResult<List<Headline>> headlines(List<String> queries, int maxHeadlines) {
        if (queries == null || queries.isEmpty()) {
            return CollaboratorResult.failure("no news queries configured");
        }
        try {
            String rss = googleNewsFeignClient.search(String.join(" OR ", queries), "en-US", "US", "US:en");
            return CollaboratorResult.success(parse(rss, maxHeadlines));
        } catch (Exception e) {
            log.warn("Google News RSS fetch failed.", e);
            return CollaboratorResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    static List<Headline> parse(String rss, int maxHeadlines) throws IOException {
        if (rss == null || rss.isBlank()) {
            return List.of();
        }
        RssFeed feed = XML_MAPPER.readValue(rss, RssFeed.class);
        if (feed == null || feed.getChannel() == null || feed.getChannel().getItems() == null) {
            return List.of();
        }
        List<Headline> headlines = new ArrayList<>();
        for (RssFeed.Item item : feed.getChannel().getItems()) {
            if (headlines.size() >= maxHeadlines) {
                break;
            }
            String source = item.getSource() == null || item.getSource().getName() == null
                    ? "unknown"
                    : item.getSource().getName();
            headlines.add(new Headline(
                    source,
                    nullToEmpty(item.getTitle()),
                    nullToEmpty(item.getDescription()),
                    nullToEmpty(item.getPubDate())
            ));
        }
        return headlines;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
