package me.golemcore.pipeline.adapter.outbound.scraper;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.ScrapedItem;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.ratelimit.SourceRateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Subreddit listings through Reddit's public JSON endpoints. A subreddit that
 * fails is logged and skipped; the source fails only when every subreddit
 * failed.
 */
@Component
@Slf4j
public class RedditSignalSource extends AbstractHttpSignalSource {

    public static final String SOURCE_ID = "reddit";

    private static final String PERMALINK_BASE = "https://www.reddit.com";

    private final PipelineProperties.RedditProperties properties;

    public RedditSignalSource(OkHttpClient httpClient, ObjectMapper objectMapper, SourceRateLimiter rateLimiter,
            PipelineProperties properties) {
        super(httpClient, objectMapper, rateLimiter);
        this.properties = properties.getSources().getReddit();
    }

    @Override
    public String sourceId() {
        return SOURCE_ID;
    }

    @Override
    public boolean isEnabled() {
        return properties.isEnabled();
    }

    @Override
    public List<ScrapedItem> collect() {
        List<ScrapedItem> items = new ArrayList<>();
        RuntimeException lastFailure = null;
        int failures = 0;
        for (String subreddit : properties.getSubreddits()) {
            try {
                items.addAll(collectSubreddit(subreddit));
            } catch (RuntimeException e) {
                log.warn("[Scraper] r/{} failed: {}", subreddit, e.getMessage());
                lastFailure = e;
                failures++;
            }
        }
        if (lastFailure != null && failures == properties.getSubreddits().size()) {
            throw lastFailure;
        }
        logSummary(properties.getSubreddits().size(), items.size());
        return items;
    }

    private List<ScrapedItem> collectSubreddit(String subreddit) {
        HttpUrl url = HttpUrl.get(properties.getBaseUrl()).newBuilder()
                .addPathSegment("r")
                .addPathSegment(subreddit)
                .addPathSegment(properties.getListing() + ".json")
                .addQueryParameter("limit", String.valueOf(properties.getLimitPerSubreddit()))
                .build();
        JsonNode listing = getJson(url, Map.of("User-Agent", properties.getUserAgent()));

        List<ScrapedItem> items = new ArrayList<>();
        for (JsonNode child : listing.path("data").path("children")) {
            JsonNode post = child.path("data");
            if (post.path("stickied").asBoolean(false)) {
                continue;
            }
            String permalink = post.path("permalink").asText("");
            String title = cleanText(post.path("title").asText(""));
            if (permalink.isEmpty() || title.isEmpty()) {
                continue;
            }
            String body = cleanText(post.path("selftext").asText(""));
            ScrapedItem item = ScrapedItem.builder()
                    .url(PERMALINK_BASE + permalink)
                    .title(title)
                    .content(body.isEmpty() ? title : title + "\n\n" + body)
                    .build();
            item.getMetadata().put(MetadataKeys.EXTERNAL_ID, post.path("id").asText(""));
            item.getMetadata().put(MetadataKeys.AUTHOR, post.path("author").asText(""));
            item.getMetadata().put(MetadataKeys.SCORE, post.path("score").asInt(0));
            item.getMetadata().put(MetadataKeys.COMMENTS, post.path("num_comments").asInt(0));
            item.getMetadata().put(MetadataKeys.COMMUNITY, post.path("subreddit").asText(subreddit));
            items.add(item);
        }
        log.debug("[Scraper] r/{}: {} posts", subreddit, items.size());
        return items;
    }
}
