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

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hacker News stories through the Algolia search API (no authentication).
 * One search per configured query, limited to recent stories above a point
 * threshold, de-duplicated by story id.
 */
@Component
@Slf4j
public class HackerNewsSignalSource extends AbstractHttpSignalSource {

    public static final String SOURCE_ID = "hackernews";

    private static final String ITEM_URL = "https://news.ycombinator.com/item?id=";

    private final PipelineProperties.HackerNewsProperties properties;
    private final Clock clock;

    public HackerNewsSignalSource(OkHttpClient httpClient, ObjectMapper objectMapper,
            SourceRateLimiter rateLimiter, PipelineProperties properties, Clock clock) {
        super(httpClient, objectMapper, rateLimiter);
        this.properties = properties.getSources().getHackernews();
        this.clock = clock;
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
        long cutoff = clock.instant().minus(Duration.ofHours(properties.getHoursBack())).getEpochSecond();
        String numericFilters = "created_at_i>" + cutoff + ",points>" + properties.getMinPoints();

        List<ScrapedItem> items = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String query : properties.getQueries()) {
            HttpUrl url = HttpUrl.get(properties.getBaseUrl() + "/search").newBuilder()
                    .addQueryParameter("query", query)
                    .addQueryParameter("tags", "story")
                    .addQueryParameter("numericFilters", numericFilters)
                    .addQueryParameter("hitsPerPage", String.valueOf(properties.getHitsPerQuery()))
                    .build();
            JsonNode hits = getJson(url, Map.of()).path("hits");
            for (JsonNode hit : hits) {
                String objectId = hit.path("objectID").asText("");
                if (objectId.isEmpty() || !seen.add(objectId)) {
                    continue;
                }
                ScrapedItem item = toItem(hit, objectId);
                if (item != null) {
                    items.add(item);
                }
            }
        }
        logSummary(properties.getQueries().size(), items.size());
        return items;
    }

    private ScrapedItem toItem(JsonNode hit, String objectId) {
        String title = cleanText(hit.path("title").asText(""));
        String storyText = cleanText(hit.path("story_text").asText(""));
        if (title.isEmpty() && storyText.isEmpty()) {
            log.debug("[Scraper] Skipping empty HN story {}", objectId);
            return null;
        }
        ScrapedItem item = ScrapedItem.builder()
                .url(ITEM_URL + objectId)
                .title(title)
                .content(storyText.isEmpty() ? title : title + "\n\n" + storyText)
                .build();
        item.getMetadata().put(MetadataKeys.EXTERNAL_ID, objectId);
        item.getMetadata().put(MetadataKeys.AUTHOR, hit.path("author").asText(""));
        item.getMetadata().put(MetadataKeys.SCORE, hit.path("points").asInt(0));
        item.getMetadata().put(MetadataKeys.COMMENTS, hit.path("num_comments").asInt(0));
        if (hit.hasNonNull("url")) {
            item.getMetadata().put("link", hit.get("url").asText());
        }
        return item;
    }
}
