package me.golemcore.pipeline.adapter.outbound.scraper;

import me.golemcore.pipeline.domain.exception.TransientIOException;
import me.golemcore.pipeline.domain.model.MetadataKeys;
import me.golemcore.pipeline.domain.model.ScrapedItem;
import me.golemcore.pipeline.infrastructure.config.PipelineConfiguration;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.ratelimit.SlidingWindowRateLimiter;
import me.golemcore.pipeline.testsupport.MutableClock;
import me.golemcore.pipeline.testsupport.http.OkHttpMockEngine;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RedditSignalSourceTest {

    private static final String LISTING = """
            {"data": {"children": [
              {"data": {"id": "a1", "title": "Pinned rules", "permalink": "/r/startups/comments/a1/",
                        "stickied": true}},
              {"data": {"id": "b2", "title": "How do you chase late invoices?",
                        "selftext": "Clients pay &gt; 60 days late.\\n\\nAny tools?",
                        "permalink": "/r/startups/comments/b2/late_invoices/", "author": "founder",
                        "score": 87, "num_comments": 23, "subreddit": "startups"}},
              {"data": {"id": "c3", "title": "Link post", "permalink": "/r/startups/comments/c3/"}},
              {"data": {"id": "d4", "title": "", "permalink": "/r/startups/comments/d4/"}}
            ]}}
            """;

    private OkHttpMockEngine engine;
    private PipelineProperties properties;
    private RedditSignalSource source;

    @BeforeEach
    void setUp() {
        engine = new OkHttpMockEngine();
        properties = new PipelineProperties();
        properties.getSources().getReddit().setBaseUrl("https://reddit.test");
        properties.getSources().getReddit().setSubreddits(List.of("startups"));
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T12:00:00Z"));
        source = new RedditSignalSource(engine.client(), PipelineConfiguration.objectMapper(),
                new SlidingWindowRateLimiter(properties, clock, clock), properties);
    }

    @Test
    void shouldRequestListingWithUserAgent() {
        engine.enqueueJson(200, LISTING);

        source.collect();

        HttpUrl url = engine.url(0);
        assertEquals("/r/startups/hot.json", url.encodedPath());
        assertEquals("25", url.queryParameter("limit"));
        assertEquals("golemcore-insight-pipeline/1.0", engine.requests().get(0).header("User-Agent"));
    }

    @Test
    void shouldMapPostsAndSkipStickiedOrUntitled() {
        engine.enqueueJson(200, LISTING);

        List<ScrapedItem> items = source.collect();

        assertEquals(2, items.size());
        ScrapedItem post = items.get(0);
        assertEquals("https://www.reddit.com/r/startups/comments/b2/late_invoices/", post.getUrl());
        assertEquals("How do you chase late invoices?\n\nClients pay > 60 days late. Any tools?", post.getContent());
        assertEquals("b2", post.getMetadata().get(MetadataKeys.EXTERNAL_ID));
        assertEquals("founder", post.getMetadata().get(MetadataKeys.AUTHOR));
        assertEquals(87, post.getMetadata().get(MetadataKeys.SCORE));
        assertEquals("startups", post.getMetadata().get(MetadataKeys.COMMUNITY));
        assertEquals("Link post", items.get(1).getContent());
    }

    @Test
    void shouldKeepPostsOfHealthySubreddits() {
        properties.getSources().getReddit().setSubreddits(List.of("startups", "SaaS"));
        engine.enqueueJson(503, "{}");
        engine.enqueueJson(200, LISTING);

        List<ScrapedItem> items = source.collect();

        assertEquals(2, items.size());
        assertEquals("/r/SaaS/hot.json", engine.url(1).encodedPath());
    }

    @Test
    void shouldFailWhenEverySubredditFails() {
        properties.getSources().getReddit().setSubreddits(List.of("startups", "SaaS"));
        engine.enqueueJson(503, "{}");
        engine.enqueueJson(502, "{}");

        assertThrows(TransientIOException.class, () -> source.collect());
    }

    @Test
    void forbiddenListingShouldNotBeTransient() {
        engine.enqueueJson(403, "{}");

        assertThrows(IllegalStateException.class, () -> source.collect());
    }
}
