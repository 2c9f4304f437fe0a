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

import me.golemcore.pipeline.domain.exception.TransientIOException;
import me.golemcore.pipeline.port.outbound.SignalSourcePort;
import me.golemcore.pipeline.ratelimit.SourceRateLimiter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Base of the OkHttp signal sources. Every request first takes a slot from
 * the {@link SourceRateLimiter} under the source id, sleeping while the
 * window is full.
 */
@Slf4j
public abstract class AbstractHttpSignalSource implements SignalSourcePort {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0]+");
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int HTTP_SERVER_ERROR = 500;

    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final SourceRateLimiter rateLimiter;

    protected AbstractHttpSignalSource(OkHttpClient httpClient, ObjectMapper objectMapper,
            SourceRateLimiter rateLimiter) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
    }

    /**
     * GET a JSON document.
     *
     * @throws TransientIOException
     *             on network errors, 429 and 5xx responses
     * @throws IllegalStateException
     *             on other unsuccessful responses
     */
    protected JsonNode getJson(HttpUrl url, Map<String, String> headers) {
        acquireSlot();

        Request.Builder requestBuilder = new Request.Builder().url(url).get();
        headers.forEach(requestBuilder::header);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                int code = response.code();
                String message = sourceId() + " returned HTTP " + code + " for " + url.encodedPath();
                if (code == HTTP_TOO_MANY_REQUESTS || code >= HTTP_SERVER_ERROR) {
                    throw new TransientIOException(message);
                }
                throw new IllegalStateException(message);
            }
            return objectMapper.readTree(body.string());
        } catch (IOException e) {
            throw new TransientIOException(sourceId() + " request failed: " + e.getMessage(), e);
        }
    }

    /**
     * Plain text of an HTML fragment: tags dropped, entities decoded,
     * whitespace (including non-breaking spaces) collapsed.
     */
    static String cleanText(String text) {
        if (text == null || text.isBlank()) {
            return "";
        }
        String plain = Jsoup.parse(text).text();
        return WHITESPACE.matcher(plain).replaceAll(" ").trim();
    }

    protected void logSummary(int requests, int items) {
        log.info("[Scraper] {}: {} items from {} requests", sourceId(), items, requests);
    }

    private void acquireSlot() {
        try {
            Duration waited = rateLimiter.acquireBlocking(sourceId());
            if (!waited.isZero()) {
                log.debug("[Scraper] {} waited {} ms for a rate limit slot", sourceId(), waited.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientIOException("Interrupted while waiting for " + sourceId() + " rate limit", e);
        }
    }
}
