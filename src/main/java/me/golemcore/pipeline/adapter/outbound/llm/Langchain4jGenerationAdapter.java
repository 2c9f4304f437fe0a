package me.golemcore.pipeline.adapter.outbound.llm;

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

import me.golemcore.pipeline.domain.exception.ConfigurationException;
import me.golemcore.pipeline.domain.exception.InsightValidationException;
import me.golemcore.pipeline.domain.model.GenerationRequest;
import me.golemcore.pipeline.domain.model.GenerationResponse;
import me.golemcore.pipeline.domain.model.InsightDraft;
import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import me.golemcore.pipeline.port.outbound.GenerationPort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ResponseFormat;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.output.TokenUsage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Generation adapter backed by a langchain4j {@link ChatModel}.
 *
 * <p>
 * Supports an OpenAI-compatible endpoint (JSON response format) and
 * Anthropic. Models are built lazily per (model, temperature, max tokens) and
 * reused. Client-side retries are disabled: the analysis service owns the
 * retry policy.
 *
 * <p>
 * Reply text is parsed as an {@link InsightDraft}; parse failures become
 * {@link InsightValidationException}, client failures are classified by
 * {@link GenerationErrorClassifier}.
 */
@Component
@Slf4j
public class Langchain4jGenerationAdapter implements GenerationPort {

    static final String PROVIDER_OPENAI = "openai";
    static final String PROVIDER_ANTHROPIC = "anthropic";

    static final String DEFAULT_SYSTEM_PROMPT = """
            You analyze a market signal (a post, discussion or article) and extract one business insight.
            Reply with a single JSON object and nothing else, with these fields:
              "title": short title of the opportunity,
              "problem_statement": the problem people describe,
              "proposed_solution": a product that would solve it,
              "market_size": one of "Small", "Medium", "Large",
              "relevance_score": number between 0 and 1,
              "competitors": up to 3 objects with "name", "url", "description", "market_position",
              "dimension_scores": object with integer scores from 1 to 10 for "opportunity", "problem",
                "feasibility", "why_now", "execution_difficulty", "go_to_market", "founder_fit".
            """;

    private final PipelineProperties.AnalysisProperties analysis;
    private final ObjectMapper objectMapper;
    private final Map<String, ChatModel> models = new ConcurrentHashMap<>();

    public Langchain4jGenerationAdapter(PipelineProperties properties, ObjectMapper objectMapper) {
        this.analysis = properties.getAnalysis();
        this.objectMapper = objectMapper;
    }

    @Override
    public String getProviderId() {
        return provider();
    }

    @Override
    public GenerationResponse generate(GenerationRequest request) {
        ChatModel model = resolveModel(request);
        ChatRequest chatRequest = buildChatRequest(request);

        ChatResponse response;
        try {
            response = model.chat(chatRequest);
        } catch (RuntimeException e) {
            String code = GenerationErrorClassifier.classify(e);
            log.debug("[Analysis] Generation call failed ({}): {}", code, e.getMessage());
            throw GenerationErrorClassifier.toAnalysisException(e);
        }

        if (response == null || response.aiMessage() == null || response.aiMessage().text() == null) {
            throw new InsightValidationException(List.of("empty reply from model"));
        }

        InsightDraft draft = parseDraft(response.aiMessage().text());
        TokenUsage usage = response.tokenUsage();
        return GenerationResponse.builder()
                .draft(draft)
                .model(request.getModel())
                .inputTokens(usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0)
                .outputTokens(usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0)
                .build();
    }

    InsightDraft parseDraft(String text) {
        String json = stripCodeFence(text.trim());
        try {
            InsightDraft draft = objectMapper.readValue(json, InsightDraft.class);
            if (draft == null) {
                throw new InsightValidationException(List.of("reply is not a JSON object"));
            }
            return draft;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InsightValidationException("Malformed structured output: " + e.getMessage(), e);
        }
    }

    private ChatRequest buildChatRequest(GenerationRequest request) {
        String systemPrompt = request.getSystemPrompt() != null ? request.getSystemPrompt() : DEFAULT_SYSTEM_PROMPT;
        StringBuilder user = new StringBuilder();
        user.append("Source: ").append(request.getSource()).append('\n');
        if (request.getTitle() != null) {
            user.append("Title: ").append(request.getTitle()).append('\n');
        }
        user.append('\n').append(request.getContent());

        List<ChatMessage> messages = List.of(SystemMessage.from(systemPrompt), UserMessage.from(user.toString()));
        ChatRequest.Builder builder = ChatRequest.builder().messages(messages);
        if (PROVIDER_OPENAI.equals(provider())) {
            builder.responseFormat(ResponseFormat.JSON);
        }
        return builder.build();
    }

    private ChatModel resolveModel(GenerationRequest request) {
        String key = request.getModel() + "|" + request.getTemperature() + "|" + request.getMaxTokens();
        return models.computeIfAbsent(key, k -> createModel(request.getModel(), request.getTemperature(),
                request.getMaxTokens()));
    }

    protected ChatModel createModel(String modelName, Double temperature, Integer maxTokens) {
        String apiKey = analysis.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("Missing API key for generation provider '" + provider()
                    + "' (pipeline.analysis.api-key)");
        }
        Duration timeout = Duration.ofMillis(analysis.getAttemptTimeoutMs());
        String provider = provider();
        log.info("[Analysis] Creating {} model {}", provider, modelName);

        if (PROVIDER_ANTHROPIC.equals(provider)) {
            var builder = AnthropicChatModel.builder()
                    .apiKey(apiKey)
                    .modelName(modelName)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .maxRetries(0)
                    .timeout(timeout);
            if (analysis.getBaseUrl() != null && !analysis.getBaseUrl().isBlank()) {
                builder.baseUrl(analysis.getBaseUrl());
            }
            return builder.build();
        }
        if (!PROVIDER_OPENAI.equals(provider)) {
            throw new ConfigurationException("Unsupported generation provider: " + provider);
        }

        var builder = OpenAiChatModel.builder()
                .apiKey(apiKey)
                .modelName(modelName)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .maxRetries(0)
                .timeout(timeout);
        if (analysis.getBaseUrl() != null && !analysis.getBaseUrl().isBlank()) {
            builder.baseUrl(analysis.getBaseUrl());
        }
        return builder.build();
    }

    private String provider() {
        return analysis.getProvider() != null ? analysis.getProvider().trim().toLowerCase(Locale.ROOT)
                : PROVIDER_OPENAI;
    }

    private static String stripCodeFence(String text) {
        if (!text.startsWith("```")) {
            return text;
        }
        int firstNewline = text.indexOf('\n');
        int closing = text.lastIndexOf("```");
        if (firstNewline < 0 || closing <= firstNewline) {
            return text;
        }
        return text.substring(firstNewline + 1, closing).trim();
    }
}
