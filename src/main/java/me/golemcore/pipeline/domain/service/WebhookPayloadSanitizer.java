package me.golemcore.pipeline.domain.service;

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

import me.golemcore.pipeline.infrastructure.config.PipelineProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Produces the copy of a webhook payload that may be stored: sensitive fields
 * of {@code data.object} are replaced by {@value #REDACTED}.
 */
@Component
public class WebhookPayloadSanitizer {

    public static final String REDACTED = "[REDACTED]";

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final Set<String> sensitiveFields;

    public WebhookPayloadSanitizer(ObjectMapper objectMapper, PipelineProperties properties) {
        this.objectMapper = objectMapper;
        this.sensitiveFields = new HashSet<>(properties.getWebhook().getSensitiveFields());
    }

    public Map<String, Object> sanitize(Map<String, Object> payload) {
        if (payload == null) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> copy = objectMapper.convertValue(payload, MAP_TYPE);
        if (copy.get("data") instanceof Map<?, ?> data && data.get("object") instanceof Map<?, ?> object) {
            @SuppressWarnings("unchecked")
            Map<String, Object> fields = (Map<String, Object>) object;
            for (String field : sensitiveFields) {
                if (fields.containsKey(field)) {
                    fields.put(field, REDACTED);
                }
            }
        }
        return copy;
    }
}
