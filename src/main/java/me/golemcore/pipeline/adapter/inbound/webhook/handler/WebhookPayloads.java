package me.golemcore.pipeline.adapter.inbound.webhook.handler;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Field access helpers for loosely typed webhook bodies.
 */
final class WebhookPayloads {

    private WebhookPayloads() {
    }

    static Map<?, ?> requireData(Map<String, Object> payload) {
        if (!(payload.get("data") instanceof Map<?, ?> data)) {
            throw new IllegalArgumentException("'data' must be an object");
        }
        return data;
    }

    static String requireString(Map<?, ?> map, String key) {
        String value = optionalString(map, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + key + "' is required");
        }
        return value;
    }

    static String optionalString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    static Map<String, Object> optionalMap(Map<?, ?> map, String key) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (map.get(key) instanceof Map<?, ?> nested) {
            nested.forEach((k, v) -> copy.put(String.valueOf(k), v));
        }
        return copy;
    }
}
