package me.golemcore.pipeline.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Market-size bucket of an insight or competitor.
 */
public enum MarketSize {

    SMALL("Small"), MEDIUM("Medium"), LARGE("Large");

    private final String label;

    MarketSize(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static MarketSize fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (MarketSize size : values()) {
            if (size.name().equals(normalized)) {
                return size;
            }
        }
        throw new IllegalArgumentException("Unknown market size: " + value);
    }
}
