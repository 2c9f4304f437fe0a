package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Normalized record produced by a signal source: plain-text content plus an
 * open metadata map.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScrapedItem {

    private String url;
    private String title;
    private String content;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();
}
