package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BulkReviewResult {

    @Builder.Default
    private List<String> processedIds = new ArrayList<>();

    /** Entry id to failure message. */
    @Builder.Default
    private Map<String, String> failures = new LinkedHashMap<>();
}
