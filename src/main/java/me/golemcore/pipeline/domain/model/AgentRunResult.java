package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentRunResult {

    private int itemsProcessed;
    private int itemsFailed;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    public static AgentRunResult empty() {
        return AgentRunResult.builder().build();
    }
}
