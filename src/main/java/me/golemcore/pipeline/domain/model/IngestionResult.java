package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestionResult {

    @Builder.Default
    private List<RawSignal> saved = new ArrayList<>();

    private int duplicates;
    private int failed;

    public int savedCount() {
        return saved.size();
    }
}
