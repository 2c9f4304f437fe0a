package me.golemcore.pipeline.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One scraped item as it was ingested. The content hash is unique among
 * non-null values; rows without a hash are never compared.
 *
 * <p>
 * Known metadata keys are listed in {@link MetadataKeys}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawSignal {

    private String id;
    private String source;
    private String url;
    private String content;
    private String contentHash;

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    private boolean processed;
    private Instant createdAt;
}
