package me.golemcore.pipeline.domain.exception;

import lombok.Getter;

/**
 * Insert rejected because a row with the same unique key already exists.
 */
@Getter
public class DuplicateContentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String contentHash;
    private final String existingId;

    public DuplicateContentException(String contentHash, String existingId) {
        super("Duplicate content hash " + contentHash + " (existing signal " + existingId + ")");
        this.contentHash = contentHash;
        this.existingId = existingId;
    }
}
