package me.golemcore.pipeline.domain.exception;

public class SimilarityResolutionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public SimilarityResolutionException(String message) {
        super(message);
    }
}
