package me.golemcore.pipeline.domain.exception;

public class ReviewTransitionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ReviewTransitionException(String message) {
        super(message);
    }
}
