package com.toeic.recommender.exception;

/** Base type of the failures the recommendation pipeline surfaces to its caller. */
public abstract class RecommendationException extends RuntimeException {

    protected RecommendationException(String message) {
        super(message);
    }

    protected RecommendationException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Stable error code reported to API clients. */
    public abstract String getCode();
}
