package com.toeic.recommender.exception;

/** The backend (or local catalog store) could not deliver a snapshot. */
public class UpstreamUnavailableException extends RecommendationException {

    public UpstreamUnavailableException(String message) {
        super(message);
    }

    public UpstreamUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String getCode() {
        return "UPSTREAM_UNAVAILABLE";
    }
}
