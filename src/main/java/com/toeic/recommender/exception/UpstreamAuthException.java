package com.toeic.recommender.exception;

/** The backend rejected the internal API key. */
public class UpstreamAuthException extends RecommendationException {

    private final int status;

    public UpstreamAuthException(int status, String message) {
        super(message);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    @Override
    public String getCode() {
        return "UPSTREAM_AUTH_ERROR";
    }
}
