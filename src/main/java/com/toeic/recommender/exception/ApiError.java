package com.toeic.recommender.exception;

import java.time.Instant;

public record ApiError(String errorId, String code, String message, String path, Instant timestamp) {
    public static final String VALIDATION_ERROR = "VALIDATION_ERROR";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
