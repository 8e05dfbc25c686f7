package com.toeic.recommender.fetcher;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Payloads of the backend's internal API. Field aliases cover the naming variants the backend has used.
 */
public class BackendDtos {
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProfileDto(String userId,
                             Integer target,
                             @JsonAlias({"average_total_score"}) Double averageTotalScore,
                             String level,
                             List<TestHistoryDto> testHistory,
                             Map<String, JsonNode> learningProgress) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TestHistoryDto(@JsonAlias({"test_id"}) String testId,
                                 @JsonAlias({"attempts", "attemptCount"}) Integer attempt,
                                 @JsonAlias({"averageScore", "avg_score"}) Double avgScore,
                                 @JsonAlias({"lastAttemptedAt", "updatedAt"}) String lastAttemptAt) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CandidateDto(String testId,
                               String lectureId,
                               String id,
                               String name,
                               Integer difficulty,
                               List<String> topics,
                               @JsonAlias({"totalUserAttempt", "totalViews"}) Double popularity,
                               String level,
                               List<Double> features) {}

    public record FeedbackDto(String userId, String itemId, String itemType, int rating, String comment) {}
}
