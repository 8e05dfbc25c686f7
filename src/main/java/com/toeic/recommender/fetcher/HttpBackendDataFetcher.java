package com.toeic.recommender.fetcher;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.*;
import com.toeic.recommender.exception.UpstreamAuthException;
import com.toeic.recommender.exception.UpstreamUnavailableException;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.function.Supplier;

/**
 * Reads learner profiles and item candidates from the backend's internal API.
 */
@Component
@ConditionalOnProperty(name = "toeic.recommender.data-source", havingValue = "http", matchIfMissing = true)
@Slf4j
public class HttpBackendDataFetcher implements DataFetcher {
    static final String API_KEY_HEADER = "X-Internal-API-Key";
    static final String INTERNAL_PREFIX = "/api/v1/internal";
    private static final double TOEIC_MAX_SCORE = 990.0;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    public HttpBackendDataFetcher(RestTemplate backendRestTemplate, ObjectMapper objectMapper, RecommenderProperties properties) {
        this.restTemplate = backendRestTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = properties.backend().baseUrl();
        this.apiKey = properties.backend().apiKey();
    }

    @Override
    @Retry(name = "backend")
    public InteractionHistory fetchInteractionHistory(String learnerId) {
        log.debug("Fetching profile for learner {}", learnerId);
        JsonNode body;
        try {
            body = call("profile of " + learnerId,
                    () -> exchange(HttpMethod.GET, url("/users/{id}/profile", learnerId), null));
        } catch (UpstreamUnavailableException e) {
            if (e.getCause() instanceof HttpClientErrorException.NotFound) {
                log.warn("Profile not found for learner {}, treating as new learner", learnerId);
                return InteractionHistory.empty(learnerId);
            }
            throw e;
        }

        JsonNode data = body == null ? null : body.path("data");
        if (data == null || !data.isObject()) {
            log.warn("Unexpected profile payload for learner {}: {}", learnerId, data == null ? "no body" : data.getNodeType());
            throw new UpstreamUnavailableException("Malformed backend payload for profile of " + learnerId);
        }
        return toHistory(learnerId, convert(data, BackendDtos.ProfileDto.class, "profile of " + learnerId));
    }

    @Override
    @Retry(name = "backend")
    public List<Item> fetchCatalog(ItemType itemType) {
        List<Item> items = new ArrayList<>();
        if (itemType == null || itemType == ItemType.TEST) {
            items.addAll(fetchCandidates("/tests/candidates", ItemType.TEST));
        }
        if (itemType == null || itemType == ItemType.LECTURE) {
            items.addAll(fetchCandidates("/lectures/candidates", ItemType.LECTURE));
        }
        return List.copyOf(items);
    }

    @Override
    public void saveFeedback(RecommendationFeedback feedback) {
        BackendDtos.FeedbackDto dto = new BackendDtos.FeedbackDto(feedback.learnerId(), feedback.itemId(),
                feedback.itemType().name().toLowerCase(Locale.ROOT), feedback.rating(), feedback.comment());
        call("feedback of " + feedback.learnerId(),
                () -> exchange(HttpMethod.POST, url("/recommendations/feedback"), dto));
    }

    private List<Item> fetchCandidates(String path, ItemType type) {
        log.debug("Fetching {} candidates", type);
        JsonNode body = call(type + " candidates", () -> exchange(HttpMethod.GET, url(path), null));
        JsonNode data = body == null ? null : body.path("data");
        if (data == null || !data.isArray()) {
            log.warn("Expected a list of {} candidates, got {}", type, data == null ? "no body" : data.getNodeType());
            throw new UpstreamUnavailableException("Malformed backend payload for " + type + " candidates");
        }

        List<Item> items = new ArrayList<>();
        for (JsonNode node : data) {
            if (!node.isObject()) {
                log.warn("Skipping malformed {} candidate: {}", type, node.getNodeType());
                continue;
            }
            BackendDtos.CandidateDto dto = convert(node, BackendDtos.CandidateDto.class, type + " candidate");
            String id = firstNonBlank(type == ItemType.TEST ? dto.testId() : dto.lectureId(), dto.id());
            if (id == null) {
                log.warn("Skipping {} candidate without id", type);
                continue;
            }
            items.add(new Item(id, type, dto.name(), cleanTopics(dto.topics()), dto.difficulty(), dto.popularity(),
                    parseLevel(dto.level()), cleanFeatures(dto.features())));
        }
        return items;
    }

    InteractionHistory toHistory(String learnerId, BackendDtos.ProfileDto profile) {
        List<Interaction> interactions = new ArrayList<>();
        if (profile.testHistory() != null) {
            for (BackendDtos.TestHistoryDto test : profile.testHistory()) {
                if (test == null || test.testId() == null || test.testId().isBlank()) continue;
                Double outcome = test.avgScore() == null ? null : clamp(test.avgScore() / TOEIC_MAX_SCORE);
                int attempts = test.attempt() == null ? 0 : test.attempt();
                interactions.add(new Interaction(test.testId(), InteractionType.COMPLETED, outcome,
                        parseInstant(test.lastAttemptAt()), attempts));
            }
        }
        if (profile.learningProgress() != null) {
            profile.learningProgress().forEach((lectureId, progress) -> {
                OptionalDouble percent = percentOf(progress);
                if (percent.isEmpty()) {
                    log.debug("Ignoring progress of lecture {} for learner {}: {}", lectureId, learnerId, progress);
                    return;
                }
                double p = percent.getAsDouble();
                InteractionType type = p >= 100.0 ? InteractionType.COMPLETED : InteractionType.IN_PROGRESS;
                Instant at = progress.isObject() ? parseInstant(progress.path("updatedAt").asText(null)) : null;
                interactions.add(new Interaction(lectureId, type, clamp(p / 100.0), at, 0));
            });
        }
        Integer current = profile.averageTotalScore() == null ? null : (int) Math.round(profile.averageTotalScore());
        LearnerAttributes attributes = new LearnerAttributes(profile.target(), current, parseLevel(profile.level()));
        return new InteractionHistory(learnerId, interactions, attributes);
    }

    private JsonNode exchange(HttpMethod method, String url, Object body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.set(API_KEY_HEADER, apiKey);
        }
        return restTemplate.exchange(url, method, new HttpEntity<>(body, headers), JsonNode.class).getBody();
    }

    private <T> T call(String description, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                log.warn("Backend rejected request for {}: {}", description, status);
                throw new UpstreamAuthException(status, "Backend rejected request for " + description + ": " + status);
            }
            log.warn("Backend request for {} failed: {} {}", description, status, e.getResponseBodyAsString());
            throw new UpstreamUnavailableException("Backend request for " + description + " failed with status " + status, e);
        } catch (RestClientException e) {
            log.warn("Backend unreachable for {}: {}", description, e.getMessage());
            throw new UpstreamUnavailableException("Backend unreachable for " + description + ": " + e.getMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type, String description) {
        try {
            return objectMapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new UpstreamUnavailableException("Malformed backend payload for " + description, e);
        }
    }

    private String url(String path, Object... uriVariables) {
        return UriComponentsBuilder.fromHttpUrl(baseUrl)
                .path(INTERNAL_PREFIX)
                .path(path)
                .buildAndExpand(uriVariables)
                .encode()
                .toUriString();
    }

    private static OptionalDouble percentOf(JsonNode progress) {
        if (progress == null) return OptionalDouble.empty();
        if (progress.isNumber()) return OptionalDouble.of(Math.min(progress.asDouble(), 100.0));
        if (progress.isObject() && progress.path("percent").isNumber()) {
            return OptionalDouble.of(Math.min(progress.path("percent").asDouble(), 100.0));
        }
        return OptionalDouble.empty();
    }

    private static List<String> cleanTopics(List<String> topics) {
        if (topics == null) return List.of();
        return topics.stream().filter(Objects::nonNull).map(String::trim).filter(t -> !t.isEmpty()).toList();
    }

    private static List<Double> cleanFeatures(List<Double> features) {
        // a vector with holes is reported as missing rather than patched
        if (features == null || features.contains(null)) return null;
        return features;
    }

    static ProficiencyLevel parseLevel(String level) {
        if (level == null || level.isBlank()) return null;
        try {
            return ProficiencyLevel.valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown proficiency level '{}'", level);
            return null;
        }
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException again) {
                log.debug("Unparseable timestamp '{}'", value);
                return null;
            }
        }
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (v != null && !v.isBlank()) return v;
        }
        return null;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
