package com.toeic.recommender;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.*;
import com.toeic.recommender.exception.UpstreamAuthException;
import com.toeic.recommender.exception.UpstreamUnavailableException;
import com.toeic.recommender.fetcher.HttpBackendDataFetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class HttpBackendDataFetcherTest {
    private static final String BASE = "http://backend.test/api/v1/internal";

    private MockRestServiceServer server;
    private HttpBackendDataFetcher fetcher;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        var props = new RecommenderProperties(RecommenderProperties.DataSourceKind.HTTP,
                new RecommenderProperties.Backend("http://backend.test", "secret", Duration.ofSeconds(1), Duration.ofSeconds(1)),
                RecommenderProperties.Ranking.defaults(),
                RecommenderProperties.Similarity.defaults(),
                RecommenderProperties.ColdStart.defaults());
        fetcher = new HttpBackendDataFetcher(restTemplate, new ObjectMapper(), props);
    }

    @Test
    void mapsProfileToInteractionHistory() {
        server.expect(requestTo(BASE + "/users/u1/profile"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("X-Internal-API-Key", "secret"))
                .andRespond(withSuccess("""
                        {"data": {
                          "userId": "u1",
                          "target": 650,
                          "averageTotalScore": 520.4,
                          "level": "intermediate",
                          "testHistory": [
                            {"testId": "T1", "attempt": 2, "avgScore": 495, "lastAttemptAt": "2025-01-10T08:00:00Z"},
                            {"testId": "T2", "attempts": 1, "averageScore": 990},
                            {"name": "no id"}
                          ],
                          "learningProgress": {
                            "L1": {"percent": 100, "updatedAt": "2025-01-12T09:30:00"},
                            "L2": 40,
                            "L3": "junk"
                          }
                        }}
                        """, MediaType.APPLICATION_JSON));

        InteractionHistory history = fetcher.fetchInteractionHistory("u1");

        server.verify();
        assertEquals("u1", history.learnerId());
        assertEquals(4, history.size());
        assertEquals(new LearnerAttributes(650, 520, ProficiencyLevel.INTERMEDIATE), history.attributes());

        Interaction t1 = history.interactionFor("T1").orElseThrow();
        assertEquals(InteractionType.COMPLETED, t1.type());
        assertEquals(0.5, t1.outcome(), 1e-9);
        assertEquals(2, t1.attempts());
        assertEquals(Instant.parse("2025-01-10T08:00:00Z"), t1.occurredAt());

        assertEquals(1.0, history.interactionFor("T2").orElseThrow().outcome(), 1e-9);

        Interaction l1 = history.interactionFor("L1").orElseThrow();
        assertEquals(InteractionType.COMPLETED, l1.type());
        assertEquals(Instant.parse("2025-01-12T09:30:00Z"), l1.occurredAt());

        Interaction l2 = history.interactionFor("L2").orElseThrow();
        assertEquals(InteractionType.IN_PROGRESS, l2.type());
        assertEquals(0.4, l2.outcome(), 1e-9);
        assertTrue(history.interactionFor("L3").isEmpty());
    }

    @Test
    void unknownLearnerGetsEmptyHistory() {
        server.expect(requestTo(BASE + "/users/nobody/profile"))
                .andRespond(withStatus(HttpStatus.NOT_FOUND));

        InteractionHistory history = fetcher.fetchInteractionHistory("nobody");

        assertTrue(history.isEmpty());
        assertTrue(history.attributes().isEmpty());
    }

    @Test
    void malformedProfilePayloadIsUnavailable() {
        server.expect(requestTo(BASE + "/users/u1/profile"))
                .andRespond(withSuccess("{\"data\": \"oops\"}", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamUnavailableException.class, () -> fetcher.fetchInteractionHistory("u1"));
        server.verify();
    }

    @Test
    void profileWithoutDataIsUnavailable() {
        server.expect(requestTo(BASE + "/users/u1/profile"))
                .andRespond(withSuccess("{\"status\": \"ok\"}", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamUnavailableException.class, () -> fetcher.fetchInteractionHistory("u1"));
    }

    @Test
    void rejectedApiKeyIsAuthError() {
        server.expect(requestTo(BASE + "/users/u1/profile"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

        var ex = assertThrows(UpstreamAuthException.class, () -> fetcher.fetchInteractionHistory("u1"));
        assertEquals(401, ex.getStatus());
    }

    @Test
    void serverErrorIsUnavailable() {
        server.expect(requestTo(BASE + "/tests/candidates"))
                .andRespond(withServerError());

        assertThrows(UpstreamUnavailableException.class, () -> fetcher.fetchCatalog(ItemType.TEST));
    }

    @Test
    void connectionFailureIsUnavailable() {
        server.expect(requestTo(BASE + "/users/u1/profile"))
                .andRespond(request -> {
                    throw new IOException("connection refused");
                });

        assertThrows(UpstreamUnavailableException.class, () -> fetcher.fetchInteractionHistory("u1"));
    }

    @Test
    void fetchesTestsAndLectures() {
        server.expect(requestTo(BASE + "/tests/candidates"))
                .andRespond(withSuccess("""
                        {"data": [
                          {"testId": "T1", "name": "Mock Test 1", "difficulty": 550,
                           "topics": ["listening", " part2 ", null], "totalUserAttempt": 120, "level": "beginner"},
                          {"name": "missing id"},
                          {"testId": "T2", "name": "Mock Test 2", "topics": [], "features": [0.1, null]}
                        ]}
                        """, MediaType.APPLICATION_JSON));
        server.expect(requestTo(BASE + "/lectures/candidates"))
                .andRespond(withSuccess("""
                        {"data": [
                          {"lectureId": "L1", "name": "Part 5 Grammar", "topics": ["grammar"], "features": [0.2, 0.8]}
                        ]}
                        """, MediaType.APPLICATION_JSON));

        List<Item> catalog = fetcher.fetchCatalog(null);

        server.verify();
        assertEquals(List.of("T1", "T2", "L1"), catalog.stream().map(Item::id).toList());
        Item t1 = catalog.get(0);
        assertEquals(ItemType.TEST, t1.type());
        assertEquals(List.of("listening", "part2"), t1.topics());
        assertEquals(550, t1.difficulty());
        assertEquals(120.0, t1.popularity(), 1e-9);
        assertEquals(ProficiencyLevel.BEGINNER, t1.level());
        assertNull(catalog.get(1).features());
        assertEquals(ItemType.LECTURE, catalog.get(2).type());
        assertEquals(List.of(0.2, 0.8), catalog.get(2).features());
    }

    @Test
    void nonListCandidatePayloadIsUnavailable() {
        server.expect(requestTo(BASE + "/lectures/candidates"))
                .andRespond(withSuccess("{\"data\": {\"unexpected\": true}}", MediaType.APPLICATION_JSON));

        assertThrows(UpstreamUnavailableException.class, () -> fetcher.fetchCatalog(ItemType.LECTURE));
        server.verify();
    }

    @Test
    void emptyCandidateListIsValid() {
        server.expect(requestTo(BASE + "/lectures/candidates"))
                .andRespond(withSuccess("{\"data\": []}", MediaType.APPLICATION_JSON));

        assertTrue(fetcher.fetchCatalog(ItemType.LECTURE).isEmpty());
    }

    @Test
    void postsFeedback() {
        server.expect(requestTo(BASE + "/recommendations/feedback"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("X-Internal-API-Key", "secret"))
                .andExpect(content().json("{\"userId\":\"u1\",\"itemId\":\"T1\",\"itemType\":\"test\",\"rating\":4}"))
                .andRespond(withSuccess());

        fetcher.saveFeedback(new RecommendationFeedback("u1", "T1", ItemType.TEST, 4, null));

        server.verify();
    }
}
