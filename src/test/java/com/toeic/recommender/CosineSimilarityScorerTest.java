package com.toeic.recommender;

import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.*;
import com.toeic.recommender.exception.InvalidFeatureDimensionException;
import com.toeic.recommender.similarity.CosineSimilarityScorer;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityScorerTest {
    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final CosineSimilarityScorer scorer = new CosineSimilarityScorer(RecommenderProperties.defaults());

    @Test
    void scoresListeningCandidatesAboveReadingForListeningLearner() {
        List<Item> catalog = new ArrayList<>();
        List<Interaction> interactions = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            catalog.add(Item.test("done-" + i, "Done " + i, List.of("listening"), 500, 10.0));
            interactions.add(Interaction.completed("done-" + i, 0.7, NOW));
        }
        List<Item> candidates = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            candidates.add(Item.test("lis-" + i, "Listening " + i, List.of("listening"), 500, 1.0));
            candidates.add(Item.test("read-" + i, "Reading " + i, List.of("reading"), 500, 100.0));
        }
        catalog.addAll(candidates);
        var history = new InteractionHistory("u1", interactions, LearnerAttributes.NONE);

        Map<String, Double> scores = scorer.score(history, candidates, catalog);

        assertEquals(10, scores.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(1.0, scores.get("lis-" + i), 1e-9);
            assertEquals(0.0, scores.get("read-" + i), 1e-9);
        }
    }

    @Test
    void returnsEmptyWhenNoInteractionResolvesToCatalogItem() {
        List<Item> catalog = List.of(Item.test("t1", "T1", List.of("listening"), 400, 5.0));
        var history = new InteractionHistory("u1",
                List.of(Interaction.completed("unknown-item", 0.9, NOW)), LearnerAttributes.NONE);

        assertTrue(scorer.score(history, catalog, catalog).isEmpty());
    }

    @Test
    void returnsEmptyForEmptyCandidateSet() {
        List<Item> catalog = List.of(Item.test("t1", "T1", List.of("listening"), 400, 5.0));
        var history = new InteractionHistory("u1", List.of(Interaction.completed("t1", 0.9, NOW)), LearnerAttributes.NONE);

        assertTrue(scorer.score(history, List.of(), catalog).isEmpty());
    }

    @Test
    void returnsEmptyWhenProfileIsAllZero() {
        // the only interacted item has no topics, so the profile carries no signal
        Item untagged = Item.test("t0", "Untagged", List.of(), 400, 5.0);
        Item candidate = Item.test("t1", "T1", List.of("reading"), 400, 5.0);
        var history = new InteractionHistory("u1", List.of(Interaction.completed("t0", 0.9, NOW)), LearnerAttributes.NONE);

        assertTrue(scorer.score(history, List.of(candidate), List.of(untagged, candidate)).isEmpty());
    }

    @Test
    void interactionsBelowMinimumOutcomeDoNotShapeProfile() {
        var props = RecommenderProperties.defaults().withSimilarity(
                new RecommenderProperties.Similarity(RecommenderProperties.FeatureMode.TOPICS, 1.0, 0.5, 0.5, 0.5, 0));
        var strict = new CosineSimilarityScorer(props);
        Item failed = Item.test("failed", "Failed", List.of("reading"), 400, 5.0);
        Item passed = Item.test("passed", "Passed", List.of("listening"), 400, 5.0);
        Item readingCandidate = Item.test("r", "R", List.of("reading"), 400, 5.0);
        Item listeningCandidate = Item.test("l", "L", List.of("listening"), 400, 5.0);
        var history = new InteractionHistory("u1", List.of(
                Interaction.completed("failed", 0.1, NOW),
                Interaction.completed("passed", 0.8, NOW)), LearnerAttributes.NONE);

        Map<String, Double> scores = strict.score(history, List.of(readingCandidate, listeningCandidate),
                List.of(failed, passed, readingCandidate, listeningCandidate));

        assertEquals(0.0, scores.get("r"), 1e-9);
        assertEquals(1.0, scores.get("l"), 1e-9);
    }

    @Test
    void recentInteractionsWeighMoreThanOldOnes() {
        Item oldReading = Item.test("old", "Old", List.of("reading"), 400, 5.0);
        Item recentListening = Item.test("recent", "Recent", List.of("listening"), 400, 5.0);
        Item readingCandidate = Item.test("r", "R", List.of("reading"), 400, 5.0);
        Item listeningCandidate = Item.test("l", "L", List.of("listening"), 400, 5.0);
        var history = new InteractionHistory("u1", List.of(
                Interaction.completed("old", 0.8, NOW.minus(90, ChronoUnit.DAYS)),
                Interaction.completed("recent", 0.8, NOW)), LearnerAttributes.NONE);

        Map<String, Double> scores = scorer.score(history, List.of(readingCandidate, listeningCandidate),
                List.of(oldReading, recentListening, readingCandidate, listeningCandidate));

        assertTrue(scores.get("l") > scores.get("r"));
    }

    @Test
    void sameInputGivesSameScores() {
        List<Item> catalog = List.of(
                Item.test("a", "A", List.of("listening", "part1"), 400, 5.0),
                Item.test("b", "B", List.of("reading", "part5"), 400, 5.0),
                Item.test("c", "C", List.of("listening", "part5"), 400, 5.0),
                Item.lecture("d", "D", List.of("part1"), 5.0));
        var history = new InteractionHistory("u1", List.of(
                Interaction.completed("a", 0.6, NOW.minus(3, ChronoUnit.DAYS)),
                new Interaction("d", InteractionType.IN_PROGRESS, 0.3, NOW, 0)), LearnerAttributes.NONE);
        List<Item> candidates = catalog.subList(1, 3);

        assertEquals(scorer.score(history, candidates, catalog), scorer.score(history, candidates, catalog));
    }

    @Test
    void explicitModeRejectsMismatchedFeatureVector() {
        var props = RecommenderProperties.defaults().withSimilarity(
                new RecommenderProperties.Similarity(RecommenderProperties.FeatureMode.EXPLICIT, 1.0, 0.5, 0.5, 0.0, 30));
        var explicit = new CosineSimilarityScorer(props);
        Item done = new Item("done", ItemType.TEST, "Done", List.of(), 500, 1.0, null, List.of(1.0, 0.0, 0.0));
        Item good = new Item("good", ItemType.TEST, "Good", List.of(), 500, 1.0, null, List.of(0.5, 0.5, 0.0));
        Item bad = new Item("bad", ItemType.TEST, "Bad", List.of(), 500, 1.0, null, List.of(1.0, 0.0));
        var history = new InteractionHistory("u1", List.of(Interaction.completed("done", 0.9, NOW)), LearnerAttributes.NONE);

        var ex = assertThrows(InvalidFeatureDimensionException.class,
                () -> explicit.score(history, List.of(good, bad), List.of(done, good, bad)));
        assertEquals("bad", ex.getItemId());
        assertEquals(3, ex.getExpected());
        assertEquals(2, ex.getActual());
    }

    @Test
    void explicitModeTreatsMissingVectorAsDimensionMismatch() {
        var props = RecommenderProperties.defaults().withSimilarity(
                new RecommenderProperties.Similarity(RecommenderProperties.FeatureMode.EXPLICIT, 1.0, 0.5, 0.5, 0.0, 30));
        var explicit = new CosineSimilarityScorer(props);
        Item done = new Item("done", ItemType.TEST, "Done", List.of(), 500, 1.0, null, List.of(1.0, 0.0));
        Item missing = new Item("missing", ItemType.LECTURE, "Missing", List.of("reading"), null, 1.0, null, null);
        var history = new InteractionHistory("u1", List.of(Interaction.completed("done", 0.9, NOW)), LearnerAttributes.NONE);

        assertThrows(InvalidFeatureDimensionException.class,
                () -> explicit.score(history, List.of(missing), List.of(done, missing)));
    }

    @Test
    void explicitModeRejectsHistoryItemWithoutVector() {
        var props = RecommenderProperties.defaults().withSimilarity(
                new RecommenderProperties.Similarity(RecommenderProperties.FeatureMode.EXPLICIT, 1.0, 0.5, 0.5, 0.0, 30));
        var explicit = new CosineSimilarityScorer(props);
        Item done = new Item("done", ItemType.TEST, "Done", List.of(), 500, 1.0, null, null);
        Item candidate = new Item("cand", ItemType.TEST, "Candidate", List.of(), 500, 1.0, null, List.of(1.0, 0.0));
        var history = new InteractionHistory("u1", List.of(Interaction.completed("done", 0.9, NOW)), LearnerAttributes.NONE);

        var ex = assertThrows(InvalidFeatureDimensionException.class,
                () -> explicit.score(history, List.of(candidate), List.of(done, candidate)));
        assertEquals("done", ex.getItemId());
        assertEquals(-1, ex.getExpected());
        assertEquals(0, ex.getActual());
    }

    @Test
    void explicitModeReportsDimensionOfLaterHistoryVector() {
        var props = RecommenderProperties.defaults().withSimilarity(
                new RecommenderProperties.Similarity(RecommenderProperties.FeatureMode.EXPLICIT, 1.0, 0.5, 0.5, 0.0, 30));
        var explicit = new CosineSimilarityScorer(props);
        Item bare = new Item("bare", ItemType.LECTURE, "Bare", List.of("reading"), null, 1.0, null, null);
        Item done = new Item("done", ItemType.TEST, "Done", List.of(), 500, 1.0, null, List.of(1.0, 0.0, 0.0));
        Item candidate = new Item("cand", ItemType.TEST, "Candidate", List.of(), 500, 1.0, null, List.of(1.0, 0.0, 0.0));
        var history = new InteractionHistory("u1", List.of(
                Interaction.completed("bare", 0.9, NOW),
                Interaction.completed("done", 0.9, NOW)), LearnerAttributes.NONE);

        var ex = assertThrows(InvalidFeatureDimensionException.class,
                () -> explicit.score(history, List.of(candidate), List.of(bare, done, candidate)));
        assertEquals("bare", ex.getItemId());
        assertEquals(3, ex.getExpected());
    }

    @Test
    void explicitModeScoresMatchingVectors() {
        var props = RecommenderProperties.defaults().withSimilarity(
                new RecommenderProperties.Similarity(RecommenderProperties.FeatureMode.EXPLICIT, 1.0, 0.5, 0.5, 0.0, 30));
        var explicit = new CosineSimilarityScorer(props);
        Item done = new Item("done", ItemType.TEST, "Done", List.of(), 500, 1.0, null, List.of(1.0, 0.0));
        Item same = new Item("same", ItemType.TEST, "Same", List.of(), 500, 1.0, null, List.of(2.0, 0.0));
        Item opposite = new Item("opp", ItemType.TEST, "Opposite", List.of(), 500, 1.0, null, List.of(-1.0, 0.0));
        var history = new InteractionHistory("u1", List.of(Interaction.completed("done", 0.9, NOW)), LearnerAttributes.NONE);

        Map<String, Double> scores = explicit.score(history, List.of(same, opposite), List.of(done, same, opposite));

        assertEquals(1.0, scores.get("same"), 1e-9);
        assertEquals(-1.0, scores.get("opp"), 1e-9);
    }
}
