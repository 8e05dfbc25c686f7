package com.toeic.recommender.domain;

import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

public class DomainModels {
    public enum ItemType { TEST, LECTURE }

    public enum InteractionType { ATTEMPTED, IN_PROGRESS, COMPLETED }

    public enum ProficiencyLevel { BEGINNER, INTERMEDIATE, ADVANCED }

    /**
     * Catalog entry. {@code difficulty} is on the TOEIC score scale (0..990), {@code features} is the
     * backend-supplied vector and is only consulted in explicit feature mode.
     */
    public record Item(String id,
                       ItemType type,
                       String name,
                       List<String> topics,
                       Integer difficulty,
                       Double popularity,
                       ProficiencyLevel level,
                       List<Double> features) {
        public Item {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(type, "type");
            topics = topics == null ? List.of() : List.copyOf(topics);
            features = features == null ? null : List.copyOf(features);
        }

        public static Item test(String id, String name, List<String> topics, Integer difficulty, Double popularity) {
            return new Item(id, ItemType.TEST, name, topics, difficulty, popularity, null, null);
        }

        public static Item lecture(String id, String name, List<String> topics, Double popularity) {
            return new Item(id, ItemType.LECTURE, name, topics, null, popularity, null, null);
        }
    }

    /** {@code outcome} is normalized to [0,1]; {@code attempts} is 0 when unknown. */
    public record Interaction(String itemId, InteractionType type, Double outcome, Instant occurredAt, int attempts) {
        public Interaction {
            Objects.requireNonNull(itemId, "itemId");
            Objects.requireNonNull(type, "type");
        }

        public static Interaction completed(String itemId, Double outcome, Instant occurredAt) {
            return new Interaction(itemId, InteractionType.COMPLETED, outcome, occurredAt, 1);
        }
    }

    public record LearnerAttributes(Integer targetScore, Integer currentScore, ProficiencyLevel level) {
        public static final LearnerAttributes NONE = new LearnerAttributes(null, null, null);

        public boolean isEmpty() {
            return targetScore == null && currentScore == null && level == null;
        }
    }

    public record InteractionHistory(String learnerId, List<Interaction> interactions, LearnerAttributes attributes) {
        public InteractionHistory {
            Objects.requireNonNull(learnerId, "learnerId");
            interactions = interactions == null ? List.of() : List.copyOf(interactions);
            attributes = attributes == null ? LearnerAttributes.NONE : attributes;
        }

        public static InteractionHistory empty(String learnerId) {
            return new InteractionHistory(learnerId, List.of(), LearnerAttributes.NONE);
        }

        public int size() {
            return interactions.size();
        }

        public boolean isEmpty() {
            return interactions.isEmpty();
        }

        public Set<String> completedItemIds() {
            return interactions.stream()
                    .filter(i -> i.type() == InteractionType.COMPLETED)
                    .map(Interaction::itemId)
                    .collect(Collectors.toSet());
        }

        public Optional<Interaction> interactionFor(String itemId) {
            return interactions.stream().filter(i -> i.itemId().equals(itemId)).findFirst();
        }
    }

    public record RecommendationFeedback(String learnerId, String itemId, ItemType itemType, int rating, String comment) {}
}
