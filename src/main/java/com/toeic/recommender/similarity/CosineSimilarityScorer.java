package com.toeic.recommender.similarity;

import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.Interaction;
import com.toeic.recommender.domain.DomainModels.InteractionHistory;
import com.toeic.recommender.domain.DomainModels.Item;
import com.toeic.recommender.exception.InvalidFeatureDimensionException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Content-based scorer: the learner profile is the weighted mean of the feature vectors of positively
 * interacted items, each candidate is scored by cosine similarity against it.
 */
@Component
public class CosineSimilarityScorer implements SimilarityScorer {
    private static final double MILLIS_PER_DAY = 86_400_000d;

    private final RecommenderProperties.Similarity settings;
    private final boolean explicit;
    private final FeatureVectorizer vectorizer;

    public CosineSimilarityScorer(RecommenderProperties properties) {
        this.settings = properties.similarity();
        this.explicit = settings.featureMode() == RecommenderProperties.FeatureMode.EXPLICIT;
        this.vectorizer = explicit ? new ExplicitFeatureVectorizer() : new TopicFeatureVectorizer();
    }

    @Override
    public Map<String, Double> score(InteractionHistory history, List<Item> candidates, List<Item> catalog) {
        if (candidates.isEmpty() || history.isEmpty()) return Map.of();

        FeatureVectorizer.FeatureSpace space = vectorizer.prepare(catalog);
        double[] profile = profileVector(history, catalog, space);
        if (profile == null || norm(profile) == 0.0) return Map.of();

        Map<String, Double> scores = new LinkedHashMap<>();
        for (Item candidate : candidates) {
            double[] vector = space.vectorOf(candidate);
            if (vector.length != profile.length) {
                throw new InvalidFeatureDimensionException(candidate.id(), profile.length, vector.length);
            }
            scores.put(candidate.id(), cosine(profile, vector));
        }
        return scores;
    }

    double[] profileVector(InteractionHistory history, List<Item> catalog, FeatureVectorizer.FeatureSpace space) {
        Map<String, Item> byId = catalog.stream()
                .collect(Collectors.toMap(Item::id, Function.identity(), (a, b) -> a));
        Instant newest = history.interactions().stream()
                .map(Interaction::occurredAt)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        double[] sum = null;
        double totalWeight = 0.0;
        for (Interaction interaction : history.interactions()) {
            Item item = byId.get(interaction.itemId());
            double weight = weight(interaction, newest);
            if (item == null || weight <= 0.0) continue;

            double[] vector = space.vectorOf(item);
            if (explicit && vector.length == 0) {
                // a catalog vector is required for every interacted item
                throw new InvalidFeatureDimensionException(item.id(),
                        sum != null ? sum.length : firstVectorLength(history, byId), 0);
            }
            if (sum == null) {
                sum = new double[vector.length];
            } else if (vector.length != sum.length) {
                throw new InvalidFeatureDimensionException(item.id(), sum.length, vector.length);
            }
            for (int i = 0; i < vector.length; i++) {
                sum[i] += weight * vector[i];
            }
            totalWeight += weight;
        }
        if (sum == null || totalWeight == 0.0) return null;

        for (int i = 0; i < sum.length; i++) {
            sum[i] /= totalWeight;
        }
        return sum;
    }

    private static int firstVectorLength(InteractionHistory history, Map<String, Item> byId) {
        return history.interactions().stream()
                .map(i -> byId.get(i.itemId()))
                .filter(item -> item != null && item.features() != null && !item.features().isEmpty())
                .map(item -> item.features().size())
                .findFirst()
                .orElse(-1);
    }

    double weight(Interaction interaction, Instant newest) {
        if (interaction.outcome() != null && interaction.outcome() < settings.minPositiveOutcome()) return 0.0;

        double base = switch (interaction.type()) {
            case COMPLETED -> settings.completedWeight();
            case IN_PROGRESS -> settings.inProgressWeight();
            case ATTEMPTED -> settings.attemptedWeight();
        };
        if (base == 0.0 || settings.recencyHalfLifeDays() == 0.0
                || newest == null || interaction.occurredAt() == null) {
            return base;
        }
        double ageDays = Duration.between(interaction.occurredAt(), newest).toMillis() / MILLIS_PER_DAY;
        return base * Math.pow(0.5, ageDays / settings.recencyHalfLifeDays());
    }

    private static double cosine(double[] a, double[] b) {
        double nb = norm(b);
        if (nb == 0.0) return 0.0;
        double dot = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
        }
        double value = dot / (norm(a) * nb);
        return Math.max(-1.0, Math.min(1.0, value));
    }

    private static double norm(double[] v) {
        double s = 0.0;
        for (double x : v) {
            s += x * x;
        }
        return Math.sqrt(s);
    }
}
