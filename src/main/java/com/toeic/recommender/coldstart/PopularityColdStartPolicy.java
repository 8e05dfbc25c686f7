package com.toeic.recommender.coldstart;

import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.Item;
import com.toeic.recommender.domain.DomainModels.LearnerAttributes;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Blends catalog-relative popularity with how well an item fits the learner's stated target and level.
 * Items with no usable signal keep the configured default score so the whole catalog stays rankable.
 */
@Component
public class PopularityColdStartPolicy implements ColdStartPolicy {
    private final RecommenderProperties.ColdStart settings;

    public PopularityColdStartPolicy(RecommenderProperties properties) {
        this.settings = properties.coldStart();
    }

    @Override
    public Map<String, Double> score(LearnerAttributes attributes, List<Item> candidates) {
        LearnerAttributes attrs = attributes == null ? LearnerAttributes.NONE : attributes;
        double maxPopularity = candidates.stream()
                .map(Item::popularity)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .max()
                .orElse(0.0);

        List<Map.Entry<String, Double>> scored = new ArrayList<>();
        for (Item item : candidates) {
            scored.add(Map.entry(item.id(), scoreItem(item, attrs, maxPopularity)));
        }
        scored.sort(Map.Entry.<String, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Double>comparingByKey()));

        Map<String, Double> out = new LinkedHashMap<>();
        scored.forEach(e -> out.putIfAbsent(e.getKey(), e.getValue()));
        return out;
    }

    double scoreItem(Item item, LearnerAttributes attrs, double maxPopularity) {
        OptionalDouble popularity = popularity(item, maxPopularity);
        OptionalDouble match = attributeMatch(item, attrs);
        if (popularity.isEmpty() && match.isEmpty()) return settings.defaultScore();

        double weighted = 0.0;
        double weights = 0.0;
        if (popularity.isPresent() && settings.popularityWeight() > 0) {
            weighted += settings.popularityWeight() * popularity.getAsDouble();
            weights += settings.popularityWeight();
        }
        if (match.isPresent() && settings.attributeWeight() > 0) {
            weighted += settings.attributeWeight() * match.getAsDouble();
            weights += settings.attributeWeight();
        }
        return weights == 0.0 ? settings.defaultScore() : weighted / weights;
    }

    private OptionalDouble popularity(Item item, double maxPopularity) {
        if (item.popularity() == null) return OptionalDouble.empty();
        if (maxPopularity <= 0.0 || item.popularity() <= 0.0) return OptionalDouble.of(0.0);
        return OptionalDouble.of(Math.min(1.0, item.popularity() / maxPopularity));
    }

    private OptionalDouble attributeMatch(Item item, LearnerAttributes attrs) {
        if (attrs.isEmpty()) return OptionalDouble.empty();
        List<Double> parts = new ArrayList<>(2);
        if (attrs.targetScore() != null && item.difficulty() != null) {
            double gap = Math.abs(item.difficulty() - attrs.targetScore());
            parts.add(1.0 - Math.min(1.0, gap / settings.difficultyTolerance()));
        }
        if (attrs.level() != null && item.level() != null) {
            parts.add(attrs.level() == item.level() ? 1.0 : 0.0);
        }
        return parts.stream().mapToDouble(Double::doubleValue).average();
    }
}
