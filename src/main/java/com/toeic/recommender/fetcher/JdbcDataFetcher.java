package com.toeic.recommender.fetcher;

import com.toeic.recommender.domain.DomainModels.*;
import com.toeic.recommender.exception.UpstreamUnavailableException;
import com.toeic.recommender.repository.CatalogJdbcRepository;
import com.toeic.recommender.repository.LearnerJdbcRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Serves snapshots from a local catalog database instead of the backend API.
 */
@Component
@ConditionalOnProperty(name = "toeic.recommender.data-source", havingValue = "jdbc")
@Slf4j
public class JdbcDataFetcher implements DataFetcher {
    private final CatalogJdbcRepository catalogRepository;
    private final LearnerJdbcRepository learnerRepository;

    public JdbcDataFetcher(CatalogJdbcRepository catalogRepository, LearnerJdbcRepository learnerRepository) {
        this.catalogRepository = catalogRepository;
        this.learnerRepository = learnerRepository;
    }

    @Override
    public InteractionHistory fetchInteractionHistory(String learnerId) {
        return query("history of " + learnerId, () -> {
            LearnerAttributes attributes = learnerRepository.loadProfile(learnerId)
                    .map(p -> new LearnerAttributes(p.targetScore(), p.currentScore(), HttpBackendDataFetcher.parseLevel(p.level())))
                    .orElse(LearnerAttributes.NONE);
            List<Interaction> interactions = learnerRepository.loadInteractions(learnerId).stream()
                    .map(r -> new Interaction(r.itemId(), storedValue(InteractionType.class, r.interactionType(), r.itemId()),
                            r.outcome(), r.occurredAt(), r.attempts()))
                    .toList();
            return new InteractionHistory(learnerId, interactions, attributes);
        });
    }

    @Override
    public List<Item> fetchCatalog(ItemType itemType) {
        return query("catalog", () -> {
            Map<String, List<String>> topics = catalogRepository.loadTopics().stream()
                    .collect(Collectors.groupingBy(CatalogJdbcRepository.TopicRow::itemId, LinkedHashMap::new,
                            Collectors.mapping(CatalogJdbcRepository.TopicRow::topic, Collectors.toList())));
            return catalogRepository.loadItems(itemType == null ? null : itemType.name()).stream()
                    .map(r -> new Item(r.itemId(), storedValue(ItemType.class, r.itemType(), r.itemId()), r.name(),
                            topics.getOrDefault(r.itemId(), List.of()), r.difficulty(), r.popularity(),
                            HttpBackendDataFetcher.parseLevel(r.level()), parseFeatures(r.itemId(), r.features())))
                    .toList();
        });
    }

    @Override
    public void saveFeedback(RecommendationFeedback feedback) {
        query("feedback of " + feedback.learnerId(), () -> {
            learnerRepository.saveFeedback(feedback.learnerId(), feedback.itemId(), feedback.itemType().name(),
                    feedback.rating(), feedback.comment());
            return null;
        });
    }

    private <T> T query(String description, Supplier<T> work) {
        try {
            return work.get();
        } catch (DataAccessException e) {
            log.warn("Catalog database failed while loading {}: {}", description, e.getMessage());
            throw new UpstreamUnavailableException("Catalog database failed while loading " + description, e);
        }
    }

    private static <E extends Enum<E>> E storedValue(Class<E> type, String value, String itemId) {
        if (value != null) {
            try {
                return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.warn("Row for item {} has unknown {} '{}'", itemId, type.getSimpleName(), value);
                throw new UpstreamUnavailableException("Catalog database holds unknown " + type.getSimpleName()
                        + " '" + value + "' for item " + itemId, e);
            }
        }
        throw new UpstreamUnavailableException("Catalog database holds no " + type.getSimpleName() + " for item " + itemId);
    }

    static List<Double> parseFeatures(String itemId, String csv) {
        if (csv == null || csv.isBlank()) return null;
        List<Double> out = new ArrayList<>();
        for (String part : csv.split(",")) {
            try {
                out.add(Double.parseDouble(part.trim()));
            } catch (NumberFormatException e) {
                log.warn("Item {} has a malformed feature vector, ignoring it", itemId);
                return null;
            }
        }
        return out;
    }
}
