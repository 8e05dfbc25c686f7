package com.toeic.recommender.recommendation;

import com.toeic.recommender.coldstart.ColdStartPolicy;
import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.Interaction;
import com.toeic.recommender.domain.DomainModels.InteractionHistory;
import com.toeic.recommender.domain.DomainModels.Item;
import com.toeic.recommender.domain.DomainModels.ItemType;
import com.toeic.recommender.exception.InsufficientCatalogException;
import com.toeic.recommender.fetcher.DataFetcher;
import com.toeic.recommender.recommendation.RecommendationModels.CandidateScore;
import com.toeic.recommender.recommendation.RecommendationModels.LearnerRecommendations;
import com.toeic.recommender.recommendation.RecommendationModels.Provenance;
import com.toeic.recommender.recommendation.RecommendationModels.RecommendOptions;
import com.toeic.recommender.recommendation.RecommendationModels.RecommendationList;
import com.toeic.recommender.recommendation.RecommendationModels.RecommendedItem;
import com.toeic.recommender.recommendation.RecommendationModels.Strategy;
import com.toeic.recommender.similarity.SimilarityScorer;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Drives one recommendation request: fetches the snapshots, picks the scoring path from the size of the
 * learner's history, then merges, de-duplicates and truncates the ranked candidates.
 * Holds no per-request state, so a single instance serves concurrent requests.
 */
@Service
public class RecommendationService {
    private static final int TOEIC_MAX_SCORE = 990;
    private static final Comparator<CandidateScore> BY_SCORE_THEN_ID =
            Comparator.comparingDouble(CandidateScore::score).reversed()
                    .thenComparing(CandidateScore::itemId);

    private final DataFetcher dataFetcher;
    private final SimilarityScorer similarityScorer;
    private final ColdStartPolicy coldStartPolicy;
    private final ScoreNormalizer normalizer;
    private final RecommenderProperties.Ranking ranking;

    public RecommendationService(DataFetcher dataFetcher,
                                 SimilarityScorer similarityScorer,
                                 ColdStartPolicy coldStartPolicy,
                                 ScoreNormalizer normalizer,
                                 RecommenderProperties properties) {
        this.dataFetcher = dataFetcher;
        this.similarityScorer = similarityScorer;
        this.coldStartPolicy = coldStartPolicy;
        this.normalizer = normalizer;
        this.ranking = properties.ranking();
    }

    public RecommendationList recommend(String learnerId, int desiredCount, RecommendOptions options) {
        requireLearner(learnerId);
        int count = boundedCount(desiredCount);
        RecommendOptions opts = options == null ? RecommendOptions.DEFAULT : options;

        InteractionHistory history = dataFetcher.fetchInteractionHistory(learnerId);
        // full catalog so items outside the type filter still shape the learner profile
        List<Item> catalog = dataFetcher.fetchCatalog(null);
        return rank(history, catalog, count, opts);
    }

    /**
     * Tests and lectures ranked separately from one pair of snapshots. A type missing from the catalog
     * yields an empty list; an empty catalog fails.
     */
    public LearnerRecommendations recommendForLearner(String learnerId, int limit) {
        requireLearner(learnerId);
        int count = boundedCount(limit);

        InteractionHistory history = dataFetcher.fetchInteractionHistory(learnerId);
        List<Item> catalog = dataFetcher.fetchCatalog(null);
        if (catalog.isEmpty()) throw new InsufficientCatalogException(null);

        RecommendationList tests = rankType(history, catalog, count, ItemType.TEST);
        RecommendationList lectures = rankType(history, catalog, count, ItemType.LECTURE);
        return new LearnerRecommendations(history.learnerId(), combined(tests, lectures), tests.items(), lectures.items());
    }

    // filling in either list means the pair as a whole was not served by similarity alone
    private static Strategy combined(RecommendationList tests, RecommendationList lectures) {
        if (tests.strategy() == Strategy.SIMILARITY_WITH_FILL || lectures.strategy() == Strategy.SIMILARITY_WITH_FILL) {
            return Strategy.SIMILARITY_WITH_FILL;
        }
        return tests.strategy();
    }

    /**
     * Pure ranking step over already fetched snapshots.
     */
    public RecommendationList rank(InteractionHistory history, List<Item> catalog, int desiredCount, RecommendOptions options) {
        List<Item> typed = catalog.stream()
                .filter(i -> options.itemTypeFilter() == null || i.type() == options.itemTypeFilter())
                .toList();
        if (typed.isEmpty()) throw new InsufficientCatalogException(options.itemTypeFilter());

        Set<String> completed = history.completedItemIds();
        List<Item> candidates = typed.stream()
                .filter(i -> options.includeCompleted() || !completed.contains(i.id()))
                .toList();
        if (candidates.isEmpty()) {
            return new RecommendationList(history.learnerId(), pathFor(history), List.of());
        }

        List<CandidateScore> ranked;
        Strategy strategy;
        if (pathFor(history) == Strategy.SIMILARITY) {
            ranked = new ArrayList<>(similarityRanking(history, candidates, catalog));
            strategy = Strategy.SIMILARITY;
            if (ranked.size() < desiredCount) {
                Set<String> scored = ranked.stream().map(CandidateScore::itemId).collect(Collectors.toSet());
                List<CandidateScore> fill = coldStartRanking(history, candidates).stream()
                        .filter(c -> !scored.contains(c.itemId()))
                        .toList();
                if (!fill.isEmpty()) {
                    // fillers rank after every similarity-scored item
                    ranked.addAll(fill);
                    strategy = Strategy.SIMILARITY_WITH_FILL;
                }
            }
        } else {
            ranked = coldStartRanking(history, candidates);
            strategy = Strategy.COLD_START;
        }
        return assemble(history, catalog, ranked, desiredCount, strategy);
    }

    private Strategy pathFor(InteractionHistory history) {
        return !history.isEmpty() && history.size() >= ranking.historyThreshold()
                ? Strategy.SIMILARITY
                : Strategy.COLD_START;
    }

    private List<CandidateScore> similarityRanking(InteractionHistory history, List<Item> candidates, List<Item> catalog) {
        Set<String> candidateIds = candidates.stream().map(Item::id).collect(Collectors.toSet());
        Map<String, Double> raw = similarityScorer.score(history, candidates, catalog).entrySet().stream()
                .filter(e -> candidateIds.contains(e.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
        if (raw.isEmpty()) return List.of();

        Map<String, Double> similarity = normalizer.normalize(raw);
        double w = ranking.blendWeight();
        if (w >= 1.0) {
            return similarity.entrySet().stream()
                    .map(e -> new CandidateScore(e.getKey(), e.getValue(), Provenance.SIMILARITY))
                    .sorted(BY_SCORE_THEN_ID)
                    .toList();
        }
        Map<String, Double> cold = normalizer.normalize(coldStartPolicy.score(history.attributes(), candidates));
        return similarity.entrySet().stream()
                .map(e -> new CandidateScore(e.getKey(),
                        w * e.getValue() + (1.0 - w) * cold.getOrDefault(e.getKey(), 0.0),
                        Provenance.BLENDED))
                .sorted(BY_SCORE_THEN_ID)
                .toList();
    }

    private List<CandidateScore> coldStartRanking(InteractionHistory history, List<Item> candidates) {
        Set<String> candidateIds = candidates.stream().map(Item::id).collect(Collectors.toSet());
        Map<String, Double> raw = coldStartPolicy.score(history.attributes(), candidates).entrySet().stream()
                .filter(e -> candidateIds.contains(e.getKey()))
                .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
        return normalizer.normalize(raw).entrySet().stream()
                .map(e -> new CandidateScore(e.getKey(), e.getValue(), Provenance.COLD_START))
                .sorted(BY_SCORE_THEN_ID)
                .toList();
    }

    private RecommendationList assemble(InteractionHistory history, List<Item> catalog, List<CandidateScore> ranked,
                                        int desiredCount, Strategy strategy) {
        Map<String, Item> byId = catalog.stream()
                .collect(Collectors.toMap(Item::id, Function.identity(), (a, b) -> a));
        Set<String> seen = new HashSet<>();
        List<RecommendedItem> items = new ArrayList<>();
        for (CandidateScore candidate : ranked) {
            if (items.size() >= desiredCount) break;
            if (!seen.add(candidate.itemId())) continue;
            Item item = byId.get(candidate.itemId());
            items.add(new RecommendedItem(item.id(), item.type(), item.name(), candidate.score(),
                    candidate.provenance(), buildReason(item, history, candidate.provenance())));
        }
        return new RecommendationList(history.learnerId(), strategy, items);
    }

    private RecommendationList rankType(InteractionHistory history, List<Item> catalog, int count, ItemType type) {
        boolean present = catalog.stream().anyMatch(i -> i.type() == type);
        if (!present) return new RecommendationList(history.learnerId(), pathFor(history), List.of());
        return rank(history, catalog, count, RecommendOptions.ofType(type));
    }

    private String buildReason(Item item, InteractionHistory history, Provenance provenance) {
        List<String> parts = new ArrayList<>();
        Optional<Interaction> previous = history.interactionFor(item.id());
        Integer target = history.attributes().targetScore();

        if (item.type() == ItemType.TEST) {
            previous.ifPresent(p -> {
                long avg = p.outcome() == null ? 0 : Math.round(p.outcome() * TOEIC_MAX_SCORE);
                if (target != null && avg < target) {
                    parts.add(String.format("Taken %d times with average score %d (below target %d)", p.attempts(), avg, target));
                } else {
                    parts.add(String.format("Taken %d times with average score %d", p.attempts(), avg));
                }
            });
            if (item.difficulty() != null) {
                parts.add(target == null
                        ? String.format("Difficulty %d", item.difficulty())
                        : String.format("Difficulty %d, %d points from target", item.difficulty(), Math.abs(item.difficulty() - target)));
            }
        } else {
            previous.filter(p -> p.outcome() != null)
                    .ifPresent(p -> parts.add(String.format("Already %d%% completed", Math.round(p.outcome() * 100))));
            if (!item.topics().isEmpty()) {
                parts.add("Helps with topics: " + String.join(", ", item.topics()));
            }
        }
        parts.add(switch (provenance) {
            case SIMILARITY -> "Close to what you have practiced";
            case BLENDED -> "Close to what you have practiced and popular with learners";
            case COLD_START -> "Popular starting point";
        });
        return String.join(" | ", parts);
    }

    private void requireLearner(String learnerId) {
        if (learnerId == null || learnerId.isBlank()) {
            throw new IllegalArgumentException("learnerId must not be blank");
        }
    }

    private int boundedCount(int desiredCount) {
        if (desiredCount < 1) {
            throw new IllegalArgumentException("desiredCount must be at least 1: " + desiredCount);
        }
        return Math.min(desiredCount, ranking.maxCount());
    }
}
