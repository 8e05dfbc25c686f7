package com.toeic.recommender.recommendation;

import com.toeic.recommender.domain.DomainModels.ItemType;

import java.util.List;

public class RecommendationModels {
    public enum Provenance { SIMILARITY, COLD_START, BLENDED }

    public enum Strategy { SIMILARITY, SIMILARITY_WITH_FILL, COLD_START }

    public record CandidateScore(String itemId, double score, Provenance provenance) {}

    public record RecommendOptions(boolean includeCompleted, ItemType itemTypeFilter) {
        public static final RecommendOptions DEFAULT = new RecommendOptions(false, null);

        public static RecommendOptions ofType(ItemType itemType) {
            return new RecommendOptions(false, itemType);
        }
    }

    public record RecommendedItem(String itemId,
                                  ItemType type,
                                  String name,
                                  double score,
                                  Provenance provenance,
                                  String reason) {}

    public record RecommendationList(String learnerId, Strategy strategy, List<RecommendedItem> items) {
        public RecommendationList {
            items = List.copyOf(items);
        }

        public List<String> itemIds() {
            return items.stream().map(RecommendedItem::itemId).toList();
        }

        public int size() {
            return items.size();
        }
    }

    public record LearnerRecommendations(String learnerId,
                                         Strategy strategy,
                                         List<RecommendedItem> recommendedTests,
                                         List<RecommendedItem> recommendedLectures) {}
}
