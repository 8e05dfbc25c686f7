package com.toeic.recommender.similarity;

import com.toeic.recommender.domain.DomainModels.InteractionHistory;
import com.toeic.recommender.domain.DomainModels.Item;

import java.util.List;
import java.util.Map;

/**
 * Scores candidate items against a learner's interaction history.
 */
public interface SimilarityScorer {

    /**
     * @param history    the learner's interactions, possibly empty
     * @param candidates items that may be recommended, completed items already removed by the caller
     * @param catalog    the full catalog snapshot, used to resolve the items in {@code history}
     * @return item id to affinity in [-1,1], in candidate order; empty when no learner profile can be built
     *         or there are no candidates
     * @throws com.toeic.recommender.exception.InvalidFeatureDimensionException when a feature vector does
     *         not match the profile dimension
     */
    Map<String, Double> score(InteractionHistory history, List<Item> candidates, List<Item> catalog);
}
