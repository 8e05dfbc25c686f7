package com.toeic.recommender.fetcher;

import com.toeic.recommender.domain.DomainModels.InteractionHistory;
import com.toeic.recommender.domain.DomainModels.Item;
import com.toeic.recommender.domain.DomainModels.ItemType;
import com.toeic.recommender.domain.DomainModels.RecommendationFeedback;

import java.util.List;

/**
 * Source of the per-request snapshots the recommender works on. Every call returns a point-in-time
 * copy or fails; retries and timeouts are the implementation's business.
 */
public interface DataFetcher {

    /**
     * Returns the learner's history. A learner the source does not know gets an empty history.
     *
     * @throws com.toeic.recommender.exception.UpstreamUnavailableException
     * @throws com.toeic.recommender.exception.UpstreamAuthException
     */
    InteractionHistory fetchInteractionHistory(String learnerId);

    /**
     * Returns the catalog, restricted to {@code itemType} when it is not null.
     *
     * @throws com.toeic.recommender.exception.UpstreamUnavailableException
     */
    List<Item> fetchCatalog(ItemType itemType);

    void saveFeedback(RecommendationFeedback feedback);
}
