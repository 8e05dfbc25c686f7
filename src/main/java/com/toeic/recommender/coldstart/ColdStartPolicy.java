package com.toeic.recommender.coldstart;

import com.toeic.recommender.domain.DomainModels.Item;
import com.toeic.recommender.domain.DomainModels.LearnerAttributes;

import java.util.List;
import java.util.Map;

/**
 * Ranks candidates without relying on interaction history.
 */
public interface ColdStartPolicy {

    /**
     * @param attributes coarse learner attributes, {@link LearnerAttributes#NONE} when unknown
     * @param candidates items to score
     * @return a score in [0,1] for every candidate, iterating from best to worst
     */
    Map<String, Double> score(LearnerAttributes attributes, List<Item> candidates);
}
