package com.toeic.recommender.recommendation;

import java.util.Map;

/**
 * Maps the raw scores of one scoring path onto the common [0,1] scale used for merging.
 * Implementations must keep the iteration order of the input map.
 */
public interface ScoreNormalizer {
    Map<String, Double> normalize(Map<String, Double> scores);
}
