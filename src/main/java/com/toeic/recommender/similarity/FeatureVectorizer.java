package com.toeic.recommender.similarity;

import com.toeic.recommender.domain.DomainModels.Item;

import java.util.List;

public interface FeatureVectorizer {

    /** Builds the vector space for one catalog snapshot. */
    FeatureSpace prepare(List<Item> catalog);

    interface FeatureSpace {
        double[] vectorOf(Item item);
    }
}
