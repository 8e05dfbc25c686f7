package com.toeic.recommender.similarity;

import com.toeic.recommender.domain.DomainModels.Item;

import java.util.List;

/**
 * Uses the vectors supplied by the catalog. An item without a vector yields a zero-length vector, which
 * the scorer reports as a dimension mismatch.
 */
public class ExplicitFeatureVectorizer implements FeatureVectorizer {

    @Override
    public FeatureSpace prepare(List<Item> catalog) {
        return item -> {
            List<Double> features = item.features();
            if (features == null) return new double[0];
            double[] vector = new double[features.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = features.get(i);
            }
            return vector;
        };
    }
}
