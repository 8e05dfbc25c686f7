package com.toeic.recommender.similarity;

import com.toeic.recommender.domain.DomainModels.Item;

import java.util.*;

/**
 * One-hot encoding over the sorted topic vocabulary of a catalog snapshot. Every item of the snapshot
 * maps to a vector of the same dimension.
 */
public class TopicFeatureVectorizer implements FeatureVectorizer {

    @Override
    public FeatureSpace prepare(List<Item> catalog) {
        SortedSet<String> vocabulary = new TreeSet<>();
        for (Item item : catalog) {
            item.topics().stream().map(TopicFeatureVectorizer::key).filter(t -> !t.isEmpty()).forEach(vocabulary::add);
        }
        Map<String, Integer> index = new HashMap<>();
        int i = 0;
        for (String topic : vocabulary) {
            index.put(topic, i++);
        }
        int dimension = vocabulary.size();

        return item -> {
            double[] vector = new double[dimension];
            for (String topic : item.topics()) {
                Integer pos = index.get(key(topic));
                if (pos != null) vector[pos] = 1.0;
            }
            return vector;
        };
    }

    private static String key(String topic) {
        return topic == null ? "" : topic.trim().toLowerCase(Locale.ROOT);
    }
}
