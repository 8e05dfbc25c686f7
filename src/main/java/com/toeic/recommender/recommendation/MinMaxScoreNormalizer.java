package com.toeic.recommender.recommendation;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class MinMaxScoreNormalizer implements ScoreNormalizer {

    @Override
    public Map<String, Double> normalize(Map<String, Double> scores) {
        Map<String, Double> out = new LinkedHashMap<>();
        if (scores.isEmpty()) return out;

        double min = scores.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = scores.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        double range = max - min;
        // flat input: leave the ordering to the id tie-break
        scores.forEach((id, v) -> out.put(id, range == 0.0 ? 1.0 : (v - min) / range));
        return out;
    }
}
