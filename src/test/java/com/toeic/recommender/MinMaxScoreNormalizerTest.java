package com.toeic.recommender;

import com.toeic.recommender.recommendation.MinMaxScoreNormalizer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MinMaxScoreNormalizerTest {
    private final MinMaxScoreNormalizer normalizer = new MinMaxScoreNormalizer();

    @Test
    void mapsRangeOntoUnitInterval() {
        Map<String, Double> raw = new LinkedHashMap<>();
        raw.put("a", -0.5);
        raw.put("b", 0.25);
        raw.put("c", 1.0);

        Map<String, Double> out = normalizer.normalize(raw);

        assertEquals(0.0, out.get("a"), 1e-9);
        assertEquals(0.5, out.get("b"), 1e-9);
        assertEquals(1.0, out.get("c"), 1e-9);
        assertEquals(List.of("a", "b", "c"), new ArrayList<>(out.keySet()));
    }

    @Test
    void flatScoresBecomeOne() {
        Map<String, Double> out = normalizer.normalize(Map.of("x", 0.3, "y", 0.3));
        assertEquals(1.0, out.get("x"), 1e-9);
        assertEquals(1.0, out.get("y"), 1e-9);
    }

    @Test
    void emptyStaysEmpty() {
        assertTrue(normalizer.normalize(Map.of()).isEmpty());
    }
}
