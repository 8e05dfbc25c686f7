package com.toeic.recommender.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings of the recommendation pipeline, bound from {@code toeic.recommender.*}.
 */
@Validated
@ConfigurationProperties(prefix = "toeic.recommender")
public record RecommenderProperties(@NotNull @DefaultValue("http") DataSourceKind dataSource,
                                    @Valid @NotNull @DefaultValue Backend backend,
                                    @Valid @NotNull @DefaultValue Ranking ranking,
                                    @Valid @NotNull @DefaultValue Similarity similarity,
                                    @Valid @NotNull @DefaultValue ColdStart coldStart) {

    public enum DataSourceKind { HTTP, JDBC }

    public enum FeatureMode { TOPICS, EXPLICIT }

    public static RecommenderProperties defaults() {
        return new RecommenderProperties(DataSourceKind.HTTP, Backend.defaults(), Ranking.defaults(),
                Similarity.defaults(), ColdStart.defaults());
    }

    public RecommenderProperties withRanking(Ranking ranking) {
        return new RecommenderProperties(dataSource, backend, ranking, similarity, coldStart);
    }

    public RecommenderProperties withSimilarity(Similarity similarity) {
        return new RecommenderProperties(dataSource, backend, ranking, similarity, coldStart);
    }

    public record Backend(@NotBlank @DefaultValue("http://backend-api:8000") String baseUrl,
                          String apiKey,
                          @NotNull @DefaultValue("3s") Duration connectTimeout,
                          @NotNull @DefaultValue("6s") Duration readTimeout) {
        public static Backend defaults() {
            return new Backend("http://backend-api:8000", null, Duration.ofSeconds(3), Duration.ofSeconds(6));
        }
    }

    public record Ranking(@Min(0) @DefaultValue("3") int historyThreshold,
                          @Min(1) @DefaultValue("5") int defaultCount,
                          @Min(1) @DefaultValue("50") int maxCount,
                          @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("1.0") double blendWeight) {
        public Ranking {
            if (defaultCount > maxCount) {
                throw new IllegalArgumentException("ranking.default-count must not exceed ranking.max-count");
            }
            if (blendWeight < 0.0 || blendWeight > 1.0) {
                throw new IllegalArgumentException("ranking.blend-weight must be within [0,1]: " + blendWeight);
            }
        }

        public static Ranking defaults() {
            return new Ranking(3, 5, 50, 1.0);
        }
    }

    public record Similarity(@NotNull @DefaultValue("topics") FeatureMode featureMode,
                             @DecimalMin("0.0") @DefaultValue("1.0") double completedWeight,
                             @DecimalMin("0.0") @DefaultValue("0.5") double inProgressWeight,
                             @DecimalMin("0.0") @DefaultValue("0.5") double attemptedWeight,
                             @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.0") double minPositiveOutcome,
                             @DecimalMin("0.0") @DefaultValue("30") double recencyHalfLifeDays) {
        public Similarity {
            if (completedWeight < 0 || inProgressWeight < 0 || attemptedWeight < 0) {
                throw new IllegalArgumentException("similarity interaction weights must be non-negative");
            }
            if (recencyHalfLifeDays < 0) {
                throw new IllegalArgumentException("similarity.recency-half-life-days must be non-negative");
            }
        }

        public static Similarity defaults() {
            return new Similarity(FeatureMode.TOPICS, 1.0, 0.5, 0.5, 0.0, 30);
        }
    }

    public record ColdStart(@DecimalMin("0.0") @DefaultValue("0.7") double popularityWeight,
                            @DecimalMin("0.0") @DefaultValue("0.3") double attributeWeight,
                            @Min(1) @DefaultValue("200") int difficultyTolerance,
                            @DecimalMin("0.0") @DecimalMax("1.0") @DefaultValue("0.0") double defaultScore) {
        public ColdStart {
            if (popularityWeight < 0 || attributeWeight < 0 || popularityWeight + attributeWeight == 0) {
                throw new IllegalArgumentException("cold-start weights must be non-negative and not both zero");
            }
        }

        public static ColdStart defaults() {
            return new ColdStart(0.7, 0.3, 200, 0.0);
        }
    }
}
