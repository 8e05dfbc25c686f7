package com.toeic.recommender.api;

import com.toeic.recommender.config.RecommenderProperties;
import com.toeic.recommender.domain.DomainModels.ItemType;
import com.toeic.recommender.domain.DomainModels.RecommendationFeedback;
import com.toeic.recommender.fetcher.DataFetcher;
import com.toeic.recommender.recommendation.RecommendationModels;
import com.toeic.recommender.recommendation.RecommendationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Locale;

@RestController
@Slf4j
public class RecommendationController {
    private final RecommendationService recommendationService;
    private final DataFetcher dataFetcher;
    private final int defaultCount;

    public RecommendationController(RecommendationService recommendationService,
                                    DataFetcher dataFetcher,
                                    RecommenderProperties properties) {
        this.recommendationService = recommendationService;
        this.dataFetcher = dataFetcher;
        this.defaultCount = properties.ranking().defaultCount();
    }

    @GetMapping("/api/recommendations/{learnerId}")
    public ResponseEntity<RecommendationModels.RecommendationList> recommend(@PathVariable String learnerId,
                                                                             @RequestParam(required = false) Integer count,
                                                                             @RequestParam(required = false, defaultValue = "false") boolean includeCompleted,
                                                                             @RequestParam(required = false) String itemType) {
        log.info("Processing recommendation request for learner {}", learnerId);
        var options = new RecommendationModels.RecommendOptions(includeCompleted, parseItemType(itemType));
        var result = recommendationService.recommend(learnerId, count == null ? defaultCount : count, options);
        log.info("Recommended {} items to learner {} via {}", result.size(), learnerId, result.strategy());
        return ResponseEntity.ok(result);
    }

    @GetMapping("/recommendations/{learnerId}")
    public ResponseEntity<RecommendationModels.LearnerRecommendations> recommendTestsAndLectures(@PathVariable String learnerId,
                                                                                              @RequestParam(required = false) Integer limit) {
        log.info("Processing recommendation request for learner {}", learnerId);
        var result = recommendationService.recommendForLearner(learnerId, limit == null ? defaultCount : limit);
        log.info("Recommended {} tests and {} lectures to learner {} via {}", result.recommendedTests().size(),
                result.recommendedLectures().size(), learnerId, result.strategy());
        return ResponseEntity.ok(result);
    }

    @PostMapping("/api/recommendations/feedback")
    public ResponseEntity<Void> feedback(@Valid @RequestBody FeedbackRequest request) {
        dataFetcher.saveFeedback(new RecommendationFeedback(request.learnerId(), request.itemId(),
                parseItemType(request.itemType()), request.rating(), request.comment()));
        return ResponseEntity.accepted().build();
    }

    private ItemType parseItemType(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return ItemType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown item type: " + value, e);
        }
    }

    public record FeedbackRequest(@NotBlank String learnerId,
                                  @NotBlank String itemId,
                                  @NotBlank String itemType,
                                  @Min(1) @Max(5) int rating,
                                  @Size(max = 1000) String comment) {}
}
