package com.toeic.recommender.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class LearnerJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public LearnerJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Optional<ProfileRow> loadProfile(String learnerId) {
        List<ProfileRow> rows = jdbcTemplate.query(
                "SELECT learner_id, target_score, current_score, proficiency_level FROM learner_profile WHERE learner_id=?",
                (rs, n) -> new ProfileRow(rs.getString(1), rs.getObject(2, Integer.class),
                        rs.getObject(3, Integer.class), rs.getString(4)),
                learnerId);
        return rows.stream().findFirst();
    }

    public List<InteractionRow> loadInteractions(String learnerId) {
        return jdbcTemplate.query(
                "SELECT item_id, interaction_type, outcome, attempts, occurred_at FROM learner_interaction WHERE learner_id=? ORDER BY id",
                (rs, n) -> {
                    Timestamp ts = rs.getTimestamp(5);
                    return new InteractionRow(rs.getString(1), rs.getString(2), rs.getObject(3, Double.class),
                            rs.getInt(4), ts == null ? null : ts.toInstant());
                },
                learnerId);
    }

    public void saveFeedback(String learnerId, String itemId, String itemType, int rating, String comment) {
        jdbcTemplate.update(
                "INSERT INTO recommendation_feedback(learner_id, item_id, item_type, rating, feedback_comment, ts) VALUES (?,?,?,?,?,?)",
                learnerId, itemId, itemType, rating, comment, Instant.now().toString());
    }

    public List<FeedbackRow> loadFeedback(String learnerId) {
        return jdbcTemplate.query(
                "SELECT learner_id, item_id, item_type, rating, feedback_comment FROM recommendation_feedback WHERE learner_id=? ORDER BY id",
                (rs, n) -> new FeedbackRow(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4), rs.getString(5)),
                learnerId);
    }

    public record ProfileRow(String learnerId, Integer targetScore, Integer currentScore, String level) {}
    public record InteractionRow(String itemId, String interactionType, Double outcome, int attempts, Instant occurredAt) {}
    public record FeedbackRow(String learnerId, String itemId, String itemType, int rating, String comment) {}
}
