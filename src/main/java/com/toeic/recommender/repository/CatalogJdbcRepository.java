package com.toeic.recommender.repository;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

@Repository
public class CatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public List<ItemRow> loadItems(String itemType) {
        String sql = "SELECT item_id, item_type, name, difficulty, popularity, proficiency_level, features FROM catalog_item";
        if (itemType == null) {
            return jdbcTemplate.query(sql + " ORDER BY item_id", (rs, n) -> itemRow(rs));
        }
        return jdbcTemplate.query(sql + " WHERE item_type=? ORDER BY item_id", (rs, n) -> itemRow(rs), itemType);
    }

    public List<TopicRow> loadTopics() {
        return jdbcTemplate.query(
                "SELECT item_id, topic FROM catalog_item_topic ORDER BY item_id, topic_order",
                (rs, n) -> new TopicRow(rs.getString(1), rs.getString(2)));
    }

    private static ItemRow itemRow(ResultSet rs) throws SQLException {
        return new ItemRow(
                rs.getString(1),
                rs.getString(2),
                rs.getString(3),
                rs.getObject(4, Integer.class),
                rs.getObject(5, Double.class),
                rs.getString(6),
                rs.getString(7));
    }

    public record ItemRow(String itemId, String itemType, String name, Integer difficulty, Double popularity,
                          String level, String features) {}
    public record TopicRow(String itemId, String topic) {}
}
