package one.nothere.adapters.persistence;

import java.sql.Timestamp;
import java.sql.Types;
import java.util.Map;
import one.nothere.domain.scoring.ScoringResult;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

/**
 * Writes scoring outcomes: the current scores on {@code pages} and an
 * append-only audit row in {@code page_scoring_logs}.
 */
@Repository
public class PageScoreRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PageScoreRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    /**
     * Stores the result. Both writes commit or roll back together.
     */
    @Transactional
    public void save(ScoringResult result) {
        Timestamp scoredAt = Timestamp.from(result.scoredAt());

        jdbcTemplate.update(
            """
            UPDATE pages
            SET islamic_alignment_score = ?,
                quality_score = ?,
                authority_score = ?,
                media_literacy_score = ?,
                equity_boost = ?,
                final_composite_score = ?,
                indexable = ?,
                scored_at = ?
            WHERE id = ?
            """,
            integer(result.islamicAlignmentScore()),
            integer(result.qualityScore()),
            integer(result.authorityScore()),
            integer(result.mediaLiteracyScore()),
            integer(result.equityBoost()),
            result.compositeScore(),
            result.indexable(),
            scoredAt,
            result.pageId()
        );

        jdbcTemplate.update(
            """
            INSERT INTO page_scoring_logs
              (page_id, url, islamic_alignment_score, quality_score, authority_score, media_literacy_score,
               equity_boost, final_composite_score, indexable, blocklist_reason,
               islamic_themes_matched, quality_details, components, scored_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), CAST(? AS jsonb), CAST(? AS jsonb), ?)
            """,
            result.pageId(),
            result.url(),
            integer(result.islamicAlignmentScore()),
            integer(result.qualityScore()),
            integer(result.authorityScore()),
            integer(result.mediaLiteracyScore()),
            integer(result.equityBoost()),
            result.compositeScore(),
            result.indexable(),
            result.blocklistReason(),
            serializeJson(componentDetails(result.components(), "islamic_alignment")),
            serializeJson(componentDetails(result.components(), "quality")),
            serializeJson(result.components()),
            scoredAt
        );
    }

    private static SqlParameterValue integer(Integer value) {
        return new SqlParameterValue(Types.INTEGER, value);
    }

    private static Object componentDetails(Map<String, Object> components, String key) {
        Object component = components.get(key);
        if (component instanceof Map<?, ?> componentMap) {
            Object details = componentMap.get("details");
            return details != null ? details : Map.of();
        }
        return Map.of();
    }

    private String serializeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize scoring details", e);
        }
    }
}
