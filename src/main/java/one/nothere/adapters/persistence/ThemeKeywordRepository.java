package one.nothere.adapters.persistence;

import java.util.List;
import java.util.Locale;
import one.nothere.domain.scoring.KeywordCategory;
import one.nothere.domain.scoring.ThemeKeyword;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

/**
 * Reads keyword-to-theme associations joined with their theme category.
 */
@Repository
public class ThemeKeywordRepository {

    private final JdbcTemplate jdbcTemplate;

    public ThemeKeywordRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Transactional(readOnly = true)
    public List<ThemeKeyword> findAll() {
        return jdbcTemplate.query(
            """
            SELECT tk.keyword, tk.theme_id, it.principle, it.category
            FROM theme_keywords tk
            JOIN islamic_themes it ON tk.theme_id = it.id
            ORDER BY tk.keyword
            """,
            (rs, rowNum) -> new ThemeKeyword(
                rs.getString("keyword").toLowerCase(Locale.ROOT),
                rs.getInt("theme_id"),
                rs.getString("principle"),
                KeywordCategory.fromCode(rs.getString("category"))
            )
        );
    }
}
