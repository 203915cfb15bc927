package one.nothere.application.scoring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import one.nothere.domain.scoring.ContextSignals;
import one.nothere.domain.scoring.DimensionScore;
import one.nothere.domain.scoring.ThemeKeyword;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Topical alignment from weighted theme keywords, in {@code [-100, 100]}.
 *
 * <p>Negative weights are dampened by page context: x0.3 for educational or
 * research pages, x0.5 for news outlets, and zeroed for known false positives.</p>
 */
@Component
public class IslamicAlignmentScorer {

    private static final Logger log = LoggerFactory.getLogger(IslamicAlignmentScorer.class);

    static final int MIN_CONTENT_CHARS = 50;
    static final int MAX_SCORE = 100;
    private static final int TOP_MATCHES_KEPT = 20;

    private final ThemeKeywordIndex keywordIndex;
    private final ContextClassifier contextClassifier;

    public IslamicAlignmentScorer(ThemeKeywordIndex keywordIndex, ContextClassifier contextClassifier) {
        this.keywordIndex = keywordIndex;
        this.contextClassifier = contextClassifier;
    }

    /**
     * @return clamped raw score; {@link #normalize(double)} maps it onto {@code [0, 100]}
     */
    public DimensionScore score(String content, String domain) {
        if (content == null || content.trim().length() < MIN_CONTENT_CHARS) {
            return DimensionScore.of(0, Map.of("reason", "content_too_short"));
        }

        List<ThemeKeyword> matches;
        try {
            matches = keywordIndex.match(content);
        } catch (DataAccessException e) {
            log.error("Keyword index unavailable, alignment degraded to neutral: {}", e.getMessage());
            return DimensionScore.degraded(0, "keyword_index_unavailable: " + e.getMessage());
        }
        if (matches.isEmpty()) {
            return DimensionScore.of(0, Map.of("reason", "no_keywords_matched"));
        }

        ContextSignals context = contextClassifier.detect(content, domain);
        Map<String, CategoryTally> categories = new LinkedHashMap<>();
        List<Map<String, Object>> matchDetails = new ArrayList<>();
        double rawScore = 0;

        for (ThemeKeyword match : matches) {
            double weight = context.adjust(match.weight());
            rawScore += weight;
            categories.computeIfAbsent(match.category().code(), code -> new CategoryTally(match.weight()))
                .add(weight);
            if (matchDetails.size() < TOP_MATCHES_KEPT) {
                Map<String, Object> detail = new LinkedHashMap<>();
                detail.put("keyword", match.keyword());
                detail.put("theme", match.principle());
                detail.put("category", match.category().code());
                detail.put("weight", weight);
                matchDetails.add(detail);
            }
        }

        double clamped = Math.max(-MAX_SCORE, Math.min(MAX_SCORE, rawScore));

        Map<String, Object> categoryDetails = new LinkedHashMap<>();
        categories.forEach((code, tally) -> categoryDetails.put(code, tally.toDetails()));

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("raw_score", rawScore);
        details.put("normalized_score", clamped);
        details.put("matches_count", matches.size());
        details.put("categories", categoryDetails);
        details.put("context", context.toDetails());
        details.put("top_matches", matchDetails);

        log.debug("Islamic alignment: {} (raw: {}, matches: {})", clamped, rawScore, matches.size());
        return DimensionScore.of(clamped, details);
    }

    /**
     * Maps a {@code [-100, 100]} alignment onto {@code [0, 100]}.
     */
    public static double normalize(double alignment) {
        return (alignment + MAX_SCORE) / 2.0;
    }

    private static final class CategoryTally {
        private final int baseWeight;
        private int count;
        private double total;

        CategoryTally(int baseWeight) {
            this.baseWeight = baseWeight;
        }

        void add(double weight) {
            count++;
            total += weight;
        }

        Map<String, Object> toDetails() {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("count", count);
            details.put("weight", baseWeight);
            details.put("total", total);
            return details;
        }
    }
}
