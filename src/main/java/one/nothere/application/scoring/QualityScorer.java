package one.nothere.application.scoring;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import one.nothere.adapters.persistence.PageRepository;
import one.nothere.domain.scoring.DimensionScore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Content quality in {@code [0, 100]} before freshness: readability, length,
 * structure, lexical uniqueness and technical signals.
 */
@Component
public class QualityScorer {

    private static final Logger log = LoggerFactory.getLogger(QualityScorer.class);

    static final int MIN_CONTENT_CHARS = 50;
    private static final int HEADING_MAX_CHARS = 100;
    private static final int UNIQUENESS_MIN_WORDS = 50;
    private static final int UNKNOWN_DOMAIN_AGE_SCORE = 5;
    private static final int MOBILE_SCORE = 5;

    private final ReadabilityScorer readabilityScorer;
    private final PageRepository pageRepository;
    private final Clock clock;

    public QualityScorer(ReadabilityScorer readabilityScorer, PageRepository pageRepository, Clock clock) {
        this.readabilityScorer = readabilityScorer;
        this.pageRepository = pageRepository;
        this.clock = clock;
    }

    public DimensionScore score(String url, String content, String domain) {
        if (content == null || content.trim().length() < MIN_CONTENT_CHARS) {
            return DimensionScore.of(0, Map.of("reason", "content_too_short"));
        }

        Map<String, Object> details = new LinkedHashMap<>();
        int readability = readabilityScorer.score(content);
        details.put("readability", readability);
        details.put("readability_method", readabilityScorer.method());

        int length = lengthScore(content);
        details.put("content_length", length);

        int structure = structureScore(content);
        details.put("structural_quality", structure);

        int grammar = grammarScore(content);
        details.put("grammar_uniqueness", grammar);

        int technical = technicalScore(url, domain, details);

        int total = Math.min(100, readability + length + structure + grammar + technical);
        details.put("total", total);
        return DimensionScore.of(total, details);
    }

    /**
     * Points for the age of a crawl: under 30 days 15, under 90 days 10, under a year 5, older 2.
     */
    public int freshnessScore(Instant crawledAt) {
        long days = Duration.between(crawledAt, clock.instant()).toDays();
        if (days < 30) {
            return 15;
        }
        if (days < 90) {
            return 10;
        }
        if (days < 365) {
            return 5;
        }
        return 2;
    }

    static int lengthScore(String content) {
        int words = TextStats.wordCount(content);
        if (words < 100) {
            return 0;
        }
        if (words < 500) {
            return 5;
        }
        if (words <= 2000) {
            return 10;
        }
        return 8;
    }

    static int structureScore(String content) {
        int score = 0;
        if (content.lines().anyMatch(line -> line.length() < HEADING_MAX_CHARS && isHeadingLike(line))) {
            score += 5;
        }
        if (content.chars().filter(c -> c == '\n').count() > 5) {
            score += 5;
        }
        List<String> lowerWords = TextStats.lowerCaseWords(content);
        if (lowerWords.size() > UNIQUENESS_MIN_WORDS && TextStats.uniqueRatio(lowerWords) > 0.4) {
            score += 5;
        }
        return score;
    }

    static int grammarScore(String content) {
        List<String> words = TextStats.words(content);
        if (words.size() <= UNIQUENESS_MIN_WORDS) {
            return 5;
        }
        return Math.min(15, (int) (TextStats.uniqueRatio(words) * 20));
    }

    // Has upper-case letters and no lower-case ones
    static boolean isHeadingLike(String line) {
        boolean hasUpper = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (Character.isLowerCase(c) || Character.isTitleCase(c)) {
                return false;
            }
            if (Character.isUpperCase(c)) {
                hasUpper = true;
            }
        }
        return hasUpper;
    }

    private int technicalScore(String url, String domain, Map<String, Object> details) {
        boolean ssl = url != null && url.toLowerCase(Locale.ROOT).startsWith("https://");
        details.put("has_ssl", ssl);

        int ageScore = domainAgeScore(domain, details);
        details.put("domain_age_score", ageScore);
        details.put("mobile_optimized", MOBILE_SCORE);

        return (ssl ? 10 : 0) + ageScore + MOBILE_SCORE;
    }

    private int domainAgeScore(String domain, Map<String, Object> details) {
        Optional<Instant> firstSeen;
        try {
            firstSeen = pageRepository.findFirstCrawlOfDomain(domain);
        } catch (DataAccessException e) {
            log.warn("Domain age lookup failed for {}: {}", domain, e.getMessage());
            details.put("domain_age_error", e.getMessage());
            return UNKNOWN_DOMAIN_AGE_SCORE;
        }
        if (firstSeen.isEmpty()) {
            return UNKNOWN_DOMAIN_AGE_SCORE;
        }
        long days = Duration.between(firstSeen.get(), clock.instant()).toDays();
        details.put("domain_age_days", days);
        if (days < 7) {
            return 0;
        }
        if (days < 30) {
            return 5;
        }
        if (days < 90) {
            return 10;
        }
        return 15;
    }
}
