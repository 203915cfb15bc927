package one.nothere.config;

import java.util.Locale;
import one.nothere.application.scoring.FleschReadabilityScorer;
import one.nothere.application.scoring.ReadabilityScorer;
import one.nothere.application.scoring.SentenceLengthReadabilityScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the readability implementation named by {@code scoring.readability}.
 */
@Configuration
public class ScoringConfig {

    private static final Logger log = LoggerFactory.getLogger(ScoringConfig.class);

    @Bean
    public ReadabilityScorer readabilityScorer(ScoringProperties properties) {
        String choice = properties.getReadability() == null ? "" : properties.getReadability().trim().toLowerCase(Locale.ROOT);
        ReadabilityScorer scorer = switch (choice) {
            case "flesch" -> new FleschReadabilityScorer();
            case "sentence-length" -> new SentenceLengthReadabilityScorer();
            default -> throw new IllegalStateException(
                "Unknown scoring.readability '" + properties.getReadability() + "', expected flesch or sentence-length");
        };
        log.info("Readability scoring uses the {} measure", scorer.method());
        return scorer;
    }
}
