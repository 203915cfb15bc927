package one.nothere.application.scoring;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;
import one.nothere.domain.scoring.ContextSignals;
import one.nothere.util.DomainNames;
import org.springframework.stereotype.Component;

/**
 * Detects educational, news, research and known false-positive contexts.
 *
 * <p>All four are suffix or substring heuristics over unauthenticated text,
 * used only to soften keyword penalties.</p>
 */
@Component
public class ContextClassifier {

    static final List<String> EDUCATIONAL_SUFFIXES = List.of(".edu", ".gov", ".ac.uk", ".ac.in", ".edu.au");

    static final List<String> NEWS_DOMAINS = List.of(
        "bbc.com", "bbc.co.uk", "reuters.com", "apnews.com",
        "ap.org", "aljazeera.com", "npr.org", "pbs.org"
    );

    static final List<String> RESEARCH_TERMS = List.of(
        "research", "study", "paper", "journal", "academic",
        "university", "scholar", "peer-reviewed", "abstract"
    );

    // Publications whose names collide with profanity or conflict keywords
    private static final List<Pattern> FALSE_POSITIVE_PATTERNS = List.of(
        Pattern.compile("\\bbitch\\s+magazine\\b"),
        Pattern.compile("\\bthe\\s+intercept\\b")
    );

    public ContextSignals detect(String content, String domain) {
        String contentLower = content == null ? "" : content.toLowerCase(Locale.ROOT);
        String host = DomainNames.bareHost(domain);

        boolean educational = EDUCATIONAL_SUFFIXES.stream().anyMatch(host::endsWith);
        boolean news = NEWS_DOMAINS.stream().anyMatch(newsDomain -> DomainNames.matchesDomain(host, newsDomain));
        boolean research = RESEARCH_TERMS.stream().anyMatch(contentLower::contains);
        boolean falsePositive = FALSE_POSITIVE_PATTERNS.stream().anyMatch(p -> p.matcher(contentLower).find());

        return new ContextSignals(educational, news, research, falsePositive);
    }
}
