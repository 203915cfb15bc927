package one.nothere.application.medialiteracy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import one.nothere.config.MediaLiteracyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cheap substring scan deciding whether a page is suspicious enough to pay for model analysis.
 */
@Component
public class RedFlagDetector {

    private static final Logger log = LoggerFactory.getLogger(RedFlagDetector.class);

    static final int MIN_CONTENT_CHARS = 100;

    static final Set<String> RED_FLAG_PHRASES = normalize(List.of(
        // Miracle cures
        "miracle cure", "doctors hate", "one weird trick",
        "scientists don't want you to know", "big pharma",
        "they don't want you to", "shocking truth",
        "government hiding", "mainstream media lies",
        "breakthrough discovery", "suppressed information",
        "what they won't tell you", "banned by",
        "secret that", "industry doesn't want",
        "proven to cure", "guaranteed results",

        // Conspiracy language
        "new world order", "illuminati", "deep state",
        "false flag", "crisis actors", "hoax",
        "cover up", "conspiracy", "they're hiding",

        // Named conspiracy theories
        "flat earth", "earth is flat", "globe lie",
        "moon landing fake", "moon landing hoax", "never went to moon",
        "chemtrails", "chem trails", "spraying chemicals",
        "5g causes", "5g conspiracy", "5g radiation",
        "vaccines cause autism", "autism from vaccines", "vaccine injury",
        "anti-vax", "anti-vaxx", "vaccine danger", "vaccine poison",
        "big pharma conspiracy", "pharmaceutical conspiracy",
        "qanon", "wwg1wga", "trust the plan", "the storm",
        "adrenochrome", "pizzagate", "pedophile ring",
        "covid hoax", "plandemic", "scamdemic", "covid fake",
        "coronavirus hoax", "virus doesn't exist",
        "microchip vaccine", "vaccine tracking", "bill gates microchip",
        "lizard people", "reptilians", "shape shifters",
        "sandy hook hoax", "parkland hoax", "shooting hoax",
        "holocaust didn't happen", "holocaust denial", "holocaust hoax",
        "9/11 inside job", "9/11 controlled demolition", "twin towers explosives",
        "agenda 21", "agenda 2030", "un takeover",
        "jade helm", "fema camps", "martial law coming",
        "crisis actor", "paid protesters", "soros funded",
        "george soros conspiracy", "soros controls",
        "rothschild conspiracy", "banking elite conspiracy",
        "freemasons control", "satanic ritual", "satanic panic",

        // MLM recruitment
        "be your own boss", "financial freedom",
        "work from home unlimited", "passive income guaranteed",
        "join my team", "ground floor opportunity",
        "unlimited earning potential", "retired at 30",

        // Predatory health claims
        "detox", "toxins", "cleanse", "boost your immune system",
        "natural alternative to", "big pharma doesn't want",
        "FDA doesn't approve because", "alternative to chemotherapy",

        // Historical revisionism
        "false flag operation",

        // Statistical manipulation
        "correlation equals causation", "100% of people",
        "studies show", "experts agree", "research proves",
        "science says"
    ));

    private final int minRedFlags;

    public RedFlagDetector(MediaLiteracyProperties properties) {
        this.minRedFlags = properties.getMinRedFlags();
    }

    /**
     * Matches the red-flag phrases against the content.
     *
     * @return the distinct phrases found, and whether there are enough of them to escalate
     */
    public RedFlagScan needsAnalysis(String content, String domain) {
        if (content == null || content.length() < MIN_CONTENT_CHARS) {
            return new RedFlagScan(false, List.of());
        }
        String contentLower = content.toLowerCase(Locale.ROOT);
        List<String> matched = new ArrayList<>();
        for (String phrase : RED_FLAG_PHRASES) {
            if (contentLower.contains(phrase)) {
                matched.add(phrase);
            }
        }
        boolean escalate = matched.size() >= minRedFlags;
        if (escalate) {
            log.info("Red flags detected ({}) on {}", matched.size(), domain);
            log.debug("Matched phrases: {}", matched.subList(0, Math.min(5, matched.size())));
        }
        return new RedFlagScan(escalate, matched);
    }

    private static Set<String> normalize(List<String> phrases) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String phrase : phrases) {
            normalized.add(phrase.toLowerCase(Locale.ROOT));
        }
        return Collections.unmodifiableSet(normalized);
    }

    /**
     * @param matched distinct matched phrases, in list order
     */
    public record RedFlagScan(boolean needsAnalysis, List<String> matched) {

        public RedFlagScan {
            matched = List.copyOf(matched);
        }
    }
}
