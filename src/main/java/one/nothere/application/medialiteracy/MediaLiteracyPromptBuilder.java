package one.nothere.application.medialiteracy;

import one.nothere.config.MediaLiteracyProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Builds the bounded analysis prompt: title, domain and a leading content excerpt.
 */
@Component
class MediaLiteracyPromptBuilder {

    private static final String TEMPLATE = """
        Analyze this webpage content for media literacy red flags.

        CONTENT:
        Title: %s
        Domain: %s
        Text: %s

        Detect these 7 patterns:
        1. Scientific Consensus Mismatch - contradicts established scientific consensus
        2. Extraordinary Claims - miracle cures, one weird trick, extreme promises without evidence
        3. Statistical Manipulation - correlation as causation, cherry-picked data, misleading stats
        4. Source-Expertise Mismatch - unqualified author making expert claims
        5. Conflict of Interest - undisclosed sponsorships, selling promoted products
        6. Historical Revisionism - contradicts established historical record
        7. Predatory Economic - MLM recruitment, pressure tactics, get-rich-quick schemes

        IMPORTANT NUANCE:
        - News reporting violence is not glorifying violence
        - Academic discussion is not advocacy
        - Historical analysis is not revisionism
        - Medical information from qualified sources is not a miracle cure claim
        - Educational content explaining conspiracies is not promoting them

        Return ONLY a JSON object (no markdown, no code blocks):
        {
          "major_red_flags": ["pattern_name1", "pattern_name2"],
          "minor_concerns": ["pattern_name3"],
          "explanation": "Brief 1-2 sentence reasoning",
          "credibility_score": 0-100,
          "context_box_needed": true or false,
          "context_box_text": "Educational context for users if needed"
        }

        Pattern names: scientific_mismatch, extraordinary_claims, statistical_manipulation, \
        expertise_mismatch, conflict_of_interest, historical_revisionism, predatory_economic

        Be strict but fair. Academic and educational content should score 70+. \
        Genuine misinformation should score 0-40.""";

    private final int excerptChars;

    MediaLiteracyPromptBuilder(MediaLiteracyProperties properties) {
        this.excerptChars = properties.getContentExcerptChars();
    }

    String build(String title, String domain, String content) {
        String excerpt = content == null ? "" : content.substring(0, Math.min(excerptChars, content.length()));
        return TEMPLATE.formatted(StringUtils.hasText(title) ? title : "No title", domain, excerpt);
    }
}
