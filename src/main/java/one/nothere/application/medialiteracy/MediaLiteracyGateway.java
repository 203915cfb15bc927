package one.nothere.application.medialiteracy;

import io.github.resilience4j.ratelimiter.RateLimiter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import one.nothere.application.medialiteracy.CompletionClient.CompletionRequest;
import one.nothere.application.medialiteracy.CompletionClient.CompletionResponse;
import one.nothere.application.medialiteracy.RedFlagDetector.RedFlagScan;
import one.nothere.config.MediaLiteracyProperties;
import one.nothere.domain.scoring.DimensionScore;
import one.nothere.exception.AiCompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Cost-gated media literacy scoring.
 *
 * <p>Pages without enough red-flag phrases score a neutral 50 with no external call.
 * Suspicious pages go to the primary model, then once to the fallback model; every
 * failure path scores neutral 50 and never throws.</p>
 */
@Service
public class MediaLiteracyGateway {

    private static final Logger log = LoggerFactory.getLogger(MediaLiteracyGateway.class);

    static final int NEUTRAL_SCORE = 50;
    private static final int TRIGGERED_BY_KEPT = 10;
    private static final int RAW_RESPONSE_KEPT = 200;

    private final RedFlagDetector redFlagDetector;
    private final MediaLiteracyPromptBuilder promptBuilder;
    private final MediaLiteracyResponseParser responseParser;
    private final CompletionClient completionClient;
    private final RateLimiter rateLimiter;
    private final MediaLiteracyStats stats;
    private final MediaLiteracyProperties properties;
    private final Set<String> deniedModels;

    public MediaLiteracyGateway(RedFlagDetector redFlagDetector,
                                MediaLiteracyPromptBuilder promptBuilder,
                                MediaLiteracyResponseParser responseParser,
                                CompletionClient completionClient,
                                @Qualifier("mediaLiteracyRateLimiter") RateLimiter rateLimiter,
                                MediaLiteracyStats stats,
                                MediaLiteracyProperties properties) {
        this.redFlagDetector = redFlagDetector;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.completionClient = completionClient;
        this.rateLimiter = rateLimiter;
        this.stats = stats;
        this.properties = properties;
        this.deniedModels = Set.copyOf(properties.getDeniedModels());
    }

    public DimensionScore score(String content, String domain, String title) {
        stats.recordCall();

        RedFlagScan scan = redFlagDetector.needsAnalysis(content, domain);
        if (!scan.needsAnalysis()) {
            stats.recordSkipped();
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", "neutral");
            details.put("reason", "No red flag keywords detected");
            details.put("skipped_analysis", true);
            return DimensionScore.of(NEUTRAL_SCORE, details);
        }

        Map<String, Object> details = analyze(content, domain, title);
        details.put("triggered_by", scan.matched().subList(0, Math.min(TRIGGERED_BY_KEPT, scan.matched().size())));
        Object score = details.getOrDefault("raw_score", NEUTRAL_SCORE);
        return DimensionScore.of(((Number) score).doubleValue(), details);
    }

    private Map<String, Object> analyze(String content, String domain, String title) {
        if (!completionClient.isAvailable()) {
            stats.recordError();
            return errorDetails("API key not configured", null);
        }
        if (!rateLimiter.acquirePermission()) {
            stats.recordRateLimited();
            log.warn("Media literacy call rate limit reached, scoring {} neutral", domain);
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", "rate_limited");
            details.put("raw_score", NEUTRAL_SCORE);
            return details;
        }

        log.info("Sending {} for media literacy analysis", domain);
        String prompt = promptBuilder.build(title, domain, content);

        CompletionResponse response = callModel(properties.getPrimaryModel(), prompt);
        if (response == null) {
            log.warn("Primary model failed, trying fallback: {}", properties.getFallbackModel());
            stats.recordFallback();
            response = callModel(properties.getFallbackModel(), prompt);
        }
        if (response == null) {
            log.error("Both primary and fallback models failed for {}", domain);
            stats.recordError();
            Map<String, Object> details = errorDetails("API unavailable", null);
            details.put("fallback_reason", "Both models failed");
            return details;
        }

        MediaLiteracyAssessment assessment;
        try {
            assessment = responseParser.parse(response.content());
        } catch (IllegalStateException e) {
            log.error("Failed to parse media literacy response from {}: {}", response.modelUsed(), e.getMessage());
            stats.recordError();
            String raw = response.content();
            return errorDetails("Invalid JSON response", raw.substring(0, Math.min(RAW_RESPONSE_KEPT, raw.length())));
        }

        stats.recordAnalyzed();
        int score = assessment.credibilityScore();
        if (score < 40) {
            log.warn("Low credibility score {}/100 for {}, red flags: {}", score, domain, assessment.majorRedFlags());
        } else if (score >= 80) {
            log.info("High credibility score {}/100 for {}", score, domain);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", "analyzed");
        details.put("model_used", response.modelUsed());
        details.put("major_red_flags", assessment.majorRedFlags());
        details.put("minor_concerns", assessment.minorConcerns());
        details.put("explanation", assessment.explanation());
        details.put("context_box_needed", assessment.contextBoxNeeded());
        details.put("context_box_text", assessment.contextBoxText() == null ? "" : assessment.contextBoxText());
        details.put("raw_score", score);
        return details;
    }

    /**
     * One completion attempt; null on any failure, including a reply served by a denied model.
     */
    private CompletionResponse callModel(String model, String prompt) {
        if (deniedModels.contains(model)) {
            log.warn("Model {} is on the deny list, not calling it", model);
            return null;
        }
        try {
            CompletionResponse response = completionClient.complete(new CompletionRequest(
                model,
                prompt,
                properties.getMaxTokens(),
                properties.getTemperature(),
                properties.getDeniedModels()
            ));
            if (deniedModels.contains(response.modelUsed())) {
                log.warn("Router served request for {} with denied model {}, discarding reply", model, response.modelUsed());
                return null;
            }
            return response;
        } catch (AiCompletionException e) {
            log.warn("Completion with {} failed: {}", model, e.getMessage());
            return null;
        }
    }

    private static Map<String, Object> errorDetails(String error, String rawResponse) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", "error");
        details.put("error", error);
        if (rawResponse != null) {
            details.put("raw_response", rawResponse);
        }
        details.put("raw_score", NEUTRAL_SCORE);
        return details;
    }

    public MediaLiteracyStats.Snapshot stats() {
        return stats.snapshot();
    }
}
