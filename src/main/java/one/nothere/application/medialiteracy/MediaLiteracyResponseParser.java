package one.nothere.application.medialiteracy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

/**
 * Parses a model reply into a {@link MediaLiteracyAssessment}.
 *
 * <p>Handles markdown fences and text around the JSON object, so the gateway
 * stays free of JSON-level concerns.</p>
 */
@Component
class MediaLiteracyResponseParser {

    private static final Logger log = LoggerFactory.getLogger(MediaLiteracyResponseParser.class);
    static final int NEUTRAL_SCORE = 50;

    private final ObjectMapper objectMapper;

    MediaLiteracyResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws IllegalStateException if the reply is empty or holds no parseable JSON object
     */
    MediaLiteracyAssessment parse(String responseText) {
        if (!StringUtils.hasText(responseText)) {
            throw new IllegalStateException("Media literacy response was empty");
        }
        JsonNode payload = parseJsonPayload(responseText);
        if (!payload.isObject()) {
            throw new IllegalStateException("Media literacy response was not a JSON object");
        }

        int credibility = credibilityScore(payload);
        return new MediaLiteracyAssessment(
            credibility,
            stringList(payload, "major_red_flags"),
            stringList(payload, "minor_concerns"),
            optionalText(payload, "explanation").orElse(""),
            payload.path("context_box_needed").asBoolean(false),
            optionalText(payload, "context_box_text").orElse(null)
        );
    }

    private JsonNode parseJsonPayload(String responseText) {
        String cleaned = responseText.replace("```json", "").replace("```", "").trim();
        try {
            return objectMapper.readTree(cleaned);
        } catch (JacksonException initialParseException) {
            int openBrace = cleaned.indexOf('{');
            int closeBrace = cleaned.lastIndexOf('}');
            if (openBrace < 0 || closeBrace <= openBrace) {
                throw new IllegalStateException("Media literacy response did not include a valid JSON object");
            }
            log.warn("Media literacy response required brace extraction fallback (initial parse failed: {})",
                initialParseException.getMessage());
            try {
                return objectMapper.readTree(cleaned.substring(openBrace, closeBrace + 1));
            } catch (JacksonException exception) {
                throw new IllegalStateException("Media literacy response JSON parsing failed", exception);
            }
        }
    }

    private int credibilityScore(JsonNode payload) {
        JsonNode node = payload.get("credibility_score");
        if (node == null || node.isNull()) {
            return NEUTRAL_SCORE;
        }
        double score;
        if (node.isNumber()) {
            score = node.asDouble();
        } else {
            try {
                score = Double.parseDouble(node.asString("").trim());
            } catch (NumberFormatException e) {
                log.warn("Non-numeric credibility score '{}', using neutral", node);
                return NEUTRAL_SCORE;
            }
        }
        if (score < 0 || score > 100) {
            log.warn("Invalid credibility score {}, clamping to 0-100", score);
        }
        return (int) Math.max(0, Math.min(100, score));
    }

    private Optional<String> optionalText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return Optional.empty();
        }
        return Optional.ofNullable(node.asString(null))
            .filter(StringUtils::hasText)
            .map(String::trim);
    }

    private List<String> stringList(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element == null || element.isNull()) {
                continue;
            }
            // structured entries are kept as compact JSON
            String text = element.isContainer() ? element.toString() : element.asString(null);
            if (StringUtils.hasText(text)) {
                values.add(text.trim());
            }
        }
        return values;
    }
}
