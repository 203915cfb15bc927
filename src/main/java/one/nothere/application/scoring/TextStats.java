package one.nothere.application.scoring;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;

/**
 * Whitespace tokenisation shared by the quality heuristics.
 */
final class TextStats {

    private TextStats() {
    }

    static List<String> words(String content) {
        String trimmed = content == null ? "" : content.trim();
        if (trimmed.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(trimmed.split("\\s+"));
    }

    static int wordCount(String content) {
        return words(content).size();
    }

    /**
     * Distinct tokens over total tokens, 0 for empty input.
     */
    static double uniqueRatio(List<String> words) {
        if (words.isEmpty()) {
            return 0;
        }
        return (double) new HashSet<>(words).size() / words.size();
    }

    static List<String> lowerCaseWords(String content) {
        return words(content == null ? "" : content.toLowerCase(Locale.ROOT));
    }
}
