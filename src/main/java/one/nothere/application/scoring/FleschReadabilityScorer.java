package one.nothere.application.scoring;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flesch reading ease mapped to points: 60 and above scores 15, 30 and above 10, below 30 scores 5.
 *
 * <p>Syllables are estimated from vowel groups with a silent trailing {@code e}.</p>
 */
public class FleschReadabilityScorer implements ReadabilityScorer {

    private static final Pattern WORD = Pattern.compile("[\\p{L}']+");
    private static final Pattern SENTENCE_END = Pattern.compile("[.!?]+");
    private static final Pattern VOWEL_GROUP = Pattern.compile("[aeiouy]+");

    @Override
    public int score(String content) {
        double ease = readingEase(content);
        if (ease >= 60) {
            return 15;
        }
        if (ease >= 30) {
            return 10;
        }
        return 5;
    }

    @Override
    public String method() {
        return "flesch";
    }

    /**
     * {@code 206.835 - 1.015 * words/sentences - 84.6 * syllables/words}; 0 for text without words.
     */
    double readingEase(String content) {
        Matcher words = WORD.matcher(content);
        int wordCount = 0;
        int syllables = 0;
        while (words.find()) {
            wordCount++;
            syllables += syllables(words.group());
        }
        if (wordCount == 0) {
            return 0;
        }
        int sentenceCount = 0;
        Matcher sentences = SENTENCE_END.matcher(content);
        while (sentences.find()) {
            sentenceCount++;
        }
        sentenceCount = Math.max(1, sentenceCount);
        return 206.835
            - 1.015 * ((double) wordCount / sentenceCount)
            - 84.6 * ((double) syllables / wordCount);
    }

    static int syllables(String word) {
        String lowered = word.toLowerCase(Locale.ROOT).replace("'", "");
        if (lowered.length() <= 3) {
            return 1;
        }
        if (lowered.endsWith("e") && !lowered.endsWith("le")) {
            lowered = lowered.substring(0, lowered.length() - 1);
        }
        Matcher groups = VOWEL_GROUP.matcher(lowered);
        int count = 0;
        while (groups.find()) {
            count++;
        }
        return Math.max(1, count);
    }
}
