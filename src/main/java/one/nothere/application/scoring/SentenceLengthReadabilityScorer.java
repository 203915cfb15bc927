package one.nothere.application.scoring;

/**
 * Average words per sentence: up to 15 scores 15, up to 25 scores 10, longer scores 5.
 * Text without sentence punctuation scores 5.
 */
public class SentenceLengthReadabilityScorer implements ReadabilityScorer {

    @Override
    public int score(String content) {
        int words = TextStats.wordCount(content);
        long sentences = content.chars().filter(c -> c == '.' || c == '!' || c == '?').count();
        if (sentences == 0) {
            return 5;
        }
        double averageWords = (double) words / sentences;
        if (averageWords <= 15) {
            return 15;
        }
        if (averageWords <= 25) {
            return 10;
        }
        return 5;
    }

    @Override
    public String method() {
        return "sentence-length";
    }
}
