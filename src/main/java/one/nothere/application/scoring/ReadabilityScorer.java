package one.nothere.application.scoring;

/**
 * Readability points (0-15) for page text; easier text scores higher.
 */
public interface ReadabilityScorer {

    int score(String content);

    /**
     * Short identifier recorded in the quality breakdown.
     */
    String method();
}
