package one.nothere.domain.scoring;

/**
 * Informative rank bands over the composite score. Only the indexable
 * threshold gates indexing; tiers order results inside the index.
 */
public enum RankTier {
    EXCLUDE,
    LOW,
    MEDIUM,
    HIGH;

    public static RankTier forComposite(int composite) {
        if (composite < 25) {
            return EXCLUDE;
        }
        if (composite < 40) {
            return LOW;
        }
        if (composite < 50) {
            return MEDIUM;
        }
        return HIGH;
    }
}
