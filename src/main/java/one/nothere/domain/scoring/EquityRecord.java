package one.nothere.domain.scoring;

/**
 * Ownership and social-impact certifications for one bare domain.
 */
public record EquityRecord(String domain,
                           boolean minorityOwned,
                           boolean womenOwned,
                           boolean veteranOwned,
                           boolean bCorp,
                           boolean lgbtqOwned,
                           boolean disabilityOwned) {
}
