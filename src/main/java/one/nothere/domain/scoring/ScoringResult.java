package one.nothere.domain.scoring;

import java.time.Instant;
import java.util.Map;

/**
 * Final outcome of scoring one page.
 *
 * <p>Component scores are null when the org blocklist short-circuited scoring.</p>
 */
public record ScoringResult(long pageId,
                            String url,
                            Instant scoredAt,
                            Integer islamicAlignmentScore,
                            Double islamicNormalizedScore,
                            Integer qualityScore,
                            Integer authorityScore,
                            Integer mediaLiteracyScore,
                            Integer equityBoost,
                            int compositeScore,
                            boolean indexable,
                            RankTier rankTier,
                            String blocklistReason,
                            Map<String, Object> components) {

    public boolean orgBlocked() {
        return blocklistReason != null;
    }
}
