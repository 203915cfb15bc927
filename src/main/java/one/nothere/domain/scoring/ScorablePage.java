package one.nothere.domain.scoring;

import java.time.Instant;

/**
 * Persisted page as seen by the scoring engine.
 *
 * @param crawledAt null when the page was never fetched (freshness is then skipped)
 */
public record ScorablePage(long id, String url, String domain, String title, String content, Instant crawledAt) {
}
