package one.nothere.domain.crawl;

import java.time.Instant;

/**
 * Page row written by the crawler. Identity is the hash of the normalized URL.
 */
public record PageRecord(String url, String urlHash, String domain, String title, String content, Instant crawledAt) {
}
