package one.nothere.domain.crawl;

/**
 * A URL together with its normalized form and the SHA-256 dedup key of that form.
 *
 * @param raw        the URL as received
 * @param normalized trimmed, fragment-free, scheme-qualified URL
 * @param hash       hex SHA-256 of {@code normalized}
 */
public record CanonicalUrl(String raw, String normalized, String hash) {
}
