package one.nothere.util;

import one.nothere.domain.crawl.CanonicalUrl;

/**
 * Turns raw URLs into the normalized form used as the crawl dedup key.
 *
 * <p>Rules: trim whitespace, drop everything from the first {@code #},
 * prepend {@code https://} when no http(s) scheme is present. Case, trailing
 * slashes and query strings are left alone, so two URLs that differ only by
 * query string stay distinct pages.</p>
 */
public final class UrlCanonicalizer {

    private static final String HTTP_PREFIX = "http://";
    private static final String HTTPS_PREFIX = "https://";

    private UrlCanonicalizer() {
    }

    /**
     * Normalizes a raw URL string.
     *
     * @param raw URL as discovered or seeded, may carry whitespace or a fragment
     * @return normalized URL, never null
     */
    public static String normalize(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("URL cannot be null");
        }
        String url = raw.trim();
        int fragment = url.indexOf('#');
        if (fragment >= 0) {
            url = url.substring(0, fragment);
        }
        if (!url.startsWith(HTTP_PREFIX) && !url.startsWith(HTTPS_PREFIX)) {
            url = HTTPS_PREFIX + url;
        }
        return url;
    }

    /**
     * Hashes an already normalized URL.
     */
    public static String hash(String normalized) {
        return HashUtils.sha256Hex(normalized);
    }

    /**
     * Normalizes and hashes in one step.
     */
    public static CanonicalUrl canonicalize(String raw) {
        String normalized = normalize(raw);
        return new CanonicalUrl(raw, normalized, hash(normalized));
    }
}
