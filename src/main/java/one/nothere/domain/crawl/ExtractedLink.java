package one.nothere.domain.crawl;

/**
 * Outbound anchor found on a crawled page.
 *
 * @param targetUrl normalized absolute target
 * @param linkText  anchor text, at most 500 characters, null when empty
 */
public record ExtractedLink(String targetUrl, String linkText) {
}
