package one.nothere.domain.crawl;

/**
 * Terminal state of one pass through the crawl worker.
 *
 * @param status   terminal state
 * @param url      normalized URL that was processed
 * @param reason   why the worker stopped, null for a normal completion
 * @param pageId   id of the persisted page on {@link Status#DONE}
 * @param linksFound number of links extracted on {@link Status#DONE}
 */
public record CrawlOutcome(Status status, String url, String reason, Long pageId, int linksFound) {

    public enum Status {
        DONE,
        ALREADY_CRAWLED,
        BLOCKED,
        FAILED
    }

    public static CrawlOutcome done(String url, long pageId, int linksFound) {
        return new CrawlOutcome(Status.DONE, url, null, pageId, linksFound);
    }

    public static CrawlOutcome alreadyCrawled(String url) {
        return new CrawlOutcome(Status.ALREADY_CRAWLED, url, "already crawled", null, 0);
    }

    public static CrawlOutcome blocked(String url, String reason) {
        return new CrawlOutcome(Status.BLOCKED, url, reason, null, 0);
    }

    public static CrawlOutcome failed(String url, String reason) {
        return new CrawlOutcome(Status.FAILED, url, reason, null, 0);
    }
}
