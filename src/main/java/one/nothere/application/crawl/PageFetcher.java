package one.nothere.application.crawl;

import one.nothere.domain.crawl.FetchResult;
import one.nothere.exception.PageFetchException;

/**
 * Retrieves a page over HTTP, following redirects, within a bounded time.
 */
public interface PageFetcher {

    /**
     * @return the response whatever its status or content type
     * @throws PageFetchException when no response could be obtained
     */
    FetchResult fetch(String url);
}
