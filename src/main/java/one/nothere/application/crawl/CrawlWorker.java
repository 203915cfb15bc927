package one.nothere.application.crawl;

import java.time.Clock;
import java.time.Duration;
import one.nothere.adapters.persistence.PageRepository;
import one.nothere.application.blocklist.BlockDecision;
import one.nothere.application.blocklist.Tier1Blocklist;
import one.nothere.application.frontier.FrontierManager;
import one.nothere.domain.crawl.CanonicalUrl;
import one.nothere.domain.crawl.CrawlOutcome;
import one.nothere.domain.crawl.ExtractedLink;
import one.nothere.domain.crawl.ExtractedPage;
import one.nothere.domain.crawl.FetchResult;
import one.nothere.domain.crawl.PageRecord;
import one.nothere.exception.ContentExtractionException;
import one.nothere.exception.PageFetchException;
import one.nothere.util.DomainNames;
import one.nothere.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;

/**
 * Runs one dequeued URL through fetch, extract, persist and link discovery.
 *
 * <p>Every path ends in a {@link CrawlOutcome}; failures are counted and the URL
 * is abandoned for this run. The only signal that escapes is thread interruption,
 * which is restored on the thread before returning.</p>
 */
public class CrawlWorker {

    private static final Logger log = LoggerFactory.getLogger(CrawlWorker.class);

    private final FrontierManager frontier;
    private final Tier1Blocklist blocklist;
    private final RobotsComplianceCache robots;
    private final PageFetcher fetcher;
    private final PageContentExtractor extractor;
    private final PageRepository pageRepository;
    private final CrawlStatistics statistics;
    private final Clock clock;
    private final Duration politenessDelay;

    public CrawlWorker(FrontierManager frontier,
                       Tier1Blocklist blocklist,
                       RobotsComplianceCache robots,
                       PageFetcher fetcher,
                       PageContentExtractor extractor,
                       PageRepository pageRepository,
                       CrawlStatistics statistics,
                       Clock clock,
                       Duration politenessDelay) {
        this.frontier = frontier;
        this.blocklist = blocklist;
        this.robots = robots;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.pageRepository = pageRepository;
        this.statistics = statistics;
        this.clock = clock;
        this.politenessDelay = politenessDelay;
    }

    /**
     * Crawls a single URL. Never throws; an unexpected runtime failure is
     * counted and reported as {@link CrawlOutcome.Status#FAILED}.
     */
    public CrawlOutcome crawl(String url) {
        try {
            return process(url);
        } catch (RuntimeException e) {
            log.error("Unexpected failure crawling {}", url, e);
            statistics.recordFailed();
            return CrawlOutcome.failed(url, "unexpected " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private CrawlOutcome process(String url) {
        CanonicalUrl canonical = UrlCanonicalizer.canonicalize(url);
        String normalized = canonical.normalized();

        try {
            if (pageRepository.existsByUrlHash(canonical.hash())) {
                log.debug("Already crawled: {}", normalized);
                return CrawlOutcome.alreadyCrawled(normalized);
            }
        } catch (DataAccessException e) {
            log.warn("Crawled-check failed for {}: {}", normalized, e.getMessage());
            statistics.recordFailed();
            return CrawlOutcome.failed(normalized, "crawled-check failed: " + e.getMessage());
        }

        BlockDecision decision = blocklist.isBlocked(normalized);
        if (decision.blocked()) {
            return blocked(normalized, decision.reason());
        }
        if (!robots.canFetch(normalized)) {
            return blocked(normalized, "Disallowed by robots.txt");
        }

        if (!politenessPause()) {
            statistics.recordFailed();
            return CrawlOutcome.failed(normalized, "interrupted before fetch");
        }

        // Fetching
        FetchResult response;
        try {
            log.info("Crawling: {}", normalized);
            response = fetcher.fetch(normalized);
        } catch (PageFetchException e) {
            return failed(normalized, e.getMessage());
        }
        if (!response.isOk()) {
            return failed(normalized, "HTTP " + response.statusCode());
        }
        if (!response.isHtml()) {
            return failed(normalized, "Not HTML: " + response.contentType());
        }

        String finalUrl = response.finalUrl();
        if (response.wasRedirected()) {
            BlockDecision redirected = blocklist.isBlocked(finalUrl);
            if (redirected.blocked()) {
                return blocked(normalized, "Redirect to blocked URL " + finalUrl + " (" + redirected.reason() + ")");
            }
        }

        // Extracting
        ExtractedPage page;
        try {
            page = extractor.extract(response.body(), finalUrl);
        } catch (ContentExtractionException e) {
            return failed(normalized, e.getMessage());
        }

        // Persisting
        long pageId;
        try {
            String domain = DomainNames.authority(finalUrl).orElse("");
            PageRecord record = new PageRecord(
                finalUrl,
                UrlCanonicalizer.hash(finalUrl),
                domain,
                page.title(),
                page.content(),
                clock.instant()
            );
            pageId = pageRepository.savePageWithLinks(record, page.links());
        } catch (DataAccessException e) {
            return failed(normalized, "persistence failed: " + e.getMessage());
        }

        // Link discovery
        int admitted = 0;
        for (ExtractedLink link : page.links()) {
            try {
                if (frontier.enqueue(link.targetUrl())) {
                    admitted++;
                }
            } catch (DataAccessException e) {
                log.warn("Could not queue discovered link {}: {}", link.targetUrl(), e.getMessage());
            }
        }

        statistics.recordCrawled(page.links().size());
        log.info("Crawled page {}: {} ({} links, {} queued)", pageId, finalUrl, page.links().size(), admitted);
        return CrawlOutcome.done(normalized, pageId, page.links().size());
    }

    private boolean politenessPause() {
        if (politenessDelay.isZero() || politenessDelay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(politenessDelay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private CrawlOutcome blocked(String url, String reason) {
        log.info("Blocked: {} ({})", url, reason);
        statistics.recordBlocked();
        return CrawlOutcome.blocked(url, reason);
    }

    private CrawlOutcome failed(String url, String reason) {
        log.warn("Failed: {} ({})", url, reason);
        statistics.recordFailed();
        return CrawlOutcome.failed(url, reason);
    }
}
