package one.nothere.application.crawl;

import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import one.nothere.adapters.persistence.PageRepository;
import one.nothere.application.blocklist.Tier1Blocklist;
import one.nothere.application.frontier.FrontierManager;
import one.nothere.config.CrawlerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Drains the frontier with a single sequential worker.
 *
 * <p>Terminates on the page limit, on frontier exhaustion, or on a cooperative
 * stop request. A stop lets the in-flight URL finish before the loop exits;
 * context shutdown requests a stop and waits (bounded) for that to happen.</p>
 */
@Service
public class CrawlLoop {

    private static final Logger log = LoggerFactory.getLogger(CrawlLoop.class);

    private final FrontierManager frontier;
    private final Tier1Blocklist blocklist;
    private final RobotsComplianceCache robots;
    private final PageFetcher fetcher;
    private final PageContentExtractor extractor;
    private final PageRepository pageRepository;
    private final CrawlStatistics statistics;
    private final CrawlerProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile CountDownLatch finished = new CountDownLatch(0);

    public CrawlLoop(FrontierManager frontier,
                     Tier1Blocklist blocklist,
                     RobotsComplianceCache robots,
                     PageFetcher fetcher,
                     PageContentExtractor extractor,
                     PageRepository pageRepository,
                     CrawlStatistics statistics,
                     CrawlerProperties properties,
                     Clock clock) {
        this.frontier = frontier;
        this.blocklist = blocklist;
        this.robots = robots;
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.pageRepository = pageRepository;
        this.statistics = statistics;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Crawls until a termination condition is met.
     *
     * @param maxPages        maximum URLs to process, null for no limit
     * @param delayOverride   politeness delay for this run, null for the configured one
     * @return statistics at termination
     */
    public CrawlStatistics.Snapshot run(Integer maxPages, Duration delayOverride) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("A crawl is already running in this process");
        }
        stopRequested.set(false);
        finished = new CountDownLatch(1);

        Duration delay = delayOverride != null ? delayOverride : properties.getPolitenessDelay();
        CrawlWorker worker = new CrawlWorker(frontier, blocklist, robots, fetcher, extractor,
            pageRepository, statistics, clock, delay);
        int statsInterval = properties.getStatsInterval();
        int processed = 0;

        log.info("Crawl started (maxPages={}, delay={}ms, queued={})",
            maxPages == null ? "unlimited" : maxPages, delay.toMillis(), frontier.stats().queued());
        try {
            while (true) {
                if (stopRequested.get() || Thread.currentThread().isInterrupted()) {
                    log.info("Crawl stopped on request after {} URLs", processed);
                    break;
                }
                if (maxPages != null && processed >= maxPages) {
                    log.info("Reached max pages limit ({})", maxPages);
                    break;
                }
                Optional<String> next = frontier.dequeue();
                if (next.isEmpty()) {
                    log.info("Frontier exhausted after {} URLs", processed);
                    break;
                }
                worker.crawl(next.get());
                processed++;
                if (processed % statsInterval == 0) {
                    log.info("Progress after {} URLs: {}", processed, statistics.snapshot());
                }
            }
        } finally {
            CrawlStatistics.Snapshot snapshot = statistics.snapshot();
            log.info("Crawl finished: {} (frontier remaining={})", snapshot, safeQueueSize());
            running.set(false);
            finished.countDown();
        }
        return statistics.snapshot();
    }

    /**
     * Asks the running loop to stop after the in-flight URL.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    @PreDestroy
    void shutdown() {
        if (!running.get()) {
            return;
        }
        log.info("Shutdown requested, waiting for in-flight URL");
        requestStop();
        try {
            if (!finished.await(properties.getShutdownGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Crawl did not stop within {}", properties.getShutdownGracePeriod());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private String safeQueueSize() {
        try {
            return String.valueOf(frontier.stats().queued());
        } catch (RuntimeException e) {
            return "unknown";
        }
    }
}
