package one.nothere.application.crawl;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Cumulative crawl counters for one process.
 * - crawled: pages fetched and persisted
 * - blocked: URLs excluded by the blocklist or robots.txt
 * - failed: transport, extraction and persistence failures
 * - linksFound: links extracted from persisted pages
 * - queued: URLs admitted into the frontier
 */
@Component
public class CrawlStatistics implements MeterBinder {

    private final AtomicLong crawled = new AtomicLong(0);
    private final AtomicLong blocked = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private final AtomicLong linksFound = new AtomicLong(0);
    private final AtomicLong queued = new AtomicLong(0);

    public void recordCrawled(int links) {
        crawled.incrementAndGet();
        linksFound.addAndGet(links);
    }

    public void recordBlocked() {
        blocked.incrementAndGet();
    }

    public void recordFailed() {
        failed.incrementAndGet();
    }

    public void recordQueued() {
        queued.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(crawled.get(), blocked.get(), failed.get(), linksFound.get(), queued.get());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("crawler.pages.crawled", crawled, AtomicLong::get).register(registry);
        FunctionCounter.builder("crawler.pages.blocked", blocked, AtomicLong::get).register(registry);
        FunctionCounter.builder("crawler.pages.failed", failed, AtomicLong::get).register(registry);
        FunctionCounter.builder("crawler.links.found", linksFound, AtomicLong::get).register(registry);
        FunctionCounter.builder("crawler.urls.queued", queued, AtomicLong::get).register(registry);
    }

    /**
     * Point-in-time copy of the counters.
     */
    public record Snapshot(long crawled, long blocked, long failed, long linksFound, long queued) {

        @Override
        public String toString() {
            return "crawled=%d, blocked=%d, failed=%d, links_found=%d, queued=%d"
                .formatted(crawled, blocked, failed, linksFound, queued);
        }
    }
}
