package one.nothere.application.frontier;

import java.util.Optional;
import one.nothere.adapters.persistence.PageRepository;
import one.nothere.application.blocklist.BlockDecision;
import one.nothere.application.blocklist.Tier1Blocklist;
import one.nothere.application.crawl.CrawlStatistics;
import one.nothere.domain.crawl.CanonicalUrl;
import one.nothere.util.UrlCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Admission policy in front of the frontier store.
 *
 * <p>A URL is admitted only when the Tier-1 blocklist allows it, no page with its
 * hash has been persisted, and the store has not seen it before.</p>
 */
@Service
public class FrontierManager {

    private static final Logger log = LoggerFactory.getLogger(FrontierManager.class);

    private final FrontierStore store;
    private final Tier1Blocklist blocklist;
    private final PageRepository pageRepository;
    private final CrawlStatistics statistics;

    public FrontierManager(FrontierStore store,
                           Tier1Blocklist blocklist,
                           PageRepository pageRepository,
                           CrawlStatistics statistics) {
        this.store = store;
        this.blocklist = blocklist;
        this.pageRepository = pageRepository;
        this.statistics = statistics;
    }

    /**
     * Attempts to admit a URL.
     *
     * @param url raw or normalized URL
     * @return true when the URL was pushed onto the frontier
     */
    public boolean enqueue(String url) {
        CanonicalUrl canonical = UrlCanonicalizer.canonicalize(url);
        BlockDecision decision = blocklist.isBlocked(canonical.normalized());
        if (decision.blocked()) {
            log.debug("Not queued, {}: {}", decision.reason(), canonical.normalized());
            return false;
        }
        if (pageRepository.existsByUrlHash(canonical.hash())) {
            log.debug("Not queued, already crawled: {}", canonical.normalized());
            return false;
        }
        if (!store.offer(canonical.normalized())) {
            return false;
        }
        statistics.recordQueued();
        return true;
    }

    /**
     * Pops the next URL in FIFO order, empty when the frontier is exhausted.
     */
    public Optional<String> dequeue() {
        return store.poll();
    }

    public boolean isQueued(String url) {
        return store.isMember(UrlCanonicalizer.normalize(url));
    }

    public void clear() {
        store.clear();
        log.info("Frontier cleared");
    }

    public Stats stats() {
        return new Stats(store.queueSize(), store.memberCount());
    }

    /**
     * @param queued URLs waiting to be crawled
     * @param seen   URLs ever admitted, queued or not
     */
    public record Stats(long queued, long seen) {
    }
}
