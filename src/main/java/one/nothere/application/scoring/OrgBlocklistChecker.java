package one.nothere.application.scoring;

import java.util.Optional;
import one.nothere.adapters.persistence.DomainSignalRepository;
import one.nothere.config.CacheFactory;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.OrgBlocklistRecord;
import one.nothere.support.cache.TtlCache;
import one.nothere.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Organisation blocklist lookup. A flagged domain overrides every other score.
 *
 * <p>Lookup failures are logged and treated as not flagged.</p>
 */
@Component
public class OrgBlocklistChecker {

    private static final Logger log = LoggerFactory.getLogger(OrgBlocklistChecker.class);

    private final DomainSignalRepository signalRepository;
    private final TtlCache<String, Optional<String>> cache;

    public OrgBlocklistChecker(DomainSignalRepository signalRepository, CacheFactory cacheFactory,
                               ScoringProperties properties) {
        this.signalRepository = signalRepository;
        ScoringProperties.Cache cacheProperties = properties.getCache();
        this.cache = cacheFactory.createCache("org-blocklist", cacheProperties.getMaxSize(),
            cacheProperties.getOrgBlocklistTtl(), cacheProperties.isEnabled());
    }

    /**
     * @return the block reason, such as {@code Flagged by: SPLC, ADL - hate group}, when the domain is flagged
     */
    public Optional<String> check(String domain) {
        String bareDomain = DomainNames.bareHost(domain);
        Optional<Optional<String>> cached = cache.getIfPresent(bareDomain);
        if (cached.isPresent()) {
            return cached.get();
        }

        Optional<String> reason;
        try {
            reason = signalRepository.findOrgBlocklist(bareDomain)
                .filter(OrgBlocklistRecord::isFlagged)
                .map(OrgBlocklistChecker::describe);
        } catch (DataAccessException e) {
            log.error("Org blocklist lookup failed for {}, treating as not flagged: {}", bareDomain, e.getMessage());
            return Optional.empty();
        }
        cache.put(bareDomain, reason);
        return reason;
    }

    static String describe(OrgBlocklistRecord record) {
        StringBuilder reason = new StringBuilder("Flagged by: ").append(String.join(", ", record.flaggedBy()));
        if (record.reason() != null && !record.reason().isBlank()) {
            reason.append(" - ").append(record.reason().trim());
        }
        return reason.toString();
    }
}
