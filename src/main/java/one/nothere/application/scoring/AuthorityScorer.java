package one.nothere.application.scoring;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import one.nothere.adapters.persistence.DomainSignalRepository;
import one.nothere.config.CacheFactory;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.DimensionScore;
import one.nothere.support.cache.TtlCache;
import one.nothere.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Domain authority from TLD prestige, inbound links and academic or government referrers.
 *
 * <p>Results are cached per bare domain for {@code scoring.cache.authority-ttl}; the backlink
 * part of the first URL scored on a domain stands in for the whole domain until expiry.</p>
 */
@Component
public class AuthorityScorer {

    private static final Logger log = LoggerFactory.getLogger(AuthorityScorer.class);

    private static final List<String> ACADEMIC_SUFFIXES = List.of(".edu", ".ac.uk", ".ac.in", ".edu.au");

    private final DomainSignalRepository signalRepository;
    private final TtlCache<String, DimensionScore> cache;

    public AuthorityScorer(DomainSignalRepository signalRepository, CacheFactory cacheFactory,
                           ScoringProperties properties) {
        this.signalRepository = signalRepository;
        ScoringProperties.Cache cacheProperties = properties.getCache();
        this.cache = cacheFactory.createCache("authority", cacheProperties.getMaxSize(),
            cacheProperties.getAuthorityTtl(), cacheProperties.isEnabled());
    }

    public DimensionScore score(String url, String domain) {
        String bareDomain = DomainNames.bareHost(domain);
        Optional<DimensionScore> cached = cache.getIfPresent(bareDomain);
        if (cached.isPresent()) {
            return cached.get();
        }

        int tldScore = tldScore(bareDomain);
        DimensionScore result;
        try {
            int backlinkScore = backlinkScore(signalRepository.countBacklinks(url));
            int externalScore = externalAuthorityScore(url);

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("tld_score", tldScore);
            details.put("backlink_score", backlinkScore);
            details.put("external_authority_score", externalScore);
            int total = tldScore + backlinkScore + externalScore;
            details.put("total", total);
            result = DimensionScore.of(total, details);
        } catch (DataAccessException e) {
            log.warn("Authority lookup failed for {}, falling back to TLD score: {}", bareDomain, e.getMessage());
            // Not cached so the next page on the domain retries the lookup
            return DimensionScore.degraded(tldScore, "link_lookup_failed: " + e.getMessage());
        }

        cache.put(bareDomain, result);
        return result;
    }

    static int tldScore(String bareDomain) {
        if (bareDomain.endsWith(".gov")) {
            return 50;
        }
        if (ACADEMIC_SUFFIXES.stream().anyMatch(bareDomain::endsWith)) {
            return 45;
        }
        if (bareDomain.endsWith(".org")) {
            return 30;
        }
        if (bareDomain.endsWith(".com") || bareDomain.endsWith(".net")) {
            return 20;
        }
        return 10;
    }

    static int backlinkScore(long backlinks) {
        if (backlinks == 0) {
            return 0;
        }
        if (backlinks <= 5) {
            return 10;
        }
        if (backlinks <= 20) {
            return 20;
        }
        return 30;
    }

    private int externalAuthorityScore(String url) {
        int score = 0;
        if (signalRepository.countReferringDomainsWithSuffix(url, ".edu") > 0) {
            score += 10;
        }
        if (signalRepository.countReferringDomainsWithSuffix(url, ".gov") > 0) {
            score += 10;
        }
        return Math.min(score, 20);
    }
}
