package one.nothere.application.scoring;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import one.nothere.adapters.persistence.DomainSignalRepository;
import one.nothere.config.CacheFactory;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.DimensionScore;
import one.nothere.domain.scoring.EquityRecord;
import one.nothere.support.cache.TtlCache;
import one.nothere.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

/**
 * Bonus for certified ownership categories, capped at 30.
 */
@Component
public class EquityBoostScorer {

    private static final Logger log = LoggerFactory.getLogger(EquityBoostScorer.class);

    static final int MAX_BOOST = 30;
    private static final int OWNERSHIP_BONUS = 15;
    private static final int B_CORP_BONUS = 10;

    private final DomainSignalRepository signalRepository;
    private final TtlCache<String, DimensionScore> cache;

    public EquityBoostScorer(DomainSignalRepository signalRepository, CacheFactory cacheFactory,
                             ScoringProperties properties) {
        this.signalRepository = signalRepository;
        ScoringProperties.Cache cacheProperties = properties.getCache();
        this.cache = cacheFactory.createCache("equity", cacheProperties.getMaxSize(),
            cacheProperties.getEquityTtl(), cacheProperties.isEnabled());
    }

    public DimensionScore score(String domain) {
        String bareDomain = DomainNames.bareHost(domain);
        Optional<DimensionScore> cached = cache.getIfPresent(bareDomain);
        if (cached.isPresent()) {
            return cached.get();
        }

        Optional<EquityRecord> record;
        try {
            record = signalRepository.findEquity(bareDomain);
        } catch (DataAccessException e) {
            log.warn("Equity lookup failed for {}: {}", bareDomain, e.getMessage());
            return DimensionScore.degraded(0, "equity_lookup_failed: " + e.getMessage());
        }

        DimensionScore result = record.map(EquityBoostScorer::boost)
            .orElseGet(() -> DimensionScore.of(0, Map.of("reason", "not_in_equity_list")));
        if (result.value() > 0) {
            log.info("Equity boost for {}: +{} {}", bareDomain, result.intValue(), result.details().get("categories"));
        }
        cache.put(bareDomain, result);
        return result;
    }

    static DimensionScore boost(EquityRecord record) {
        List<String> categories = new ArrayList<>();
        int boost = 0;
        if (record.minorityOwned()) {
            boost += OWNERSHIP_BONUS;
            categories.add("minority_owned");
        }
        if (record.womenOwned()) {
            boost += OWNERSHIP_BONUS;
            categories.add("women_owned");
        }
        if (record.veteranOwned()) {
            boost += OWNERSHIP_BONUS;
            categories.add("veteran_owned");
        }
        if (record.bCorp()) {
            boost += B_CORP_BONUS;
            categories.add("b_corp");
        }
        if (record.lgbtqOwned()) {
            boost += OWNERSHIP_BONUS;
            categories.add("lgbtq_owned");
        }
        if (record.disabilityOwned()) {
            boost += OWNERSHIP_BONUS;
            categories.add("disability_owned");
        }
        int capped = Math.min(boost, MAX_BOOST);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("boost", capped);
        details.put("raw_boost", boost);
        details.put("categories", categories);
        return DimensionScore.of(capped, details);
    }
}
