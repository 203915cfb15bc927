package one.nothere.application.scoring;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import one.nothere.adapters.persistence.PageRepository;
import one.nothere.adapters.persistence.PageScoreRepository;
import one.nothere.application.medialiteracy.MediaLiteracyGateway;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.DimensionScore;
import one.nothere.domain.scoring.RankTier;
import one.nothere.domain.scoring.ScorablePage;
import one.nothere.domain.scoring.ScoringResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

/**
 * Combines the five scoring dimensions into one composite score and persists it.
 *
 * <p>Weights: alignment 0.30, quality 0.25, authority 0.20, media literacy 0.15,
 * equity 0.10. A domain flagged by the org blocklist scores 0 without computing
 * any dimension. A dimension that cannot be computed degrades on its own; only
 * persistence failures reach the caller.</p>
 */
@Service
public class CompositeScoringService {

    private static final Logger log = LoggerFactory.getLogger(CompositeScoringService.class);

    static final double ALIGNMENT_WEIGHT = 0.30;
    static final double QUALITY_WEIGHT = 0.25;
    static final double AUTHORITY_WEIGHT = 0.20;
    static final double MEDIA_WEIGHT = 0.15;
    static final double EQUITY_WEIGHT = 0.10;
    private static final int PROGRESS_LOG_INTERVAL = 100;

    private final OrgBlocklistChecker orgBlocklistChecker;
    private final IslamicAlignmentScorer alignmentScorer;
    private final QualityScorer qualityScorer;
    private final AuthorityScorer authorityScorer;
    private final MediaLiteracyGateway mediaLiteracyGateway;
    private final EquityBoostScorer equityBoostScorer;
    private final PageRepository pageRepository;
    private final PageScoreRepository scoreRepository;
    private final ScoringProperties properties;
    private final Clock clock;
    private final Timer scoringTimer;
    private final Counter indexableCounter;
    private final Counter excludedCounter;

    public CompositeScoringService(OrgBlocklistChecker orgBlocklistChecker,
                                   IslamicAlignmentScorer alignmentScorer,
                                   QualityScorer qualityScorer,
                                   AuthorityScorer authorityScorer,
                                   MediaLiteracyGateway mediaLiteracyGateway,
                                   EquityBoostScorer equityBoostScorer,
                                   PageRepository pageRepository,
                                   PageScoreRepository scoreRepository,
                                   ScoringProperties properties,
                                   Clock clock,
                                   ObjectProvider<MeterRegistry> meterRegistry) {
        this.orgBlocklistChecker = orgBlocklistChecker;
        this.alignmentScorer = alignmentScorer;
        this.qualityScorer = qualityScorer;
        this.authorityScorer = authorityScorer;
        this.mediaLiteracyGateway = mediaLiteracyGateway;
        this.equityBoostScorer = equityBoostScorer;
        this.pageRepository = pageRepository;
        this.scoreRepository = scoreRepository;
        this.properties = properties;
        this.clock = clock;
        MeterRegistry registry = meterRegistry.getIfAvailable(SimpleMeterRegistry::new);
        this.scoringTimer = Timer.builder("scoring.page.duration").register(registry);
        this.indexableCounter = Counter.builder("scoring.pages").tag("decision", "indexable").register(registry);
        this.excludedCounter = Counter.builder("scoring.pages").tag("decision", "excluded").register(registry);
    }

    /**
     * Scores the page and persists the result.
     *
     * @throws org.springframework.dao.DataAccessException when the result cannot be stored
     */
    public ScoringResult score(ScorablePage page) {
        return scoringTimer.record(() -> scoreAndSave(page));
    }

    /**
     * Loads and scores one stored page.
     *
     * @return empty when no page has this id
     */
    public Optional<ScoringResult> scorePageById(long pageId) {
        return pageRepository.findScorablePage(pageId).map(this::score);
    }

    /**
     * Scores every stored page with content, unscored pages first. A failing page is logged and skipped.
     *
     * @param limit maximum pages, null for all
     */
    public RescoreSummary rescoreAll(Integer limit) {
        List<Long> ids = pageRepository.findIdsForRescoring(limit);
        log.info("Rescoring {} pages", ids.size());
        int scored = 0;
        int indexable = 0;
        int failed = 0;
        for (Long id : ids) {
            try {
                Optional<ScoringResult> result = scorePageById(id);
                if (result.isPresent()) {
                    scored++;
                    if (result.get().indexable()) {
                        indexable++;
                    }
                }
            } catch (RuntimeException e) {
                failed++;
                log.error("Scoring page {} failed: {}", id, e.getMessage(), e);
            }
            int processed = scored + failed;
            if (processed > 0 && processed % PROGRESS_LOG_INTERVAL == 0) {
                log.info("Rescore progress: {}/{} pages ({} indexable, {} failed)", processed, ids.size(), indexable, failed);
            }
        }
        RescoreSummary summary = new RescoreSummary(ids.size(), scored, indexable, failed);
        log.info("Rescore complete: {}", summary);
        return summary;
    }

    private ScoringResult scoreAndSave(ScorablePage page) {
        ScoringResult result = compute(page);
        scoreRepository.save(result);
        (result.indexable() ? indexableCounter : excludedCounter).increment();
        return result;
    }

    ScoringResult compute(ScorablePage page) {
        log.info("Scoring page {}: {}", page.id(), page.url());

        Optional<String> blockReason = orgBlocklistChecker.check(page.domain());
        if (blockReason.isPresent()) {
            log.warn("Page {} blocked by org blocklist: {}", page.id(), blockReason.get());
            Map<String, Object> components = new LinkedHashMap<>();
            components.put("org_blocked", true);
            components.put("reason", blockReason.get());
            return new ScoringResult(page.id(), page.url(), clock.instant(),
                null, null, null, null, null, null,
                0, false, RankTier.EXCLUDE, blockReason.get(), components);
        }

        Map<String, Object> components = new LinkedHashMap<>();

        DimensionScore alignment = alignmentScorer.score(page.content(), page.domain());
        double alignmentNormalized = IslamicAlignmentScorer.normalize(alignment.value());
        components.put("islamic_alignment", component(
            "raw_score", alignment.value(), "normalized_score", alignmentNormalized, alignment));

        DimensionScore quality = qualityScorer.score(page.url(), page.content(), page.domain());
        int qualityScore = quality.intValue();
        Map<String, Object> qualityDetails = new LinkedHashMap<>(quality.details());
        if (page.crawledAt() != null) {
            int freshness = qualityScorer.freshnessScore(page.crawledAt());
            qualityScore = Math.min(100, qualityScore + freshness);
            qualityDetails.put("freshness", freshness);
        }
        components.put("quality", component("score", qualityScore, qualityDetails));

        DimensionScore authority = authorityScorer.score(page.url(), page.domain());
        components.put("authority", component("score", authority.intValue(), authority.details()));

        DimensionScore media = mediaLiteracyGateway.score(page.content(), page.domain(), page.title());
        components.put("media_literacy", component("score", media.intValue(), media.details()));

        DimensionScore equity = equityBoostScorer.score(page.domain());
        components.put("equity_boost", component("boost", equity.intValue(), equity.details()));

        int composite = composite(alignmentNormalized, qualityScore, authority.intValue(), media.intValue(), equity.intValue());
        boolean indexable = composite >= properties.getIndexableThreshold();

        log.info("Page {} final score: {} (indexable={})", page.id(), composite, indexable);
        log.debug("Alignment: {}, quality: {}, authority: {}, media: {}, equity: +{}",
            alignment.value(), qualityScore, authority.intValue(), media.intValue(), equity.intValue());

        return new ScoringResult(page.id(), page.url(), clock.instant(),
            alignment.intValue(), alignmentNormalized, qualityScore, authority.intValue(), media.intValue(),
            equity.intValue(), composite, indexable, RankTier.forComposite(composite), null, components);
    }

    static int composite(double alignmentNormalized, int quality, int authority, int media, int equity) {
        double weighted = alignmentNormalized * ALIGNMENT_WEIGHT
            + quality * QUALITY_WEIGHT
            + authority * AUTHORITY_WEIGHT
            + media * MEDIA_WEIGHT
            + equity * EQUITY_WEIGHT;
        // ties go to the even neighbour
        return (int) Math.rint(weighted);
    }

    private static Map<String, Object> component(String scoreKey, Object score, Map<String, Object> details) {
        Map<String, Object> component = new LinkedHashMap<>();
        component.put(scoreKey, score);
        component.put("details", details);
        return component;
    }

    private static Map<String, Object> component(String rawKey, Object raw, String normalizedKey, Object normalized,
                                                 DimensionScore score) {
        Map<String, Object> component = new LinkedHashMap<>();
        component.put(rawKey, raw);
        component.put(normalizedKey, normalized);
        component.put("details", score.details());
        return component;
    }

    public record RescoreSummary(int candidates, int scored, int indexable, int failed) {
    }
}
