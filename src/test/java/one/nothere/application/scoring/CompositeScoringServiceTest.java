package one.nothere.application.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
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
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.beans.factory.support.StaticListableBeanFactory;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CompositeScoringServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T10:00:00Z");
    private static final ScorablePage PAGE = new ScorablePage(
        42L, "https://example.org/zakat", "example.org", "Zakat", "content", NOW.minusSeconds(3600));

    @Mock
    private OrgBlocklistChecker orgBlocklistChecker;
    @Mock
    private IslamicAlignmentScorer alignmentScorer;
    @Mock
    private QualityScorer qualityScorer;
    @Mock
    private AuthorityScorer authorityScorer;
    @Mock
    private MediaLiteracyGateway mediaLiteracyGateway;
    @Mock
    private EquityBoostScorer equityBoostScorer;
    @Mock
    private PageRepository pageRepository;
    @Mock
    private PageScoreRepository scoreRepository;

    private SimpleMeterRegistry registry;
    private CompositeScoringService service;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        StaticListableBeanFactory beans = new StaticListableBeanFactory();
        beans.addBean("meterRegistry", registry);
        service = new CompositeScoringService(orgBlocklistChecker, alignmentScorer, qualityScorer, authorityScorer,
            mediaLiteracyGateway, equityBoostScorer, pageRepository, scoreRepository, new ScoringProperties(),
            Clock.fixed(NOW, ZoneOffset.UTC), beans.getBeanProvider(MeterRegistry.class));

        when(orgBlocklistChecker.check(anyString())).thenReturn(Optional.empty());
        when(alignmentScorer.score(anyString(), anyString())).thenReturn(DimensionScore.of(20, Map.of()));
        when(qualityScorer.score(anyString(), anyString(), anyString())).thenReturn(DimensionScore.of(40, Map.of("total", 40)));
        when(qualityScorer.freshnessScore(any())).thenReturn(15);
        when(authorityScorer.score(anyString(), anyString())).thenReturn(DimensionScore.of(30, Map.of()));
        when(mediaLiteracyGateway.score(anyString(), anyString(), anyString()))
            .thenReturn(DimensionScore.of(50, Map.of("status", "neutral")));
        when(equityBoostScorer.score(anyString())).thenReturn(DimensionScore.of(0, Map.of()));
    }

    @Test
    void should_WeightDimensionsIntoComposite() {
        assertThat(CompositeScoringService.composite(50, 50, 50, 50, 0)).isEqualTo(45);
        assertThat(CompositeScoringService.composite(100, 100, 100, 100, 30)).isEqualTo(93);
        assertThat(CompositeScoringService.composite(0, 0, 0, 0, 0)).isZero();
    }

    @Test
    void should_RoundTiesToEven() {
        // 15 + 12.5 + 10 + 7.5 + 0.5
        assertThat(CompositeScoringService.composite(50, 50, 50, 50, 5)).isEqualTo(46);
        // 15 + 12.5 + 10 + 7.5 - 0.5
        assertThat(CompositeScoringService.composite(50, 50, 50, 50, -5)).isEqualTo(44);
        // 15 + 12.5 + 10 + 7.5 + 1.5
        assertThat(CompositeScoringService.composite(50, 50, 50, 50, 15)).isEqualTo(46);
    }

    @Test
    void should_StayBelowIndexableThreshold_When_CompositeIsExactlyHalfwayBelowIt() {
        // 15 + 0 + 2 + 7.5 + 0 = 24.5
        int composite = CompositeScoringService.composite(50, 0, 10, 50, 0);

        assertThat(composite).isEqualTo(24);
        assertThat(composite).isLessThan(new ScoringProperties().getIndexableThreshold());
    }

    @Test
    void should_CombineDimensions_AndAddFreshnessToQuality() {
        ScoringResult result = service.compute(PAGE);

        // 60 * 0.30 + 55 * 0.25 + 30 * 0.20 + 50 * 0.15 + 0 * 0.10 = 45.25
        assertThat(result.compositeScore()).isEqualTo(45);
        assertThat(result.indexable()).isTrue();
        assertThat(result.rankTier()).isEqualTo(RankTier.MEDIUM);
        assertThat(result.islamicAlignmentScore()).isEqualTo(20);
        assertThat(result.islamicNormalizedScore()).isEqualTo(60.0);
        assertThat(result.qualityScore()).isEqualTo(55);
        assertThat(result.scoredAt()).isEqualTo(NOW);
        assertThat(result.orgBlocked()).isFalse();
        assertThat(result.components()).containsOnlyKeys(
            "islamic_alignment", "quality", "authority", "media_literacy", "equity_boost");

        @SuppressWarnings("unchecked")
        Map<String, Object> quality = (Map<String, Object>) result.components().get("quality");
        assertThat(quality).containsEntry("score", 55);
        assertThat(quality.get("details"))
            .asInstanceOf(InstanceOfAssertFactories.map(String.class, Object.class))
            .containsEntry("freshness", 15);
    }

    @Test
    void should_SkipFreshness_When_PageWasNeverFetched() {
        ScorablePage unfetched = new ScorablePage(7L, PAGE.url(), PAGE.domain(), PAGE.title(), PAGE.content(), null);

        ScoringResult result = service.compute(unfetched);

        // 18 + 10 + 6 + 7.5 = 41.5
        assertThat(result.qualityScore()).isEqualTo(40);
        assertThat(result.compositeScore()).isEqualTo(42);
        verify(qualityScorer, never()).freshnessScore(any());
    }

    @Test
    void should_ExcludeWithoutScoring_When_OrgBlocklisted() {
        when(orgBlocklistChecker.check("example.org")).thenReturn(Optional.of("Flagged by: SPLC - hate group"));

        ScoringResult result = service.compute(PAGE);

        assertThat(result.compositeScore()).isZero();
        assertThat(result.indexable()).isFalse();
        assertThat(result.rankTier()).isEqualTo(RankTier.EXCLUDE);
        assertThat(result.orgBlocked()).isTrue();
        assertThat(result.qualityScore()).isNull();
        assertThat(result.islamicAlignmentScore()).isNull();
        assertThat(result.components())
            .containsEntry("org_blocked", true)
            .containsEntry("reason", "Flagged by: SPLC - hate group");
        verifyNoInteractions(alignmentScorer, qualityScorer, authorityScorer, mediaLiteracyGateway, equityBoostScorer);
    }

    @Test
    void should_MarkNotIndexable_When_BelowThreshold() {
        when(alignmentScorer.score(anyString(), anyString())).thenReturn(DimensionScore.of(-100, Map.of()));
        when(qualityScorer.score(anyString(), anyString(), anyString())).thenReturn(DimensionScore.of(0, Map.of()));
        when(qualityScorer.freshnessScore(any())).thenReturn(2);
        when(authorityScorer.score(anyString(), anyString())).thenReturn(DimensionScore.of(10, Map.of()));
        when(mediaLiteracyGateway.score(anyString(), anyString(), anyString())).thenReturn(DimensionScore.of(20, Map.of()));

        ScoringResult result = service.compute(PAGE);

        // 0 + 0.5 + 2 + 3 + 0 = 5.5
        assertThat(result.compositeScore()).isEqualTo(6);
        assertThat(result.indexable()).isFalse();
        assertThat(result.rankTier()).isEqualTo(RankTier.EXCLUDE);
    }

    @Test
    void should_PersistResult_AndCountDecision() {
        ScoringResult result = service.score(PAGE);

        verify(scoreRepository).save(result);
        assertThat(registry.get("scoring.pages").tag("decision", "indexable").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("scoring.page.duration").timer().count()).isEqualTo(1L);
    }

    @Test
    void should_ReturnEmpty_When_PageIdUnknown() {
        when(pageRepository.findScorablePage(99L)).thenReturn(Optional.empty());

        assertThat(service.scorePageById(99L)).isEmpty();
        verifyNoInteractions(scoreRepository);
    }

    @Test
    void should_ContinueRescoring_When_OnePageFails() {
        when(pageRepository.findIdsForRescoring(null)).thenReturn(List.of(1L, 2L, 3L));
        when(pageRepository.findScorablePage(1L)).thenReturn(Optional.of(PAGE));
        when(pageRepository.findScorablePage(2L)).thenThrow(new DataAccessResourceFailureException("lost connection"));
        when(pageRepository.findScorablePage(3L)).thenReturn(Optional.empty());

        CompositeScoringService.RescoreSummary summary = service.rescoreAll(null);

        assertThat(summary).isEqualTo(new CompositeScoringService.RescoreSummary(3, 1, 1, 1));
    }
}
