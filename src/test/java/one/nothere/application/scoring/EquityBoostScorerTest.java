package one.nothere.application.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;
import one.nothere.adapters.persistence.DomainSignalRepository;
import one.nothere.config.CacheFactory;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.DimensionScore;
import one.nothere.domain.scoring.EquityRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class EquityBoostScorerTest {

    @Mock
    private DomainSignalRepository signals;

    private EquityBoostScorer scorer;

    @BeforeEach
    void setUp() {
        scorer = new EquityBoostScorer(signals, new CacheFactory(), new ScoringProperties());
    }

    @Test
    void should_CapBoostAtThirty() {
        EquityRecord record = new EquityRecord("coop.example", true, true, true, false, false, false);

        DimensionScore result = EquityBoostScorer.boost(record);

        assertThat(result.value()).isEqualTo(30.0);
        assertThat(result.details())
            .containsEntry("raw_boost", 45)
            .containsEntry("categories", List.of("minority_owned", "women_owned", "veteran_owned"));
    }

    @Test
    void should_AwardTenForBCorpCertification() {
        EquityRecord record = new EquityRecord("b.example", false, false, false, true, false, false);

        assertThat(EquityBoostScorer.boost(record).value()).isEqualTo(10.0);
    }

    @Test
    void should_LookUpBareDomain_AndCacheAbsence() {
        when(signals.findEquity("example.com")).thenReturn(Optional.empty());

        DimensionScore first = scorer.score("www.example.com");
        DimensionScore second = scorer.score("example.com");

        assertThat(first.value()).isZero();
        assertThat(first.details()).containsEntry("reason", "not_in_equity_list");
        assertThat(second).isSameAs(first);
        verify(signals, times(1)).findEquity("example.com");
    }

    @Test
    void should_ScoreZeroWithoutCaching_When_LookupFails() {
        when(signals.findEquity("example.com"))
            .thenThrow(new DataAccessResourceFailureException("down"))
            .thenReturn(Optional.of(new EquityRecord("example.com", false, true, false, false, false, false)));

        DimensionScore degraded = scorer.score("example.com");
        DimensionScore recovered = scorer.score("example.com");

        assertThat(degraded.isDegraded()).isTrue();
        assertThat(degraded.value()).isZero();
        assertThat(recovered.value()).isEqualTo(15.0);
    }
}
