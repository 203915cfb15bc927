package one.nothere.application.scoring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Optional;
import one.nothere.adapters.persistence.DomainSignalRepository;
import one.nothere.config.CacheFactory;
import one.nothere.config.ScoringProperties;
import one.nothere.domain.scoring.OrgBlocklistRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class OrgBlocklistCheckerTest {

    @Mock
    private DomainSignalRepository signals;

    private OrgBlocklistChecker checker;

    @BeforeEach
    void setUp() {
        checker = new OrgBlocklistChecker(signals, new CacheFactory(), new ScoringProperties());
    }

    @Test
    void should_DescribeFlaggingOrganisations() {
        when(signals.findOrgBlocklist("hate.example")).thenReturn(Optional.of(
            new OrgBlocklistRecord("hate.example", true, false, false, true, false, " hate group ")));

        assertThat(checker.check("www.hate.example")).contains("Flagged by: SPLC, ADL - hate group");
    }

    @Test
    void should_OmitReasonSuffix_When_NoReasonRecorded() {
        OrgBlocklistRecord record = new OrgBlocklistRecord("x.example", false, true, false, false, false, null);

        assertThat(OrgBlocklistChecker.describe(record)).isEqualTo("Flagged by: ACLU");
    }

    @Test
    void should_NotBlock_When_RowHasNoFlags() {
        when(signals.findOrgBlocklist("listed.example")).thenReturn(Optional.of(
            new OrgBlocklistRecord("listed.example", false, false, false, false, false, "cleared")));

        assertThat(checker.check("listed.example")).isEmpty();
    }

    @Test
    void should_CacheNegativeLookups() {
        when(signals.findOrgBlocklist("example.com")).thenReturn(Optional.empty());

        assertThat(checker.check("example.com")).isEmpty();
        assertThat(checker.check("WWW.EXAMPLE.COM")).isEmpty();

        verify(signals, times(1)).findOrgBlocklist("example.com");
    }

    @Test
    void should_FailOpen_AndRetry_When_LookupFails() {
        when(signals.findOrgBlocklist("example.com"))
            .thenThrow(new DataAccessResourceFailureException("down"))
            .thenReturn(Optional.of(new OrgBlocklistRecord("example.com", false, false, true, false, false, "x")));

        assertThat(checker.check("example.com")).isEmpty();
        assertThat(checker.check("example.com")).contains("Flagged by: CAIR - x");
    }
}
