package one.nothere.application.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import one.nothere.adapters.persistence.PageRepository;
import one.nothere.application.blocklist.BlocklistDefaults;
import one.nothere.application.frontier.FrontierManager;
import one.nothere.config.CrawlerProperties;
import one.nothere.domain.crawl.FetchResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class CrawlLoopTest {

    @Mock
    private FrontierManager frontier;
    @Mock
    private RobotsComplianceCache robots;
    @Mock
    private PageFetcher fetcher;
    @Mock
    private PageRepository pageRepository;

    private CrawlLoop loop;

    @BeforeEach
    void setUp() {
        loop = new CrawlLoop(frontier, BlocklistDefaults.newBlocklist(), robots, fetcher, new PageContentExtractor(),
            pageRepository, new CrawlStatistics(), new CrawlerProperties(), Clock.systemUTC());
        when(frontier.stats()).thenReturn(new FrontierManager.Stats(0, 0));
        // Every dequeued URL short-circuits as already crawled, so no fetch happens.
        when(pageRepository.existsByUrlHash(anyString())).thenReturn(true);
    }

    @Test
    void should_StopAtPageLimit_When_FrontierHasMore() {
        when(frontier.dequeue()).thenReturn(Optional.of("https://example.com/x"));

        loop.run(3, Duration.ZERO);

        verify(frontier, times(3)).dequeue();
        verify(fetcher, never()).fetch(anyString());
        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void should_Stop_When_FrontierIsExhausted() {
        when(frontier.dequeue())
            .thenReturn(Optional.of("https://example.com/a"))
            .thenReturn(Optional.of("https://example.com/b"))
            .thenReturn(Optional.empty());

        loop.run(null, Duration.ZERO);

        verify(frontier, times(3)).dequeue();
    }

    @Test
    void should_CountBlockedUrlsTowardPageLimit() {
        when(frontier.dequeue()).thenReturn(Optional.of("https://pornhub.com/"));
        when(pageRepository.existsByUrlHash(anyString())).thenReturn(false);

        CrawlStatistics.Snapshot snapshot = loop.run(2, Duration.ZERO);

        assertThat(snapshot.blocked()).isEqualTo(2);
        verify(frontier, times(2)).dequeue();
    }

    @Test
    void should_RejectSecondRun_When_AlreadyRunning() {
        when(frontier.dequeue()).thenAnswer(invocation -> {
            assertThat(loop.isRunning()).isTrue();
            assertThatThrownBy(() -> loop.run(1, Duration.ZERO))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already running");
            return Optional.empty();
        });

        loop.run(null, Duration.ZERO);

        assertThat(loop.isRunning()).isFalse();
    }

    @Test
    void should_FinishInFlightUrlAndStop_When_StopRequested() {
        when(frontier.dequeue()).thenAnswer(invocation -> {
            loop.requestStop();
            return Optional.of("https://example.com/in-flight");
        });

        loop.run(null, Duration.ZERO);

        verify(frontier, times(1)).dequeue();
        verify(pageRepository).existsByUrlHash(anyString());
    }

    @Test
    void should_ContinueWithNextUrl_When_FetchFailsWithUncheckedIo() {
        when(frontier.dequeue())
            .thenReturn(Optional.of("https://example.com/stalled"))
            .thenReturn(Optional.of("https://example.com/gone"))
            .thenReturn(Optional.empty());
        when(pageRepository.existsByUrlHash(anyString())).thenReturn(false);
        when(robots.canFetch(anyString())).thenReturn(true);
        when(fetcher.fetch("https://example.com/stalled"))
            .thenThrow(new UncheckedIOException(new SocketTimeoutException("Read timeout")));
        when(fetcher.fetch("https://example.com/gone"))
            .thenReturn(new FetchResult("https://example.com/gone", "https://example.com/gone", 404, "text/html", null));

        CrawlStatistics.Snapshot snapshot = loop.run(null, Duration.ZERO);

        assertThat(snapshot.failed()).isEqualTo(2);
        verify(frontier, times(3)).dequeue();
        assertThat(loop.isRunning()).isFalse();
    }
}
