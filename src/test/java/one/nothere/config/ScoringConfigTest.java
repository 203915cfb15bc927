package one.nothere.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import one.nothere.application.scoring.FleschReadabilityScorer;
import one.nothere.application.scoring.SentenceLengthReadabilityScorer;
import org.junit.jupiter.api.Test;

class ScoringConfigTest {

    private final ScoringConfig config = new ScoringConfig();

    @Test
    void should_DefaultToFlesch() {
        assertThat(config.readabilityScorer(new ScoringProperties())).isInstanceOf(FleschReadabilityScorer.class);
    }

    @Test
    void should_SelectSentenceLength_IgnoringCase() {
        ScoringProperties properties = new ScoringProperties();
        properties.setReadability(" Sentence-Length ");

        assertThat(config.readabilityScorer(properties)).isInstanceOf(SentenceLengthReadabilityScorer.class);
    }

    @Test
    void should_RejectUnknownMeasure() {
        ScoringProperties properties = new ScoringProperties();
        properties.setReadability("gunning-fog");

        assertThatThrownBy(() -> config.readabilityScorer(properties))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("gunning-fog");
    }
}
