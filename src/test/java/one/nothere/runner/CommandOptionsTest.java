package one.nothere.runner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.DefaultApplicationArguments;

class CommandOptionsTest {

    @Test
    void should_ParseTypedOptions() {
        ApplicationArguments arguments = new DefaultApplicationArguments(
            "--max-pages=25", "--delay=1.5", "--score-page=42", "--seed= seeds.txt ");

        assertThat(CommandOptions.positiveIntOption(arguments, "max-pages")).isEqualTo(25);
        assertThat(CommandOptions.nonNegativeDoubleOption(arguments, "delay")).isEqualTo(1.5);
        assertThat(CommandOptions.longOption(arguments, "score-page")).isEqualTo(42L);
        assertThat(CommandOptions.stringOption(arguments, "seed")).isEqualTo("seeds.txt");
        assertThat(CommandOptions.positiveIntOption(arguments, "limit")).isNull();
    }

    @Test
    void should_RejectInvalidValues() {
        ApplicationArguments arguments = new DefaultApplicationArguments(
            "--max-pages=0", "--delay=-1", "--limit=ten", "--seed");

        assertThatThrownBy(() -> CommandOptions.positiveIntOption(arguments, "max-pages"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("must be positive");
        assertThatThrownBy(() -> CommandOptions.nonNegativeDoubleOption(arguments, "delay"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CommandOptions.positiveIntOption(arguments, "limit"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Invalid number");
        assertThatThrownBy(() -> CommandOptions.stringOption(arguments, "seed"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("requires a value");
        assertThatThrownBy(() -> CommandOptions.longOption(arguments, "score-page"))
            .isInstanceOf(IllegalArgumentException.class).hasMessageContaining("Missing required option");
    }

    @Test
    void should_SplitListOptionsAcrossOccurrences() {
        ApplicationArguments arguments = new DefaultApplicationArguments(
            "--blocklist-add=a.example, b.example", "--blocklist-add=c.example,,");

        assertThat(CommandOptions.listOption(arguments, "blocklist-add"))
            .containsExactly("a.example", "b.example", "c.example");
        assertThat(CommandOptions.listOption(arguments, "absent")).isEmpty();
    }
}
