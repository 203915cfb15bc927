package one.nothere.runner;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.ApplicationArguments;

/**
 * Typed access to {@code --name=value} options.
 */
final class CommandOptions {

    private CommandOptions() {
    }

    static String stringOption(ApplicationArguments arguments, String option) {
        if (!arguments.containsOption(option)) {
            return null;
        }
        List<String> values = arguments.getOptionValues(option);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            throw new IllegalArgumentException("Option --" + option + " requires a value");
        }
        return values.get(0).trim();
    }

    static Integer positiveIntOption(ApplicationArguments arguments, String option) {
        String raw = stringOption(arguments, option);
        if (raw == null) {
            return null;
        }
        try {
            int value = Integer.parseInt(raw);
            if (value <= 0) {
                throw new IllegalArgumentException("--" + option + " must be positive: " + raw);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for --" + option + ": " + raw, ex);
        }
    }

    static long longOption(ApplicationArguments arguments, String option) {
        String raw = stringOption(arguments, option);
        if (raw == null) {
            throw new IllegalArgumentException("Missing required option --" + option);
        }
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for --" + option + ": " + raw, ex);
        }
    }

    static Double nonNegativeDoubleOption(ApplicationArguments arguments, String option) {
        String raw = stringOption(arguments, option);
        if (raw == null) {
            return null;
        }
        try {
            double value = Double.parseDouble(raw);
            if (value < 0 || Double.isNaN(value) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("--" + option + " must be a non-negative number: " + raw);
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid number for --" + option + ": " + raw, ex);
        }
    }

    /**
     * Comma-separated values across every occurrence of the option.
     */
    static List<String> listOption(ApplicationArguments arguments, String option) {
        List<String> values = new ArrayList<>();
        if (!arguments.containsOption(option) || arguments.getOptionValues(option) == null) {
            return values;
        }
        for (String raw : arguments.getOptionValues(option)) {
            for (String part : raw.split(",")) {
                if (!part.isBlank()) {
                    values.add(part.trim());
                }
            }
        }
        return values;
    }
}
