package one.nothere.domain.scoring;

import java.util.Arrays;
import java.util.Locale;

/**
 * Theme categories and the signed weight each keyword match contributes.
 */
public enum KeywordCategory {
    HARAM_PROHIBITED("haram_prohibited", -10),
    HALAL_ENCOURAGED("halal_encouraged", 5),
    CORE_VALUES("core_values", 3),
    SOCIAL_ETHICS("social_ethics", 3),
    UNKNOWN("unknown", 0);

    private final String code;
    private final int weight;

    KeywordCategory(String code, int weight) {
        this.code = code;
        this.weight = weight;
    }

    public String code() {
        return code;
    }

    public int weight() {
        return weight;
    }

    /**
     * Resolves a stored category code; unrecognised codes weigh nothing.
     */
    public static KeywordCategory fromCode(String code) {
        if (code == null) {
            return UNKNOWN;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(category -> category.code.equals(normalized))
            .findFirst()
            .orElse(UNKNOWN);
    }
}
