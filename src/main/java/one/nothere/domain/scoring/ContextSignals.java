package one.nothere.domain.scoring;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page context used to dampen negative keyword weights.
 */
public record ContextSignals(boolean educational, boolean news, boolean research, boolean falsePositive) {

    /**
     * Applies the dampening rules to a keyword weight. Positive weights pass through;
     * a false-positive context zeroes negative weights whatever the other flags say.
     */
    public double adjust(int weight) {
        if (weight >= 0) {
            return weight;
        }
        if (falsePositive) {
            return 0;
        }
        if (educational || research) {
            return weight * 0.3;
        }
        if (news) {
            return weight * 0.5;
        }
        return weight;
    }

    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("is_educational", educational);
        details.put("is_news", news);
        details.put("is_research", research);
        details.put("is_false_positive", falsePositive);
        return details;
    }
}
