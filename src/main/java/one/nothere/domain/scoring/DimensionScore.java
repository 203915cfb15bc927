package one.nothere.domain.scoring;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one scoring dimension: either a computed value, or a degraded
 * fallback value with the reason the dimension could not be computed.
 *
 * @param value          score contributed by the dimension
 * @param details        JSON-serialisable breakdown kept for the audit log
 * @param degradedReason null for a computed value
 */
public record DimensionScore(double value, Map<String, Object> details, String degradedReason) {

    public DimensionScore {
        details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static DimensionScore of(double value, Map<String, Object> details) {
        return new DimensionScore(value, details, null);
    }

    public static DimensionScore degraded(double fallbackValue, String reason) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("degraded", true);
        details.put("reason", reason);
        return new DimensionScore(fallbackValue, details, reason);
    }

    public boolean isDegraded() {
        return degradedReason != null;
    }

    /**
     * Value truncated toward zero, the form persisted in integer score columns.
     */
    public int intValue() {
        return (int) value;
    }
}
