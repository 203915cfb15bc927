package one.nothere.application.medialiteracy;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Cumulative gateway counters. The skip rate is the share of pages that never reached a model.
 */
@Component
public class MediaLiteracyStats implements MeterBinder {

    private final AtomicLong totalCalls = new AtomicLong(0);
    private final AtomicLong skippedNeutral = new AtomicLong(0);
    private final AtomicLong analyzed = new AtomicLong(0);
    private final AtomicLong errors = new AtomicLong(0);
    private final AtomicLong fallbackUsed = new AtomicLong(0);
    private final AtomicLong rateLimited = new AtomicLong(0);

    void recordCall() {
        totalCalls.incrementAndGet();
    }

    void recordSkipped() {
        skippedNeutral.incrementAndGet();
    }

    void recordAnalyzed() {
        analyzed.incrementAndGet();
    }

    void recordError() {
        errors.incrementAndGet();
    }

    void recordFallback() {
        fallbackUsed.incrementAndGet();
    }

    void recordRateLimited() {
        rateLimited.incrementAndGet();
    }

    public Snapshot snapshot() {
        return new Snapshot(totalCalls.get(), skippedNeutral.get(), analyzed.get(), errors.get(),
            fallbackUsed.get(), rateLimited.get());
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        FunctionCounter.builder("media_literacy.calls", totalCalls, AtomicLong::get).register(registry);
        FunctionCounter.builder("media_literacy.skipped", skippedNeutral, AtomicLong::get).register(registry);
        FunctionCounter.builder("media_literacy.analyzed", analyzed, AtomicLong::get).register(registry);
        FunctionCounter.builder("media_literacy.errors", errors, AtomicLong::get).register(registry);
        FunctionCounter.builder("media_literacy.fallback", fallbackUsed, AtomicLong::get).register(registry);
        FunctionCounter.builder("media_literacy.rate_limited", rateLimited, AtomicLong::get).register(registry);
        Gauge.builder("media_literacy.skip_rate", this, stats -> stats.snapshot().skipRatePercent())
            .baseUnit("percent")
            .register(registry);
    }

    public record Snapshot(long totalCalls, long skippedNeutral, long analyzed, long errors,
                           long fallbackUsed, long rateLimited) {

        public double skipRatePercent() {
            return totalCalls == 0 ? 0 : skippedNeutral * 100.0 / totalCalls;
        }

        @Override
        public String toString() {
            return "total_calls=%d, skipped_neutral=%d, analyzed=%d, errors=%d, fallback_used=%d, rate_limited=%d, skip_rate=%.1f%%"
                .formatted(totalCalls, skippedNeutral, analyzed, errors, fallbackUsed, rateLimited, skipRatePercent());
        }
    }
}
