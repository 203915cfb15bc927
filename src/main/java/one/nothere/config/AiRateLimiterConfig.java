package one.nothere.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Rate limiter guarding spend on the external completion API.
 * Requests over the limit are refused immediately rather than queued.
 */
@Configuration
public class AiRateLimiterConfig {

    private static final Logger logger = LoggerFactory.getLogger(AiRateLimiterConfig.class);

    @Bean
    public RateLimiter mediaLiteracyRateLimiter(MediaLiteracyProperties properties) {
        RateLimiterConfig config = RateLimiterConfig.custom()
            .limitRefreshPeriod(Duration.ofMinutes(1))
            .limitForPeriod(properties.getMaxCallsPerMinute())
            .timeoutDuration(Duration.ZERO)
            .build();

        RateLimiter rateLimiter = RateLimiter.of("mediaLiteracyRateLimiter", config);

        logger.info("Media literacy rate limiter initialized with limit of {} calls per minute",
            properties.getMaxCallsPerMinute());

        return rateLimiter;
    }
}
