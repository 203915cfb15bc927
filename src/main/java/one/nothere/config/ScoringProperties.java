package one.nothere.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for composite scoring.
 */
@Component
@ConfigurationProperties(prefix = "scoring")
public class ScoringProperties {

    /**
     * Readability implementation: {@code flesch} or {@code sentence-length}.
     */
    private String readability = "flesch";

    /**
     * Composite score at or above which a page is indexable.
     */
    private int indexableThreshold = 25;

    private final Cache cache = new Cache();

    @PostConstruct
    void validate() {
        Assert.isTrue(indexableThreshold >= 0 && indexableThreshold <= 100,
            "scoring.indexable-threshold must be between 0 and 100");
        Assert.isTrue(cache.maxSize > 0, "scoring.cache.max-size must be positive");
    }

    public String getReadability() {
        return readability;
    }

    public void setReadability(String readability) {
        this.readability = readability;
    }

    public int getIndexableThreshold() {
        return indexableThreshold;
    }

    public void setIndexableThreshold(int indexableThreshold) {
        this.indexableThreshold = indexableThreshold;
    }

    public Cache getCache() {
        return cache;
    }

    /**
     * Per-lookup cache expiries. An unset TTL keeps entries for the process lifetime.
     */
    public static class Cache {

        /**
         * When false every scorer cache is replaced by a pass-through.
         */
        private boolean enabled = true;

        private int maxSize = 100_000;

        private Duration authorityTtl = Duration.ofDays(7);

        private Duration equityTtl;

        private Duration orgBlocklistTtl;

        private Duration keywordTtl;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Duration getAuthorityTtl() {
            return authorityTtl;
        }

        public void setAuthorityTtl(Duration authorityTtl) {
            this.authorityTtl = authorityTtl;
        }

        public Duration getEquityTtl() {
            return equityTtl;
        }

        public void setEquityTtl(Duration equityTtl) {
            this.equityTtl = equityTtl;
        }

        public Duration getOrgBlocklistTtl() {
            return orgBlocklistTtl;
        }

        public void setOrgBlocklistTtl(Duration orgBlocklistTtl) {
            this.orgBlocklistTtl = orgBlocklistTtl;
        }

        public Duration getKeywordTtl() {
            return keywordTtl;
        }

        public void setKeywordTtl(Duration keywordTtl) {
            this.keywordTtl = keywordTtl;
        }
    }
}
