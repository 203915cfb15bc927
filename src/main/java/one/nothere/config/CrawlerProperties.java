package one.nothere.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the crawler.
 */
@Component
@ConfigurationProperties(prefix = "crawler")
public class CrawlerProperties {

    /**
     * User-Agent header sent with every page and robots.txt request.
     */
    private String userAgent = "NotHere.one Bot/1.0 (Values-based search engine; +https://nothere.one/bot)";

    /**
     * Product token matched against robots.txt user-agent groups.
     */
    private String robotsAgent = "NotHereBot";

    /**
     * Upper bound on a single page fetch, redirects included.
     */
    private Duration fetchTimeout = Duration.ofSeconds(10);

    /**
     * Sleep applied by a worker before each page fetch.
     */
    private Duration politenessDelay = Duration.ofSeconds(1);

    /**
     * Response bodies beyond this many bytes are truncated by the fetcher.
     */
    private int maxBodyBytes = 5 * 1024 * 1024;

    /**
     * Statistics are logged every this many processed URLs.
     */
    private int statsInterval = 10;

    /**
     * Seed file read when the frontier is empty and no --seed option is given.
     */
    private String defaultSeedFile = "seed_urls.txt";

    /**
     * How long the closing thread waits for the in-flight URL on shutdown.
     */
    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    private final Frontier frontier = new Frontier();
    private final Robots robots = new Robots();
    private final Blocklist blocklist = new Blocklist();

    @PostConstruct
    void validate() {
        Assert.isTrue(!fetchTimeout.isNegative() && !fetchTimeout.isZero(), "crawler.fetch-timeout must be positive");
        Assert.isTrue(!politenessDelay.isNegative(), "crawler.politeness-delay must be non-negative");
        Assert.isTrue(statsInterval > 0, "crawler.stats-interval must be positive");
        Assert.isTrue(maxBodyBytes >= 0, "crawler.max-body-bytes must be non-negative");
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getRobotsAgent() {
        return robotsAgent;
    }

    public void setRobotsAgent(String robotsAgent) {
        this.robotsAgent = robotsAgent;
    }

    public Duration getFetchTimeout() {
        return fetchTimeout;
    }

    public void setFetchTimeout(Duration fetchTimeout) {
        this.fetchTimeout = fetchTimeout;
    }

    public Duration getPolitenessDelay() {
        return politenessDelay;
    }

    public void setPolitenessDelay(Duration politenessDelay) {
        this.politenessDelay = politenessDelay;
    }

    public int getMaxBodyBytes() {
        return maxBodyBytes;
    }

    public void setMaxBodyBytes(int maxBodyBytes) {
        this.maxBodyBytes = maxBodyBytes;
    }

    public int getStatsInterval() {
        return statsInterval;
    }

    public void setStatsInterval(int statsInterval) {
        this.statsInterval = statsInterval;
    }

    public String getDefaultSeedFile() {
        return defaultSeedFile;
    }

    public void setDefaultSeedFile(String defaultSeedFile) {
        this.defaultSeedFile = defaultSeedFile;
    }

    public Duration getShutdownGracePeriod() {
        return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
        this.shutdownGracePeriod = shutdownGracePeriod;
    }

    public Frontier getFrontier() {
        return frontier;
    }

    public Robots getRobots() {
        return robots;
    }

    public Blocklist getBlocklist() {
        return blocklist;
    }

    public static class Frontier {

        /**
         * Backing store: {@code jdbc} shares the frontier across processes, {@code memory} keeps it local.
         */
        private String store = "jdbc";

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }
    }

    public static class Robots {

        /**
         * Upper bound on a robots.txt fetch.
         */
        private Duration timeout = Duration.ofSeconds(10);

        /**
         * Expiry of cached robots policies; unset keeps them for the process lifetime.
         */
        private Duration cacheTtl;

        private int cacheMaxSize = 50_000;

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getCacheTtl() {
            return cacheTtl;
        }

        public void setCacheTtl(Duration cacheTtl) {
            this.cacheTtl = cacheTtl;
        }

        public int getCacheMaxSize() {
            return cacheMaxSize;
        }

        public void setCacheMaxSize(int cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
        }
    }

    public static class Blocklist {

        /**
         * Optional file of extra blocked domains, one per line, {@code #} starts a comment.
         */
        private String extraDomainsFile;

        public String getExtraDomainsFile() {
            return extraDomainsFile;
        }

        public void setExtraDomainsFile(String extraDomainsFile) {
            this.extraDomainsFile = extraDomainsFile;
        }
    }
}
