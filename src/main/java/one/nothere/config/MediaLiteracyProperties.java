package one.nothere.config;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

/**
 * Strongly typed configuration for the media-literacy escalation gateway.
 */
@Component
@ConfigurationProperties(prefix = "media-literacy")
public class MediaLiteracyProperties {

    /**
     * API key for the completion endpoint; blank or {@code not-configured} disables escalation.
     */
    private String apiKey;

    private String baseUrl = "https://openrouter.ai/api/v1";

    private String primaryModel = "google/gemini-2.5-flash-lite";

    /**
     * Model tried once after the primary fails. An auto-routing model is expected here.
     */
    private String fallbackModel = "openrouter/auto";

    /**
     * Model identifiers that must never serve a request, auto-routing included.
     */
    private List<String> deniedModels = new ArrayList<>(List.of("openai/gpt-4o", "openai/o1", "openai/o1-mini"));

    private Duration timeout = Duration.ofSeconds(15);

    private long maxTokens = 500;

    private double temperature = 0.3;

    /**
     * Leading characters of page content included in the prompt.
     */
    private int contentExcerptChars = 2500;

    /**
     * Distinct red-flag phrases required before the external model is called.
     */
    private int minRedFlags = 2;

    /**
     * Spend guard: external calls permitted per minute, excess requests score neutral.
     */
    private int maxCallsPerMinute = 60;

    private String referer = "https://nothere.one";

    private String appTitle = "NotHere.one";

    @PostConstruct
    void validate() {
        Assert.isTrue(!timeout.isNegative() && !timeout.isZero(), "media-literacy.timeout must be positive");
        Assert.isTrue(maxTokens > 0, "media-literacy.max-tokens must be positive");
        Assert.isTrue(minRedFlags > 0, "media-literacy.min-red-flags must be positive");
        Assert.isTrue(maxCallsPerMinute > 0, "media-literacy.max-calls-per-minute must be positive");
        Assert.isTrue(!deniedModels.contains(primaryModel), "media-literacy.primary-model is on the deny list");
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPrimaryModel() {
        return primaryModel;
    }

    public void setPrimaryModel(String primaryModel) {
        this.primaryModel = primaryModel;
    }

    public String getFallbackModel() {
        return fallbackModel;
    }

    public void setFallbackModel(String fallbackModel) {
        this.fallbackModel = fallbackModel;
    }

    public List<String> getDeniedModels() {
        return deniedModels;
    }

    public void setDeniedModels(List<String> deniedModels) {
        this.deniedModels = deniedModels;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public long getMaxTokens() {
        return maxTokens;
    }

    public void setMaxTokens(long maxTokens) {
        this.maxTokens = maxTokens;
    }

    public double getTemperature() {
        return temperature;
    }

    public void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    public int getContentExcerptChars() {
        return contentExcerptChars;
    }

    public void setContentExcerptChars(int contentExcerptChars) {
        this.contentExcerptChars = contentExcerptChars;
    }

    public int getMinRedFlags() {
        return minRedFlags;
    }

    public void setMinRedFlags(int minRedFlags) {
        this.minRedFlags = minRedFlags;
    }

    public int getMaxCallsPerMinute() {
        return maxCallsPerMinute;
    }

    public void setMaxCallsPerMinute(int maxCallsPerMinute) {
        this.maxCallsPerMinute = maxCallsPerMinute;
    }

    public String getReferer() {
        return referer;
    }

    public void setReferer(String referer) {
        this.referer = referer;
    }

    public String getAppTitle() {
        return appTitle;
    }

    public void setAppTitle(String appTitle) {
        this.appTitle = appTitle;
    }
}
