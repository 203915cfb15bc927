package one.nothere.application.crawl;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import one.nothere.config.CacheFactory;
import one.nothere.config.CrawlerProperties;
import one.nothere.support.cache.TtlCache;
import one.nothere.util.DomainNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;

/**
 * Per-origin robots.txt policy, fetched once and memoized.
 *
 * <p>Fails open: a missing, unreachable, non-2xx or unparseable robots.txt
 * is cached as "allow everything". Robots absence is common and says nothing
 * about trust, unlike the Tier-1 blocklist which fails closed.</p>
 */
@Component
public class RobotsComplianceCache {

    private static final Logger log = LoggerFactory.getLogger(RobotsComplianceCache.class);
    private static final BaseRobotRules ALLOW_ALL = new SimpleRobotRules(SimpleRobotRules.RobotRulesMode.ALLOW_ALL);

    private final WebClient webClient;
    private final SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
    private final TtlCache<String, BaseRobotRules> policies;
    private final List<String> robotNames;
    private final Duration timeout;

    public RobotsComplianceCache(@Qualifier("robotsWebClient") WebClient webClient,
                                 CacheFactory cacheFactory,
                                 CrawlerProperties properties) {
        this.webClient = webClient;
        this.policies = cacheFactory.createCache("robots-policies",
            properties.getRobots().getCacheMaxSize(), properties.getRobots().getCacheTtl());
        this.robotNames = List.of(properties.getRobotsAgent().toLowerCase(Locale.ROOT));
        this.timeout = properties.getRobots().getTimeout();
    }

    /**
     * Whether the crawler may fetch {@code url} under its origin's robots.txt.
     */
    public boolean canFetch(String url) {
        Optional<String> origin = DomainNames.origin(url);
        if (origin.isEmpty()) {
            return true;
        }
        return policies.get(origin.get(), this::loadPolicy).isAllowed(url);
    }

    private BaseRobotRules loadPolicy(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            RobotsResponse response = webClient.get()
                .uri(URI.create(robotsUrl))
                .exchangeToMono(clientResponse -> {
                    int status = clientResponse.statusCode().value();
                    if (!clientResponse.statusCode().is2xxSuccessful()) {
                        return clientResponse.releaseBody().thenReturn(new RobotsResponse(status, null, new byte[0]));
                    }
                    String contentType = clientResponse.headers().contentType()
                        .map(MediaType::toString)
                        .orElse(null);
                    return clientResponse.bodyToMono(byte[].class)
                        .defaultIfEmpty(new byte[0])
                        .map(body -> new RobotsResponse(status, contentType, body));
                })
                .block(timeout);

            if (response == null || response.status() < 200 || response.status() >= 300) {
                log.debug("robots.txt unavailable for {} (status={}); allowing all", origin,
                    response == null ? "none" : response.status());
                return ALLOW_ALL;
            }
            return parser.parseContent(robotsUrl, response.body(),
                response.contentType() == null ? "text/plain" : response.contentType(), robotNames);
        } catch (WebClientException | IllegalStateException e) {
            log.debug("robots.txt fetch failed for {}; allowing all: {}", origin, e.getMessage());
            return ALLOW_ALL;
        } catch (RuntimeException e) {
            log.warn("robots.txt for {} could not be parsed; allowing all: {}", origin, e.getMessage());
            return ALLOW_ALL;
        }
    }

    private record RobotsResponse(int status, String contentType, byte[] body) {
    }
}
