/**
 * Configuration for WebClient
 * - Defines the client used for robots.txt retrieval
 * - Sets up timeouts, redirect handling and the crawler User-Agent
 */
package one.nothere.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import java.util.concurrent.TimeUnit;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Configures the application's WebClient instances
 */
@Configuration
public class WebClientConfig {

    private static final int ROBOTS_MAX_BYTES = 512 * 1024;

    /**
     * Creates the robots.txt client
     * - Follows redirects (robots.txt commonly redirects to the canonical host)
     * - Connect, read, write and response timeouts all bounded by {@code crawler.robots.timeout}
     * - Bodies capped at 512 KiB
     *
     * @return WebClient used by the robots compliance cache
     */
    @Bean
    public WebClient robotsWebClient(CrawlerProperties properties) {
        long timeoutMillis = properties.getRobots().getTimeout().toMillis();
        HttpClient httpClient = HttpClient.create()
            .followRedirect(true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeoutMillis))
            .doOnConnected(conn -> conn
                .addHandlerLast(new ReadTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
                .addHandlerLast(new WriteTimeoutHandler(timeoutMillis, TimeUnit.MILLISECONDS))
            )
            .responseTimeout(properties.getRobots().getTimeout());

        ExchangeStrategies exchangeStrategies = ExchangeStrategies.builder()
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(ROBOTS_MAX_BYTES))
            .build();

        return WebClient.builder()
            .defaultHeader(HttpHeaders.USER_AGENT, properties.getUserAgent())
            .exchangeStrategies(exchangeStrategies)
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .build();
    }
}
