package one.nothere.application.crawl;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import one.nothere.config.CrawlerProperties;
import one.nothere.domain.crawl.FetchResult;
import one.nothere.exception.PageFetchException;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link PageFetcher} on top of jsoup's HTTP connection.
 *
 * <p>HTTP error statuses and non-HTML content types are returned rather than
 * thrown so the worker decides what counts as a failure. The body is only
 * downloaded for a 200 HTML response.</p>
 */
@Component
public class JsoupPageFetcher implements PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(JsoupPageFetcher.class);

    private final String userAgent;
    private final int timeoutMillis;
    private final int maxBodyBytes;

    public JsoupPageFetcher(CrawlerProperties properties) {
        this.userAgent = properties.getUserAgent();
        this.timeoutMillis = (int) Math.min(Integer.MAX_VALUE, properties.getFetchTimeout().toMillis());
        this.maxBodyBytes = properties.getMaxBodyBytes();
    }

    @Override
    public FetchResult fetch(String url) {
        try {
            Connection.Response response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMillis)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(maxBodyBytes)
                .execute();
            FetchResult head = new FetchResult(
                url,
                response.url().toExternalForm(),
                response.statusCode(),
                response.contentType(),
                null
            );
            if (!head.isOk() || !head.isHtml()) {
                discardBody(response);
                return head;
            }
            // jsoup reads the body lazily; read failures surface here as UncheckedIOException
            return head.withBody(response.body());
        } catch (IOException e) {
            throw transportFailure(url, e);
        } catch (UncheckedIOException e) {
            throw transportFailure(url, e.getCause());
        } catch (IllegalArgumentException e) {
            throw new PageFetchException(url, "malformed URL", e);
        }
    }

    private static void discardBody(Connection.Response response) {
        try (InputStream body = response.bodyStream()) {
            log.trace("Discarded unread body of {} {}", response.statusCode(), response.url());
        } catch (IOException | RuntimeException e) {
            log.debug("Could not release connection for {}: {}", response.url(), e.getMessage());
        }
    }

    private static PageFetchException transportFailure(String url, IOException cause) {
        return new PageFetchException(url, cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }
}
