package one.nothere.application.crawl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import one.nothere.config.CrawlerProperties;
import one.nothere.domain.crawl.FetchResult;
import one.nothere.exception.PageFetchException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class JsoupPageFetcherTest {

    private static final String PAGE = "<html><head><title>Hello</title></head><body><p>Body</p></body></html>";

    private final CountDownLatch release = new CountDownLatch(1);
    private ExecutorService executor;
    private HttpServer server;
    private String baseUrl;
    private JsoupPageFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/page", exchange -> respond(exchange, 200, "text/html; charset=UTF-8", PAGE));
        server.createContext("/missing", exchange -> respond(exchange, 404, "text/html", "<html>not here</html>"));
        server.createContext("/report.pdf", exchange -> respond(exchange, 200, "application/pdf", "%PDF-1.4"));
        server.createContext("/old", exchange -> {
            exchange.getResponseHeaders().add("Location", "/page");
            exchange.sendResponseHeaders(301, -1);
            exchange.close();
        });
        server.createContext("/stalled", this::stall);
        executor = Executors.newCachedThreadPool();
        server.setExecutor(executor);
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        CrawlerProperties properties = new CrawlerProperties();
        properties.setFetchTimeout(Duration.ofMillis(500));
        fetcher = new JsoupPageFetcher(properties);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        release.countDown();
        server.stop(0);
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void should_ReturnBody_When_ResponseIsOkHtml() {
        FetchResult result = fetcher.fetch(baseUrl + "/page");

        assertThat(result.isOk()).isTrue();
        assertThat(result.isHtml()).isTrue();
        assertThat(result.body()).contains("<title>Hello</title>");
        assertThat(result.wasRedirected()).isFalse();
    }

    @Test
    void should_ReportFinalUrl_When_Redirected() {
        FetchResult result = fetcher.fetch(baseUrl + "/old");

        assertThat(result.requestUrl()).isEqualTo(baseUrl + "/old");
        assertThat(result.finalUrl()).isEqualTo(baseUrl + "/page");
        assertThat(result.wasRedirected()).isTrue();
        assertThat(result.body()).contains("Body");
    }

    @Test
    void should_SkipBody_When_StatusIsNotOk() {
        FetchResult result = fetcher.fetch(baseUrl + "/missing");

        assertThat(result.statusCode()).isEqualTo(404);
        assertThat(result.body()).isNull();
    }

    @Test
    void should_SkipBody_When_ContentIsNotHtml() {
        FetchResult result = fetcher.fetch(baseUrl + "/report.pdf");

        assertThat(result.statusCode()).isEqualTo(200);
        assertThat(result.contentType()).isEqualTo("application/pdf");
        assertThat(result.body()).isNull();
    }

    @Test
    void should_ThrowPageFetchException_When_BodyReadTimesOut() {
        assertThatThrownBy(() -> fetcher.fetch(baseUrl + "/stalled"))
            .isInstanceOf(PageFetchException.class)
            .hasMessageContaining("/stalled");
    }

    @Test
    void should_ThrowPageFetchException_When_UrlIsMalformed() {
        assertThatThrownBy(() -> fetcher.fetch("not a url"))
            .isInstanceOf(PageFetchException.class)
            .hasMessageContaining("malformed URL");
    }

    private void stall(HttpExchange exchange) throws IOException {
        exchange.getResponseHeaders().add("Content-Type", "text/html");
        exchange.sendResponseHeaders(200, 10_000);
        OutputStream out = exchange.getResponseBody();
        out.write("<html><body>partial ".getBytes(StandardCharsets.UTF_8));
        out.flush();
        try {
            release.await(10, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        exchange.close();
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
