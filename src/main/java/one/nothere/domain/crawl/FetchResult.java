package one.nothere.domain.crawl;

import java.util.Locale;

/**
 * Raw HTTP response for a page fetch after redirects were followed.
 *
 * @param requestUrl  URL that was requested
 * @param finalUrl    URL the response was served from
 * @param statusCode  HTTP status code
 * @param contentType Content-Type header, may be null
 * @param body        decoded response body, null when it was not downloaded
 */
public record FetchResult(String requestUrl, String finalUrl, int statusCode, String contentType, String body) {

    public FetchResult withBody(String downloadedBody) {
        return new FetchResult(requestUrl, finalUrl, statusCode, contentType, downloadedBody);
    }

    public boolean isOk() {
        return statusCode == 200;
    }

    public boolean isHtml() {
        return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
    }

    public boolean wasRedirected() {
        return finalUrl != null && !finalUrl.equals(requestUrl);
    }
}
