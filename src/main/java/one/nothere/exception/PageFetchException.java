package one.nothere.exception;

/**
 * A page could not be retrieved: connection failure, timeout or malformed request URL.
 * RETRYABLE: No (the URL is abandoned for the current run)
 */
public class PageFetchException extends RuntimeException {

    private final String url;

    public PageFetchException(String url, String message, Throwable cause) {
        super("Failed to fetch " + url + ": " + message, cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
