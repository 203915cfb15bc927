package one.nothere.exception;

/**
 * A fetched document could not be parsed into title, text and links.
 */
public class ContentExtractionException extends RuntimeException {

    public ContentExtractionException(String url, Throwable cause) {
        super("Failed to extract content from " + url, cause);
    }
}
