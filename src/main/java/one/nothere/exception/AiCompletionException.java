package one.nothere.exception;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;

/**
 * A completion request failed in transport, returned an error status,
 * came back empty, or was served by a model on the deny list.
 */
public class AiCompletionException extends RuntimeException {

    private final String model;

    public AiCompletionException(String model, String message) {
        super(message);
        this.model = model;
    }

    public AiCompletionException(String model, String message, Throwable cause) {
        super(message, cause);
        this.model = model;
    }

    /**
     * Model the failed request was addressed to.
     */
    public String getModel() {
        return model;
    }

    /**
     * Formats an OpenAI SDK exception into a concise description with HTTP status
     * code and human-readable explanation when available.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 400 -> "bad request";
                case 401 -> "unauthorized, check API key";
                case 402 -> "insufficient credits";
                case 403 -> "access denied";
                case 404 -> "not found, check base URL and model name";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
