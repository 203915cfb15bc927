package one.nothere.application.medialiteracy;

import java.util.List;

/**
 * Chat completion endpoint used for misinformation analysis.
 */
public interface CompletionClient {

    /**
     * Whether the client has credentials and can make calls at all.
     */
    boolean isAvailable();

    /**
     * Sends one single-message completion request.
     *
     * @throws one.nothere.exception.AiCompletionException on transport or HTTP failure, or an empty reply
     */
    CompletionResponse complete(CompletionRequest request);

    /**
     * @param deniedModels model identifiers the router must never select for this request
     */
    record CompletionRequest(String model, String prompt, long maxTokens, double temperature, List<String> deniedModels) {

        public CompletionRequest {
            deniedModels = deniedModels == null ? List.of() : List.copyOf(deniedModels);
        }
    }

    /**
     * @param modelUsed model that actually served the request, which differs from the requested one under auto-routing
     * @param content   raw message text
     */
    record CompletionResponse(String modelUsed, String content) {
    }
}
