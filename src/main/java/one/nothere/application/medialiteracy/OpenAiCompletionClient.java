package one.nothere.application.medialiteracy;

import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import com.openai.core.JsonValue;
import com.openai.core.RequestOptions;
import com.openai.core.Timeout;
import com.openai.errors.OpenAIException;
import com.openai.models.ChatModel;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionMessageParam;
import com.openai.models.chat.completions.ChatCompletionUserMessageParam;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import one.nothere.config.MediaLiteracyProperties;
import one.nothere.exception.AiCompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * OpenAI-compatible completion client pointed at an OpenRouter style router.
 *
 * <p>Retries are disabled in the SDK; the gateway owns the single fallback attempt.</p>
 */
@Component
class OpenAiCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompletionClient.class);
    private static final String API_KEY_SENTINEL = "not-configured";

    private final OpenAIClient openAiClient;
    private final boolean available;
    private final Duration timeout;

    OpenAiCompletionClient(MediaLiteracyProperties properties) {
        this.timeout = properties.getTimeout();
        String apiKey = properties.getApiKey();

        if (StringUtils.hasText(apiKey) && !API_KEY_SENTINEL.equals(apiKey.trim())) {
            String resolvedBaseUrl = normalizeBaseUrl(properties.getBaseUrl());
            OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder()
                .apiKey(apiKey.trim())
                .baseUrl(resolvedBaseUrl)
                .maxRetries(0);
            if (StringUtils.hasText(properties.getReferer())) {
                builder.putHeader("HTTP-Referer", properties.getReferer());
            }
            if (StringUtils.hasText(properties.getAppTitle())) {
                builder.putHeader("X-Title", properties.getAppTitle());
            }
            this.openAiClient = builder.build();
            this.available = true;
            log.info("Media literacy completion client configured (primaryModel={}, baseUrl={})",
                properties.getPrimaryModel(), resolvedBaseUrl);
            return;
        }

        this.openAiClient = null;
        this.available = false;
        log.warn("Media literacy completion client is disabled: no API key configured, escalations score neutral");
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    @Override
    public CompletionResponse complete(CompletionRequest request) {
        if (!available || openAiClient == null) {
            throw new AiCompletionException(request.model(), "Completion client is not configured");
        }

        ChatCompletionCreateParams.Builder params = ChatCompletionCreateParams.builder()
            .model(ChatModel.of(request.model()))
            .messages(List.of(
                ChatCompletionMessageParam.ofUser(ChatCompletionUserMessageParam.builder().content(request.prompt()).build())
            ))
            .maxCompletionTokens(request.maxTokens())
            .temperature(request.temperature())
            .putAdditionalBodyProperty("route", JsonValue.from("fallback"));
        if (!request.deniedModels().isEmpty()) {
            params.putAdditionalBodyProperty("models", JsonValue.from(Map.of("blacklist", request.deniedModels())));
        }

        RequestOptions options = RequestOptions.builder()
            .timeout(Timeout.builder()
                .request(timeout)
                .read(timeout)
                .build())
            .build();

        try {
            log.debug("Completion call (model={})", request.model());
            ChatCompletion completion = openAiClient.chat().completions().create(params.build(), options);
            if (completion.choices().isEmpty()) {
                throw new AiCompletionException(request.model(), "Completion response contained no choices");
            }
            String content = completion.choices().get(0).message().content().orElse("");
            if (!StringUtils.hasText(content)) {
                throw new AiCompletionException(request.model(), "Completion response was empty");
            }
            String modelUsed = StringUtils.hasText(completion.model()) ? completion.model() : request.model();
            return new CompletionResponse(modelUsed, content.trim());
        } catch (OpenAIException openAiException) {
            String detail = AiCompletionException.describeApiError(openAiException);
            log.error("Completion API call failed (model={}): {}", request.model(), detail);
            throw new AiCompletionException(
                request.model(),
                "Completion failed (%s): %s".formatted(request.model(), detail),
                openAiException
            );
        }
    }

    static String normalizeBaseUrl(String rawUrl) {
        if (rawUrl == null || rawUrl.isBlank()) {
            return "https://openrouter.ai/api/v1";
        }
        String normalized = rawUrl.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith("/chat/completions")) {
            normalized = normalized.substring(0, normalized.length() - "/chat/completions".length());
        }
        return normalized;
    }
}
