package dev.pekelund.finsight.documents.googleai;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.core.io.Resource;
import org.springframework.util.Assert;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link ChatModel} that calls Google AI Studio's Gemini {@code generateContent} endpoint with an API key. Media
 * attached to user messages is sent inline, base64 encoded.
 */
public class GoogleAiGeminiChatModel implements ChatModel {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiChatModel.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiChatModel(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        Assert.hasText(apiKey, "Gemini API key must not be empty");
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GoogleAiGeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        Assert.notNull(prompt, "Prompt must not be null");
        GoogleAiGeminiChatOptions options = resolveOptions(prompt.getOptions());
        List<GenerateContentRequest.Part> parts = toParts(prompt.getInstructions());
        Observation observation = Observation.start("google.ai.gemini.call", observationRegistry)
            .highCardinalityKeyValue("model", Optional.ofNullable(options.getModel()).orElse("(unset)"));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Google AI Gemini model '{}' with {} part(s)", options.getModel(), parts.size());
            GenerateContentRequest request = new GenerateContentRequest(
                List.of(new GenerateContentRequest.Content("user", parts)),
                new GenerateContentRequest.GenerationConfig(options.getTemperature(), options.getTopP(),
                    options.getTopK(), options.getMaxOutputTokens(), options.getResponseMimeType()));
            GenerateContentResponse response = executeRequest(options.getModel(), request);
            return new ChatResponse(List.of(new Generation(new AssistantMessage(extractContent(response)))));
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    @Override
    public ChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    private GoogleAiGeminiChatOptions resolveOptions(ChatOptions promptOptions) {
        if (promptOptions instanceof GoogleAiGeminiChatOptions googleOptions) {
            return defaultOptions.merge(googleOptions);
        }
        return defaultOptions;
    }

    private List<GenerateContentRequest.Part> toParts(List<Message> messages) {
        if (CollectionUtils.isEmpty(messages)) {
            throw new IllegalArgumentException("Prompt must contain at least one message");
        }
        List<GenerateContentRequest.Part> parts = new ArrayList<>();
        for (Message message : messages) {
            if (StringUtils.hasText(message.getText())) {
                parts.add(GenerateContentRequest.Part.text(message.getText()));
            }
            if (message instanceof UserMessage userMessage) {
                for (Media media : userMessage.getMedia()) {
                    parts.add(GenerateContentRequest.Part.inline(media.getMimeType().toString(), encode(media)));
                }
            }
        }
        return parts;
    }

    private static String encode(Media media) {
        Object data = media.getData();
        if (data instanceof byte[] bytes) {
            return Base64.getEncoder().encodeToString(bytes);
        }
        if (data instanceof Resource resource) {
            try {
                return Base64.getEncoder().encodeToString(resource.getContentAsByteArray());
            } catch (IOException ex) {
                throw new IllegalStateException("Failed to read media resource " + resource, ex);
            }
        }
        if (data instanceof String text) {
            return text;
        }
        throw new IllegalArgumentException("Unsupported media data type " + (data == null ? null : data.getClass()));
    }

    private GenerateContentResponse executeRequest(String model, GenerateContentRequest request) {
        String modelName = StringUtils.hasText(model) ? model : defaultOptions.getModel();
        if (!StringUtils.hasText(modelName)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(modelName))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw new IllegalStateException("Google AI Gemini request failed: " + ex.getMessage(), ex);
        }
    }

    private String extractContent(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new IllegalStateException("Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Gemini response did not contain any text parts"));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Content(String role, List<Part> parts) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record Part(String text, InlineData inlineData) {

            static Part text(String text) {
                return new Part(text, null);
            }

            static Part inline(String mimeType, String data) {
                return new Part(null, new InlineData(mimeType, data));
            }
        }

        record InlineData(String mimeType, String data) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
            String responseMimeType) {
        }
    }

    record GenerateContentResponse(List<Candidate> candidates) {

        record Candidate(Content content) {
        }

        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }
    }
}
