package dev.pekelund.finsight.documents.googleai;

import java.util.List;
import java.util.Objects;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Chat options understood by {@link GoogleAiGeminiChatModel}. {@code responseMimeType} maps to Gemini's
 * {@code generationConfig.responseMimeType} and is set to {@code application/json} for extraction calls.
 */
public class GoogleAiGeminiChatOptions implements ChatOptions {

    public static final String JSON_MIME_TYPE = "application/json";

    private final String model;
    private final Double temperature;
    private final Integer topK;
    private final Double topP;
    private final Integer maxOutputTokens;
    private final List<String> stopSequences;
    private final String responseMimeType;

    private GoogleAiGeminiChatOptions(Builder builder) {
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.topK = builder.topK;
        this.topP = builder.topP;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.stopSequences = builder.stopSequences != null ? List.copyOf(builder.stopSequences) : List.of();
        this.responseMimeType = builder.responseMimeType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
            .model(model)
            .temperature(temperature)
            .topK(topK)
            .topP(topP)
            .maxOutputTokens(maxOutputTokens)
            .stopSequences(stopSequences)
            .responseMimeType(responseMimeType);
    }

    /**
     * @return these options with every non-empty value of {@code overrides} applied on top
     */
    public GoogleAiGeminiChatOptions merge(GoogleAiGeminiChatOptions overrides) {
        if (overrides == null) {
            return this;
        }
        Builder builder = toBuilder();
        if (StringUtils.hasText(overrides.getModel())) {
            builder.model(overrides.getModel());
        }
        if (overrides.getTemperature() != null) {
            builder.temperature(overrides.getTemperature());
        }
        if (overrides.getTopK() != null) {
            builder.topK(overrides.getTopK());
        }
        if (overrides.getTopP() != null) {
            builder.topP(overrides.getTopP());
        }
        if (overrides.getMaxOutputTokens() != null) {
            builder.maxOutputTokens(overrides.getMaxOutputTokens());
        }
        if (!CollectionUtils.isEmpty(overrides.getStopSequences())) {
            builder.stopSequences(overrides.getStopSequences());
        }
        if (StringUtils.hasText(overrides.getResponseMimeType())) {
            builder.responseMimeType(overrides.getResponseMimeType());
        }
        return builder.build();
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public Double getFrequencyPenalty() {
        return null;
    }

    @Override
    public Integer getMaxTokens() {
        return maxOutputTokens;
    }

    @Override
    public Double getPresencePenalty() {
        return null;
    }

    @Override
    public List<String> getStopSequences() {
        return stopSequences;
    }

    @Override
    public Double getTemperature() {
        return temperature;
    }

    @Override
    public Integer getTopK() {
        return topK;
    }

    @Override
    public Double getTopP() {
        return topP;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public String getResponseMimeType() {
        return responseMimeType;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends ChatOptions> T copy() {
        return (T) toBuilder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GoogleAiGeminiChatOptions that)) {
            return false;
        }
        return Objects.equals(model, that.model)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(topK, that.topK)
            && Objects.equals(topP, that.topP)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens)
            && Objects.equals(stopSequences, that.stopSequences)
            && Objects.equals(responseMimeType, that.responseMimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, temperature, topK, topP, maxOutputTokens, stopSequences, responseMimeType);
    }

    @Override
    public String toString() {
        return "GoogleAiGeminiChatOptions{"
            + "model='" + model + '\''
            + ", temperature=" + temperature
            + ", maxOutputTokens=" + maxOutputTokens
            + ", responseMimeType='" + responseMimeType + '\''
            + '}';
    }

    public static class Builder implements ChatOptions.Builder {

        private String model;
        private Double temperature;
        private Integer topK;
        private Double topP;
        private Integer maxOutputTokens;
        private List<String> stopSequences;
        private String responseMimeType;

        @Override
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        @Override
        public Builder frequencyPenalty(Double frequencyPenalty) {
            return this;
        }

        @Override
        public Builder maxTokens(Integer maxTokens) {
            this.maxOutputTokens = maxTokens;
            return this;
        }

        @Override
        public Builder presencePenalty(Double presencePenalty) {
            return this;
        }

        @Override
        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        @Override
        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        @Override
        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        @Override
        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        @Override
        public GoogleAiGeminiChatOptions build() {
            return new GoogleAiGeminiChatOptions(this);
        }
    }
}
