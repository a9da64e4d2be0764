package dev.pekelund.finsight.documents.googleai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.micrometer.observation.ObservationRegistry;
import java.util.Base64;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.util.MimeTypeUtils;
import org.springframework.web.client.RestClient;

class GoogleAiGeminiChatModelTest {

    private static final String BASE_URL = "https://gemini.test/v1beta";

    private MockRestServiceServer server;
    private GoogleAiGeminiChatModel chatModel;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        GoogleAiGeminiChatOptions defaults = GoogleAiGeminiChatOptions.builder()
            .model("gemini-2.5-pro")
            .temperature(0.1)
            .responseMimeType(GoogleAiGeminiChatOptions.JSON_MIME_TYPE)
            .build();
        chatModel = new GoogleAiGeminiChatModel(builder.build(), "test-key", defaults, ObservationRegistry.NOOP);
    }

    @Test
    void sendsInlineMediaAndReturnsFirstTextPart() {
        byte[] pdf = {37, 80, 68, 70};
        server.expect(requestTo(BASE_URL + "/models/gemini-2.0-flash:generateContent?key=test-key"))
            .andExpect(method(HttpMethod.POST))
            .andExpect(jsonPath("$.contents[0].role").value("user"))
            .andExpect(jsonPath("$.contents[0].parts[0].text").value("Extract this"))
            .andExpect(jsonPath("$.contents[0].parts[1].inlineData.mimeType").value("application/pdf"))
            .andExpect(jsonPath("$.contents[0].parts[1].inlineData.data").value(Base64.getEncoder().encodeToString(pdf)))
            .andExpect(jsonPath("$.generationConfig.responseMimeType").value("application/json"))
            .andExpect(jsonPath("$.generationConfig.temperature").value(0.1))
            .andRespond(withSuccess("""
                {"candidates":[{"content":{"role":"model","parts":[{"text":"{\\"ok\\":true}"}]},
                  "finishReason":"STOP"}]}
                """, MediaType.APPLICATION_JSON));

        UserMessage message = UserMessage.builder()
            .text("Extract this")
            .media(new Media(MimeTypeUtils.parseMimeType("application/pdf"), new ByteArrayResource(pdf)))
            .build();
        ChatResponse response = chatModel.call(new Prompt(message,
            GoogleAiGeminiChatOptions.builder().model("gemini-2.0-flash").build()));

        assertThat(response.getResult().getOutput().getText()).isEqualTo("{\"ok\":true}");
        server.verify();
    }

    @Test
    void wrapsHttpFailures() {
        server.expect(requestTo(BASE_URL + "/models/gemini-2.5-pro:generateContent?key=test-key"))
            .andRespond(withServerError());

        assertThatThrownBy(() -> chatModel.call(new Prompt(new UserMessage("hello"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageStartingWith("Google AI Gemini request failed");
    }

    @Test
    void rejectsResponsesWithoutText() {
        server.expect(requestTo(BASE_URL + "/models/gemini-2.5-pro:generateContent?key=test-key"))
            .andRespond(withSuccess("{\"candidates\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> chatModel.call(new Prompt(new UserMessage("hello"))))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("candidates");
    }

    @Test
    void mergesPromptOptionsOverDefaults() {
        GoogleAiGeminiChatOptions merged = GoogleAiGeminiChatOptions.builder().model("a").temperature(0.5).build()
            .merge(GoogleAiGeminiChatOptions.builder().model("b").build());

        assertThat(merged.getModel()).isEqualTo("b");
        assertThat(merged.getTemperature()).isEqualTo(0.5);
        assertThat(merged.<GoogleAiGeminiChatOptions>copy()).isEqualTo(merged);
    }
}
