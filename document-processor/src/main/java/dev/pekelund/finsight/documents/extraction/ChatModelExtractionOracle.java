package dev.pekelund.finsight.documents.extraction;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.content.Media;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/**
 * {@link ExtractionOracle} backed by a Spring AI {@link ChatModel}. The multimodal and text variants differ only in
 * the chat options (and so the model) used for the call.
 */
public class ChatModelExtractionOracle implements ExtractionOracle {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChatModelExtractionOracle.class);

    private final ChatModel chatModel;
    private final ChatOptions documentOptions;
    private final ChatOptions textOptions;

    public ChatModelExtractionOracle(ChatModel chatModel, ChatOptions documentOptions, ChatOptions textOptions) {
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.documentOptions = documentOptions;
        this.textOptions = textOptions;
    }

    @Override
    public String extractFromDocument(String instruction, byte[] document, String mediaType) {
        Media media = new Media(MimeTypeUtils.parseMimeType(mediaType), new ByteArrayResource(document));
        UserMessage message = UserMessage.builder()
            .text(instruction)
            .media(media)
            .build();
        LOGGER.info("Requesting document extraction from model '{}' ({} bytes of {})", modelOf(documentOptions),
            document.length, mediaType);
        return call(new Prompt(message, copy(documentOptions)));
    }

    @Override
    public String extractFromText(String instruction) {
        LOGGER.info("Requesting text extraction from model '{}' (instruction length {})", modelOf(textOptions),
            instruction.length());
        return call(new Prompt(new UserMessage(instruction), copy(textOptions)));
    }

    private String call(Prompt prompt) {
        ChatResponse response = chatModel.call(prompt);
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Extraction model returned no result");
        }
        String text = response.getResult().getOutput().getText();
        if (!StringUtils.hasText(text)) {
            throw new IllegalStateException("Extraction model returned an empty response");
        }
        return text;
    }

    private static ChatOptions copy(ChatOptions options) {
        return options != null ? options.copy() : null;
    }

    private static String modelOf(ChatOptions options) {
        return options != null && options.getModel() != null ? options.getModel() : "(default)";
    }
}
