package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.finsight.records.RecordStore;
import dev.pekelund.finsight.storage.DocumentStorageService;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the resolved configuration when the service boots so the deployed artifact can be verified.
 */
@Component
public class DocumentProcessorDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessorDiagnostics.class);

    private final Environment environment;
    private final DocumentProcessingProperties properties;
    private final ObjectProvider<ChatModel> chatModelProvider;
    private final ObjectProvider<GoogleAiGeminiChatOptions> chatOptionsProvider;
    private final ObjectProvider<RecordStore> recordStoreProvider;
    private final ObjectProvider<DocumentStorageService> storageServiceProvider;

    public DocumentProcessorDiagnostics(Environment environment, DocumentProcessingProperties properties,
        ObjectProvider<ChatModel> chatModelProvider, ObjectProvider<GoogleAiGeminiChatOptions> chatOptionsProvider,
        ObjectProvider<RecordStore> recordStoreProvider, ObjectProvider<DocumentStorageService> storageServiceProvider) {
        this.environment = environment;
        this.properties = properties;
        this.chatModelProvider = chatModelProvider;
        this.chatOptionsProvider = chatOptionsProvider;
        this.recordStoreProvider = recordStoreProvider;
        this.storageServiceProvider = storageServiceProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Finsight document processor diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Upload limits - max size: {}, extensions: {}", properties.getUpload().getMaxUploadSize(),
            properties.getUpload().getAllowedExtensions());
        LOGGER.info("Extraction - small file threshold: {}, min text length: {}, oracle timeout: {}, "
                + "text fallback on timeout: {}", properties.getExtraction().getSmallFileThreshold(),
            properties.getExtraction().getMinTextLength(), properties.getExtraction().getVisionTimeout(),
            properties.getExtraction().isTextFallbackOnTimeout());

        ChatModel chatModel = chatModelProvider.getIfAvailable();
        LOGGER.info("Chat model implementation: {}", chatModel != null ? chatModel.getClass().getName() : "(none)");
        chatOptionsProvider.orderedStream()
            .forEach(options -> LOGGER.info("Gemini chat options: {}", options));

        RecordStore recordStore = recordStoreProvider.getIfAvailable();
        LOGGER.info("Record store implementation: {}",
            recordStore != null ? recordStore.getClass().getSimpleName() : "(none)");
        DocumentStorageService storageService = storageServiceProvider.getIfAvailable();
        LOGGER.info("Document archive enabled: {}", storageService != null && storageService.isEnabled());
    }
}
