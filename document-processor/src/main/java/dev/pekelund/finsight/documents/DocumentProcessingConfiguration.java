package dev.pekelund.finsight.documents;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.finsight.documents.extraction.ChatModelExtractionOracle;
import dev.pekelund.finsight.documents.extraction.DocumentClassifier;
import dev.pekelund.finsight.documents.extraction.ExtractionEngine;
import dev.pekelund.finsight.documents.extraction.ExtractionOracle;
import dev.pekelund.finsight.documents.extraction.ExtractionPayloadReader;
import dev.pekelund.finsight.documents.extraction.PdfTextExtractor;
import dev.pekelund.finsight.documents.googleai.GoogleAiGeminiChatModel;
import dev.pekelund.finsight.documents.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.finsight.documents.summary.SummaryGenerator;
import dev.pekelund.finsight.documents.tabular.ColumnMapper;
import dev.pekelund.finsight.documents.tabular.RowImporter;
import dev.pekelund.finsight.documents.tabular.TabularParser;
import dev.pekelund.finsight.documents.tabular.TypeDetector;
import dev.pekelund.finsight.documents.upload.UploadValidator;
import dev.pekelund.finsight.records.RecordStore;
import dev.pekelund.finsight.storage.DocumentStorageService;
import io.micrometer.observation.ObservationRegistry;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the document processing workload.
 */
@Configuration
@EnableConfigurationProperties(DocumentProcessingProperties.class)
public class DocumentProcessingConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentProcessingConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    @Bean
    public GoogleAiGeminiChatOptions documentGeminiChatOptions(Environment environment) {
        return geminiOptions(environment, "google.ai.gemini.vision-model", "gemini-2.5-pro");
    }

    @Bean
    public GoogleAiGeminiChatOptions textGeminiChatOptions(Environment environment) {
        return geminiOptions(environment, "google.ai.gemini.text-model", "gemini-2.0-flash");
    }

    private static GoogleAiGeminiChatOptions geminiOptions(Environment environment, String modelProperty,
        String defaultModel) {
        String modelName = environment.getProperty(modelProperty, defaultModel);
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Google AI Gemini settings ({}) - model: {}, temperature: {}, maxOutputTokens: {}",
            modelProperty, modelName, temperature, maxOutputTokens);
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .responseMimeType(GoogleAiGeminiChatOptions.JSON_MIME_TYPE)
            .build();
    }

    @Bean
    @Primary
    @Profile("!local")
    public GoogleAiGeminiChatModel googleAiGeminiChatModel(Environment environment,
        @Qualifier("documentGeminiChatOptions") GoogleAiGeminiChatOptions documentGeminiChatOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }
        String baseUrl = environment.getProperty("google.ai.gemini.base-url",
            GoogleAiGeminiChatModel.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();

        GoogleAiGeminiChatModel chatModel = new GoogleAiGeminiChatModel(restClient, apiKey, documentGeminiChatOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
        LOGGER.info("Google AI Gemini ChatModel default options: {}", chatModel.getDefaultOptions());
        return chatModel;
    }

    @Bean
    public ExtractionOracle extractionOracle(ChatModel chatModel,
        @Qualifier("documentGeminiChatOptions") GoogleAiGeminiChatOptions documentGeminiChatOptions,
        @Qualifier("textGeminiChatOptions") GoogleAiGeminiChatOptions textGeminiChatOptions) {
        return new ChatModelExtractionOracle(chatModel, documentGeminiChatOptions, textGeminiChatOptions);
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService extractionExecutor(DocumentProcessingProperties properties) {
        int threads = Math.max(1, properties.getExtraction().getOracleThreads());
        int queueCapacity = Math.max(1, properties.getExtraction().getOracleQueueCapacity());
        return new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(queueCapacity), new CustomizableThreadFactory("extraction-oracle-"),
            new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public ExtractionEngine extractionEngine(ExtractionOracle extractionOracle, ObjectMapper objectMapper,
        @Qualifier("extractionExecutor") ExecutorService extractionExecutor, DocumentProcessingProperties properties) {
        return new ExtractionEngine(extractionOracle, new DocumentClassifier(), new PdfTextExtractor(),
            new ExtractionPayloadReader(objectMapper), properties.getExtraction().toSettings(), extractionExecutor);
    }

    @Bean
    public UploadValidator uploadValidator(DocumentProcessingProperties properties) {
        return new UploadValidator(properties.getUpload().getMaxUploadSize(),
            properties.getUpload().getAllowedExtensions());
    }

    @Bean
    public TypeDetector typeDetector(DocumentProcessingProperties properties) {
        return new TypeDetector(properties.getDetection().toWeights());
    }

    @Bean
    public ColumnMapper columnMapper(DocumentProcessingProperties properties) {
        return new ColumnMapper(properties.getMapping().toWeights());
    }

    @Bean
    public RowImporter rowImporter(RecordStore recordStore, DocumentProcessingProperties properties) {
        return new RowImporter(recordStore, properties.getUpload().getMaxReportedErrors());
    }

    @Bean
    public SummaryGenerator summaryGenerator(DocumentProcessingProperties properties) {
        return new SummaryGenerator(properties.getSummary().toWeights());
    }

    @Bean
    public DocumentRegistry documentRegistry(RecordStore recordStore, ObjectMapper objectMapper) {
        return new DocumentRegistry(recordStore, objectMapper);
    }

    @Bean
    public DocumentPipeline documentPipeline(TypeDetector typeDetector, ColumnMapper columnMapper,
        RowImporter rowImporter, ExtractionEngine extractionEngine, SummaryGenerator summaryGenerator,
        ObjectProvider<DocumentStorageService> storageService, DocumentRegistry documentRegistry,
        DocumentProcessingProperties properties) {
        return new DocumentPipeline(new TabularParser(), typeDetector, columnMapper, rowImporter, extractionEngine,
            summaryGenerator, storageService.getIfAvailable(), documentRegistry, properties.getPreviewRowLimit(),
            properties.isArchiveUploads());
    }
}
