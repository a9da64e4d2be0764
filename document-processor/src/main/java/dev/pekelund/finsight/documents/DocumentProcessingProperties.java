package dev.pekelund.finsight.documents;

import dev.pekelund.finsight.documents.extraction.ExtractionSettings;
import dev.pekelund.finsight.documents.summary.SummaryWeights;
import dev.pekelund.finsight.documents.tabular.DetectionWeights;
import dev.pekelund.finsight.documents.tabular.MappingWeights;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

@ConfigurationProperties(prefix = "finsight.documents")
public class DocumentProcessingProperties {

    private final Upload upload = new Upload();
    private final Extraction extraction = new Extraction();
    private final Detection detection = new Detection();
    private final Mapping mapping = new Mapping();
    private final Summary summary = new Summary();

    /**
     * Number of rows kept in analysis previews and used for spreadsheet summaries.
     */
    private int previewRowLimit = 100;

    /**
     * Whether accepted uploads are archived through the document storage service when it is enabled.
     */
    private boolean archiveUploads = true;

    public Upload getUpload() {
        return upload;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public Detection getDetection() {
        return detection;
    }

    public Mapping getMapping() {
        return mapping;
    }

    public Summary getSummary() {
        return summary;
    }

    public int getPreviewRowLimit() {
        return previewRowLimit;
    }

    public void setPreviewRowLimit(int previewRowLimit) {
        this.previewRowLimit = previewRowLimit;
    }

    public boolean isArchiveUploads() {
        return archiveUploads;
    }

    public void setArchiveUploads(boolean archiveUploads) {
        this.archiveUploads = archiveUploads;
    }

    public static class Upload {

        /**
         * Largest accepted upload.
         */
        private DataSize maxUploadSize = DataSize.ofMegabytes(10);

        /**
         * Accepted file extensions without the leading dot.
         */
        private Set<String> allowedExtensions = new LinkedHashSet<>(List.of("csv", "pdf"));

        /**
         * Maximum number of row errors reported back from an import.
         */
        private int maxReportedErrors = 10;

        public DataSize getMaxUploadSize() {
            return maxUploadSize;
        }

        public void setMaxUploadSize(DataSize maxUploadSize) {
            this.maxUploadSize = maxUploadSize;
        }

        public Set<String> getAllowedExtensions() {
            return allowedExtensions;
        }

        public void setAllowedExtensions(Set<String> allowedExtensions) {
            this.allowedExtensions = allowedExtensions;
        }

        public int getMaxReportedErrors() {
            return maxReportedErrors;
        }

        public void setMaxReportedErrors(int maxReportedErrors) {
            this.maxReportedErrors = maxReportedErrors;
        }
    }

    public static class Extraction {

        /**
         * Documents smaller than this try text-based extraction first.
         */
        private DataSize smallFileThreshold = DataSize.ofKilobytes(100);

        /**
         * Minimum number of characters of embedded text needed for text-based extraction.
         */
        private int minTextLength = 100;

        /**
         * Upper bound for a single extraction oracle call.
         */
        private Duration visionTimeout = Duration.ofSeconds(90);

        /**
         * Whether an image-based timeout falls back to text-based extraction.
         */
        private boolean textFallbackOnTimeout = true;

        /**
         * Threads available for concurrent oracle calls.
         */
        private int oracleThreads = 4;

        /**
         * Oracle calls allowed to wait for a thread; further calls are rejected as busy.
         */
        private int oracleQueueCapacity = 16;

        /**
         * How long an oracle call may wait for a free thread before the run is reported as busy.
         */
        private Duration queueTimeout = Duration.ofSeconds(30);

        public DataSize getSmallFileThreshold() {
            return smallFileThreshold;
        }

        public void setSmallFileThreshold(DataSize smallFileThreshold) {
            this.smallFileThreshold = smallFileThreshold;
        }

        public int getMinTextLength() {
            return minTextLength;
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = minTextLength;
        }

        public Duration getVisionTimeout() {
            return visionTimeout;
        }

        public void setVisionTimeout(Duration visionTimeout) {
            this.visionTimeout = visionTimeout;
        }

        public boolean isTextFallbackOnTimeout() {
            return textFallbackOnTimeout;
        }

        public void setTextFallbackOnTimeout(boolean textFallbackOnTimeout) {
            this.textFallbackOnTimeout = textFallbackOnTimeout;
        }

        public int getOracleThreads() {
            return oracleThreads;
        }

        public void setOracleThreads(int oracleThreads) {
            this.oracleThreads = oracleThreads;
        }

        public int getOracleQueueCapacity() {
            return oracleQueueCapacity;
        }

        public void setOracleQueueCapacity(int oracleQueueCapacity) {
            this.oracleQueueCapacity = oracleQueueCapacity;
        }

        public Duration getQueueTimeout() {
            return queueTimeout;
        }

        public void setQueueTimeout(Duration queueTimeout) {
            this.queueTimeout = queueTimeout;
        }

        public ExtractionSettings toSettings() {
            return new ExtractionSettings(smallFileThreshold.toBytes(), minTextLength, visionTimeout,
                textFallbackOnTimeout, queueTimeout);
        }
    }

    public static class Detection {

        private int minimumScore = 2;
        private int minimumLead = 0;
        private int uniquePatternWeight = 2;

        public int getMinimumScore() {
            return minimumScore;
        }

        public void setMinimumScore(int minimumScore) {
            this.minimumScore = minimumScore;
        }

        public int getMinimumLead() {
            return minimumLead;
        }

        public void setMinimumLead(int minimumLead) {
            this.minimumLead = minimumLead;
        }

        public int getUniquePatternWeight() {
            return uniquePatternWeight;
        }

        public void setUniquePatternWeight(int uniquePatternWeight) {
            this.uniquePatternWeight = uniquePatternWeight;
        }

        public DetectionWeights toWeights() {
            return new DetectionWeights(minimumScore, minimumLead, uniquePatternWeight);
        }
    }

    public static class Mapping {

        private double exactWeight = 1.0;
        private double synonymWeight = 0.85;
        private double partialWeight = 0.7;

        /**
         * Share of the overall confidence contributed by required fields.
         */
        private double requiredShare = 0.7;

        /**
         * Minimum confidence for a mapping to be applied without confirmation.
         */
        private double autoApplyThreshold = 0.80;

        public double getExactWeight() {
            return exactWeight;
        }

        public void setExactWeight(double exactWeight) {
            this.exactWeight = exactWeight;
        }

        public double getSynonymWeight() {
            return synonymWeight;
        }

        public void setSynonymWeight(double synonymWeight) {
            this.synonymWeight = synonymWeight;
        }

        public double getPartialWeight() {
            return partialWeight;
        }

        public void setPartialWeight(double partialWeight) {
            this.partialWeight = partialWeight;
        }

        public double getRequiredShare() {
            return requiredShare;
        }

        public void setRequiredShare(double requiredShare) {
            this.requiredShare = requiredShare;
        }

        public double getAutoApplyThreshold() {
            return autoApplyThreshold;
        }

        public void setAutoApplyThreshold(double autoApplyThreshold) {
            this.autoApplyThreshold = autoApplyThreshold;
        }

        public MappingWeights toWeights() {
            return new MappingWeights(exactWeight, synonymWeight, partialWeight, requiredShare, autoApplyThreshold);
        }
    }

    public static class Summary {

        private double pdfBaseConfidence = 0.8;
        private double csvBaseConfidence = 0.7;
        private double genericBaseConfidence = 0.5;
        private double metricBoost = 0.05;
        private double metadataBoost = 0.02;
        private double maxConfidence = 1.0;
        private int maxDisplayMetrics = 3;
        private BigDecimal currencyThreshold = BigDecimal.valueOf(100);
        private int numericSampleSize = 100;
        private double numericColumnThreshold = 0.5;

        public double getPdfBaseConfidence() {
            return pdfBaseConfidence;
        }

        public void setPdfBaseConfidence(double pdfBaseConfidence) {
            this.pdfBaseConfidence = pdfBaseConfidence;
        }

        public double getCsvBaseConfidence() {
            return csvBaseConfidence;
        }

        public void setCsvBaseConfidence(double csvBaseConfidence) {
            this.csvBaseConfidence = csvBaseConfidence;
        }

        public double getGenericBaseConfidence() {
            return genericBaseConfidence;
        }

        public void setGenericBaseConfidence(double genericBaseConfidence) {
            this.genericBaseConfidence = genericBaseConfidence;
        }

        public double getMetricBoost() {
            return metricBoost;
        }

        public void setMetricBoost(double metricBoost) {
            this.metricBoost = metricBoost;
        }

        public double getMetadataBoost() {
            return metadataBoost;
        }

        public void setMetadataBoost(double metadataBoost) {
            this.metadataBoost = metadataBoost;
        }

        public double getMaxConfidence() {
            return maxConfidence;
        }

        public void setMaxConfidence(double maxConfidence) {
            this.maxConfidence = maxConfidence;
        }

        public int getMaxDisplayMetrics() {
            return maxDisplayMetrics;
        }

        public void setMaxDisplayMetrics(int maxDisplayMetrics) {
            this.maxDisplayMetrics = maxDisplayMetrics;
        }

        public BigDecimal getCurrencyThreshold() {
            return currencyThreshold;
        }

        public void setCurrencyThreshold(BigDecimal currencyThreshold) {
            this.currencyThreshold = currencyThreshold;
        }

        public int getNumericSampleSize() {
            return numericSampleSize;
        }

        public void setNumericSampleSize(int numericSampleSize) {
            this.numericSampleSize = numericSampleSize;
        }

        public double getNumericColumnThreshold() {
            return numericColumnThreshold;
        }

        public void setNumericColumnThreshold(double numericColumnThreshold) {
            this.numericColumnThreshold = numericColumnThreshold;
        }

        public SummaryWeights toWeights() {
            return new SummaryWeights(pdfBaseConfidence, csvBaseConfidence, genericBaseConfidence, metricBoost,
                metadataBoost, maxConfidence, maxDisplayMetrics, currencyThreshold, numericSampleSize,
                numericColumnThreshold);
        }
    }
}
