package dev.pekelund.finsight.documents.extraction;

import dev.pekelund.finsight.documents.DocumentProcessingException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns PDF documents into typed payloads through the {@link ExtractionOracle}.
 *
 * <p>Documents below the small-file threshold first try the text-first strategy: the embedded text is read locally
 * and sent to the text variant of the oracle. When that yields too little text or fails, the raw document is sent to
 * the multimodal variant under a hard timeout. A timeout there falls back to text-based extraction once. Any other
 * failure of a classified schema is retried once with {@link ExtractionSchema#GENERIC}; a forced schema is never
 * retried.</p>
 *
 * <p>Oracle calls run on the supplied executor. The oracle timeout starts once a worker picks the call up; a call that
 * waits longer than the queue timeout for a worker ends the run as {@link ExtractionOutcome.Busy}.</p>
 */
public class ExtractionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExtractionEngine.class);

    private final ExtractionOracle oracle;
    private final DocumentClassifier classifier;
    private final PdfTextExtractor textExtractor;
    private final ExtractionPayloadReader payloadReader;
    private final ExtractionSettings settings;
    private final ExecutorService executor;

    public ExtractionEngine(ExtractionOracle oracle, DocumentClassifier classifier, PdfTextExtractor textExtractor,
        ExtractionPayloadReader payloadReader, ExtractionSettings settings, ExecutorService executor) {
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.textExtractor = Objects.requireNonNull(textExtractor, "textExtractor");
        this.payloadReader = Objects.requireNonNull(payloadReader, "payloadReader");
        this.settings = settings != null ? settings : ExtractionSettings.defaults();
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    public ExtractionOutcome extract(ExtractionRequest request) {
        Objects.requireNonNull(request, "request");
        Optional<ExtractionSchema> forced = request.forced();
        ExtractionSchema schema = forced.orElseGet(() -> classifier.classify(request.filename()));
        LOGGER.info("Extracting {} ({} bytes) with schema {}{}", request.filename(), request.content().length,
            schema, forced.isPresent() ? " (forced)" : "");

        ExtractionOutcome outcome = new Run(request, schema, forced.isPresent()).execute();
        logOutcome(request, outcome);
        return outcome;
    }

    private void logOutcome(ExtractionRequest request, ExtractionOutcome outcome) {
        long elapsedMs = outcome.elapsed().toMillis();
        if (outcome instanceof ExtractionOutcome.Ok ok) {
            LOGGER.info("Extracted {} with schema {} using {} strategy in {} ms", request.filename(),
                ok.result().schema(), ok.result().strategy(), elapsedMs);
        } else if (outcome instanceof ExtractionOutcome.Busy) {
            LOGGER.warn("Extraction of {} gave up after {} ms waiting for an oracle worker", request.filename(),
                elapsedMs);
        } else if (outcome instanceof ExtractionOutcome.Exhausted exhausted) {
            LOGGER.error("Extraction of {} exhausted every strategy after {} ms: {}", request.filename(), elapsedMs,
                exhausted.causes());
        } else {
            LOGGER.error("Extraction of {} failed after {} ms: {}", request.filename(), elapsedMs, outcome);
        }
    }

    static String describe(Duration duration) {
        if (duration.toMillis() % 1000 == 0) {
            return duration.toSeconds() + " seconds";
        }
        return duration.toMillis() + " ms";
    }

    /**
     * State of a single {@link #extract(ExtractionRequest)} call.
     */
    private final class Run {

        private final ExtractionRequest request;
        private final ExtractionSchema schema;
        private final boolean forced;
        private final long startedNanos = System.nanoTime();
        private final List<Attempt> failures = new ArrayList<>();
        private boolean textAttempted;

        private Run(ExtractionRequest request, ExtractionSchema schema, boolean forced) {
            this.request = request;
            this.schema = schema;
            this.forced = forced;
        }

        ExtractionOutcome execute() {
            if (request.content().length < settings.smallFileThresholdBytes()) {
                Attempt text = textAttempt(schema);
                if (text.succeeded()) {
                    return ok(text);
                }
                if (text.busy()) {
                    return busy();
                }
                LOGGER.info("Text-first extraction of {} fell through to image-based extraction: {}",
                    request.filename(), text.message());
                failures.add(text);
            }

            Attempt image = imageAttempt(schema);
            if (image.succeeded()) {
                return ok(image);
            }
            if (image.busy()) {
                return busy();
            }

            if (image.timedOut()) {
                if (settings.textFallbackOnTimeout() && !textAttempted) {
                    LOGGER.warn("Image-based extraction of {} timed out after {}, falling back to text extraction",
                        request.filename(), describe(settings.oracleTimeout()));
                    Attempt fallback = textAttempt(schema);
                    if (fallback.succeeded()) {
                        return ok(fallback);
                    }
                    failures.add(image);
                    return new ExtractionOutcome.Exhausted(List.of(image.message(),
                        "text extraction fallback failed: " + fallback.message()), elapsed());
                }
                failures.add(image);
                return failed();
            }

            failures.add(image);
            if (forced || schema == ExtractionSchema.GENERIC) {
                return failed();
            }

            LOGGER.warn("{} extraction of {} failed, falling back to generic", schema.label(), request.filename());
            Attempt generic = imageAttempt(ExtractionSchema.GENERIC);
            if (generic.succeeded()) {
                return ok(generic);
            }
            if (generic.busy()) {
                return busy();
            }
            failures.add(generic);
            return failed();
        }

        private Attempt textAttempt(ExtractionSchema target) {
            textAttempted = true;
            PdfText text;
            boolean tabular;
            try {
                text = textExtractor.extract(request.content());
                if (text.length() < settings.minimumTextLength()) {
                    String message = "Extracted text too short (" + text.length()
                        + " characters), document may be scanned";
                    return Attempt.failed(target, message, new PdfTextExtractionException(message));
                }
                tabular = textExtractor.looksTabular(text.text());
            } catch (RuntimeException ex) {
                LOGGER.debug("Local text extraction of {} failed", request.filename(), ex);
                return Attempt.failed(target, "Text extraction failed: " + messageOf(ex), ex);
            }

            LOGGER.info("Read {} characters from {} page(s) of {} (tabular: {})", text.length(), text.pageCount(),
                request.filename(), tabular);
            String instruction = ExtractionInstructions.forText(target, text.text(), tabular);
            return call(target, ExtractionStrategy.TEXT, tabular, () -> oracle.extractFromText(instruction));
        }

        private Attempt imageAttempt(ExtractionSchema target) {
            String instruction = ExtractionInstructions.forDocument(target);
            return call(target, ExtractionStrategy.IMAGE, false,
                () -> oracle.extractFromDocument(instruction, request.content(), request.mediaType()));
        }

        private Attempt call(ExtractionSchema target, ExtractionStrategy strategy, boolean tabular,
            Callable<String> oracleCall) {
            String label = strategy == ExtractionStrategy.TEXT ? "Text-based" : "Image-based";
            CountDownLatch started = new CountDownLatch(1);
            Future<String> future;
            try {
                future = executor.submit(() -> {
                    started.countDown();
                    return oracleCall.call();
                });
            } catch (RejectedExecutionException ex) {
                LOGGER.warn("{} extraction of {} was rejected by the oracle executor", label, request.filename());
                ExtractionBusyException busy = new ExtractionBusyException(settings.queueTimeout());
                return Attempt.busy(target, busy.getMessage(), busy);
            }

            long callStarted;
            String response;
            try {
                if (!started.await(settings.queueTimeout().toNanos(), TimeUnit.NANOSECONDS)) {
                    future.cancel(true);
                    LOGGER.warn("{} extraction of {} did not get an oracle worker within {}", label,
                        request.filename(), describe(settings.queueTimeout()));
                    ExtractionBusyException busy = new ExtractionBusyException(settings.queueTimeout());
                    return Attempt.busy(target, busy.getMessage(), busy);
                }
                callStarted = System.nanoTime();
                response = future.get(settings.oracleTimeout().toNanos(), TimeUnit.NANOSECONDS);
            } catch (TimeoutException ex) {
                future.cancel(true);
                return Attempt.timedOut(target, label + " extraction timed out after "
                    + describe(settings.oracleTimeout()), new ExtractionTimeoutException(settings.oracleTimeout()));
            } catch (ExecutionException ex) {
                RuntimeException cause = asRuntime(ex.getCause());
                return Attempt.failed(target, label + " extraction failed: " + messageOf(cause), cause);
            } catch (InterruptedException ex) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new DocumentProcessingException("Interrupted while waiting for the extraction oracle", ex);
            }

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Oracle response for {} with schema {}: {}", request.filename(), target, response);
            }
            try {
                ExtractionPayload payload = payloadReader.read(target, response);
                Duration callDuration = Duration.ofNanos(System.nanoTime() - callStarted);
                return Attempt.succeeded(new ExtractionResult(target, payload, strategy, callDuration, tabular));
            } catch (ExtractionSchemaException ex) {
                return Attempt.failed(target, label + " extraction failed: " + ex.getMessage(), ex);
            }
        }

        private ExtractionOutcome ok(Attempt attempt) {
            Duration elapsed = elapsed();
            return new ExtractionOutcome.Ok(attempt.result().withProcessingTime(elapsed), elapsed);
        }

        private ExtractionOutcome busy() {
            return new ExtractionOutcome.Busy(settings.queueTimeout(), elapsed());
        }

        /**
         * A forced schema reports only its final attempt; earlier text-first failures are logged when they happen.
         */
        private ExtractionOutcome failed() {
            if (failures.size() == 1 || forced) {
                Attempt last = failures.get(failures.size() - 1);
                if (last.timedOut()) {
                    return new ExtractionOutcome.TimedOut(settings.oracleTimeout(), elapsed());
                }
                return new ExtractionOutcome.SchemaFailed(last.schema(), last.failure(), elapsed());
            }
            return new ExtractionOutcome.Exhausted(failures.stream().map(Attempt::message).toList(), elapsed());
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startedNanos);
        }
    }

    private static RuntimeException asRuntime(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new DocumentProcessingException(messageOf(cause), cause);
    }

    private static String messageOf(Throwable throwable) {
        if (throwable == null) {
            return "Unknown error";
        }
        return throwable.getMessage() != null ? throwable.getMessage() : throwable.getClass().getSimpleName();
    }

    private enum AttemptState {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        BUSY
    }

    private record Attempt(ExtractionSchema schema, ExtractionResult result, String message, RuntimeException failure,
        AttemptState state) {

        static Attempt succeeded(ExtractionResult result) {
            return new Attempt(result.schema(), result, null, null, AttemptState.SUCCEEDED);
        }

        static Attempt failed(ExtractionSchema schema, String message, RuntimeException failure) {
            return new Attempt(schema, null, message, failure, AttemptState.FAILED);
        }

        static Attempt timedOut(ExtractionSchema schema, String message, RuntimeException failure) {
            return new Attempt(schema, null, message, failure, AttemptState.TIMED_OUT);
        }

        static Attempt busy(ExtractionSchema schema, String message, RuntimeException failure) {
            return new Attempt(schema, null, message, failure, AttemptState.BUSY);
        }

        boolean succeeded() {
            return state == AttemptState.SUCCEEDED;
        }

        boolean timedOut() {
            return state == AttemptState.TIMED_OUT;
        }

        boolean busy() {
            return state == AttemptState.BUSY;
        }
    }
}
