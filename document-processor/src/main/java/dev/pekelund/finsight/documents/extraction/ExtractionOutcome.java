package dev.pekelund.finsight.documents.extraction;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Terminal state of one {@link ExtractionEngine} run. Every variant reports the wall-clock time spent.
 */
public sealed interface ExtractionOutcome {

    Duration elapsed();

    default boolean isSuccess() {
        return this instanceof Ok;
    }

    default Optional<ExtractionResult> maybeResult() {
        return this instanceof Ok ok ? Optional.of(ok.result()) : Optional.empty();
    }

    /**
     * @return the extraction result, or the exception describing why there is none
     */
    ExtractionResult orElseThrow();

    record Ok(ExtractionResult result, Duration elapsed) implements ExtractionOutcome {

        @Override
        public ExtractionResult orElseThrow() {
            return result;
        }
    }

    /**
     * The oracle did not answer within {@code timeout} and no fallback ran.
     */
    record TimedOut(Duration timeout, Duration elapsed) implements ExtractionOutcome {

        @Override
        public ExtractionResult orElseThrow() {
            throw new ExtractionTimeoutException(timeout);
        }
    }

    /**
     * A single attempt against {@code schema} failed and no retry was allowed.
     */
    record SchemaFailed(ExtractionSchema schema, RuntimeException cause, Duration elapsed)
        implements ExtractionOutcome {

        @Override
        public ExtractionResult orElseThrow() {
            if (cause instanceof ExtractionSchemaException schemaException) {
                throw schemaException;
            }
            throw new ExtractionSchemaException(schema, cause.getMessage(), cause);
        }
    }

    /**
     * No oracle capacity became available within {@code queueTimeout}, so no attempt was made.
     */
    record Busy(Duration queueTimeout, Duration elapsed) implements ExtractionOutcome {

        @Override
        public ExtractionResult orElseThrow() {
            throw new ExtractionBusyException(queueTimeout);
        }
    }

    record Exhausted(List<String> causes, Duration elapsed) implements ExtractionOutcome {

        public Exhausted {
            causes = List.copyOf(causes);
        }

        @Override
        public ExtractionResult orElseThrow() {
            throw new ExtractionExhaustedException(causes);
        }
    }
}
