package org.javai.result.boundary;

import java.util.Objects;
import java.util.function.Function;
import org.javai.result.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The adapter between code that throws checked exceptions and code that works with
 * {@link Result}. Runs the work, catches checked exceptions, reports them and returns
 * them as a {@link Result.Failure}.
 *
 * <p>RuntimeExceptions and Errors are not caught. They are defects rather than outcomes
 * and propagate to the caller unchanged.
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * Boundary boundary = Boundary.withReporter(new Slf4jFailureReporter());
 *
 * Result<JsonNode, String> document = boundary.call(
 *     "Json.parse",
 *     () -> objectMapper.readTree(json),
 *     Exception::getMessage
 * );
 * }</pre>
 */
public final class Boundary {

    private static final Logger LOG = LoggerFactory.getLogger(Boundary.class);

    private final FailureReporter reporter;

    /**
     * Creates a Boundary that captures failures without reporting them.
     */
    public static Boundary silent() {
        return new Boundary(FailureReporter.noOp());
    }

    /**
     * Creates a Boundary that reports every captured failure to {@code reporter}.
     */
    public static Boundary withReporter(FailureReporter reporter) {
        return new Boundary(reporter);
    }

    public Boundary(FailureReporter reporter) {
        this.reporter = Objects.requireNonNull(reporter, "reporter must not be null");
    }

    /**
     * Executes work that may throw a checked exception.
     *
     * @param operation the operation name, used for reporting
     * @param work the work to execute
     * @return Success with the work's value, or Failure with the exception it threw
     */
    public <T> Result<T, Exception> call(String operation, CheckedSupplier<? extends T, ? extends Exception> work) {
        return call(operation, work, Function.identity());
    }

    /**
     * Executes work that may throw a checked exception, mapping a captured exception into
     * the caller's error type.
     *
     * @param operation the operation name, used for reporting
     * @param work the work to execute
     * @param errorMapper converts the captured exception into the failure value
     * @return Success with the work's value, or Failure with the mapped exception
     */
    public <T, E> Result<T, E> call(
            String operation,
            CheckedSupplier<? extends T, ? extends Exception> work,
            Function<? super Exception, ? extends E> errorMapper
    ) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(work, "work must not be null");
        Objects.requireNonNull(errorMapper, "errorMapper must not be null");

        try {
            return Result.success(work.get());
        } catch (RuntimeException e) {
            // Defects propagate, they are not outcomes
            throw e;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return handleException(operation, e, errorMapper);
        }
    }

    private <T, E> Result<T, E> handleException(
            String operation,
            Exception e,
            Function<? super Exception, ? extends E> errorMapper
    ) {
        LOG.debug("Operation [{}] failed with {}", operation, e.getClass().getName(), e);
        reporter.report(operation, e);
        return Result.failure(errorMapper.apply(e));
    }
}
