package org.javai.result.boundary;

import java.util.Objects;

/**
 * Receives the checked exceptions a {@link Boundary} turns into failures.
 * Implementations might log them or count them.
 */
@FunctionalInterface
public interface FailureReporter {

    /**
     * Reports a failure captured at a boundary.
     *
     * @param operation the operation name given to the boundary
     * @param exception the exception the work threw
     */
    void report(String operation, Exception exception);

    /**
     * A reporter that does nothing.
     */
    static FailureReporter noOp() {
        return (operation, exception) -> {};
    }

    /**
     * Creates a reporter that forwards each report to all given reporters, in order.
     */
    static FailureReporter composite(FailureReporter... reporters) {
        return CompositeFailureReporter.of(reporters);
    }

    /**
     * Returns a reporter that calls this one, then {@code next}.
     */
    default FailureReporter andThen(FailureReporter next) {
        Objects.requireNonNull(next, "next must not be null");
        return composite(this, next);
    }
}
