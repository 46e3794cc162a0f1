package org.javai.result.boundary;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports boundary failures as SLF4J warnings.
 *
 * <p>Only the exception's type and message are logged. The exception itself is returned
 * to the caller inside the failure.
 */
public class Slf4jFailureReporter implements FailureReporter {

    private static final String DEFAULT_LOGGER_NAME = "org.javai.result.FailureReporter";

    private final Logger logger;

    /**
     * Creates a reporter using the default logger name.
     */
    public Slf4jFailureReporter() {
        this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
    }

    /**
     * Creates a reporter with a custom logger name.
     *
     * @param loggerName the logger name
     */
    public Slf4jFailureReporter(String loggerName) {
        this(LoggerFactory.getLogger(loggerName));
    }

    /**
     * Creates a reporter with a specific logger instance.
     *
     * @param logger the SLF4J logger to use
     */
    public Slf4jFailureReporter(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void report(String operation, Exception exception) {
        logger.warn("Failure in operation [{}]: {} | type={}",
                operation,
                exception.getMessage(),
                exception.getClass().getName());
    }
}
