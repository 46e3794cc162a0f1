package org.javai.result.boundary;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Reports boundary failures through the Log4j2 API.
 *
 * <p>Entries carry the {@code RESULT_FAILURE} marker so they can be routed or filtered
 * separately from the application's other log output. The level defaults to WARN.
 */
public class Log4jFailureReporter implements FailureReporter {

	public static final Marker FAILURE_MARKER = MarkerManager.getMarker("RESULT_FAILURE");

	private final Logger logger;
	private final Level level;

	/**
	 * Creates a Log4jFailureReporter using the default logger name.
	 */
	public Log4jFailureReporter() {
		this(LogManager.getLogger("org.javai.result.FailureReporter"));
	}

	/**
	 * Creates a Log4jFailureReporter with a custom logger name.
	 *
	 * @param loggerName the logger name
	 */
	public Log4jFailureReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	/**
	 * Creates a Log4jFailureReporter with a specific logger instance.
	 *
	 * @param logger the Log4j logger to use
	 */
	public Log4jFailureReporter(Logger logger) {
		this(logger, Level.WARN);
	}

	/**
	 * Creates a Log4jFailureReporter logging at the given level.
	 *
	 * @param logger the Log4j logger to use
	 * @param level the level of every entry
	 */
	public Log4jFailureReporter(Logger logger, Level level) {
		this.logger = logger;
		this.level = level;
	}

	@Override
	public void report(String operation, Exception exception) {
		logger.atLevel(level)
			.withMarker(FAILURE_MARKER)
			.log("Failure in operation [{}]: {} | type={}",
				operation,
				exception.getMessage(),
				exception.getClass().getName());
	}
}
