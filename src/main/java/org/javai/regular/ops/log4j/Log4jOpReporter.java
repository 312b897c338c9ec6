package org.javai.regular.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.regular.Failure;
import org.javai.regular.FailureType;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;
import org.javai.regular.ops.OpReporter;
import org.javai.regular.ops.OpReporterUtils;

import java.time.Duration;

/**
 * Reports engine events using Log4j2.
 *
 * <p>Levels:
 * <ul>
 *   <li>task failures → ERROR ({@code DEFECT} failures include the stack trace)</li>
 *   <li>retry scheduled, waiting for the top of the minute → WARN</li>
 *   <li>continue after success, polling, window opened/closed, stopped → DEBUG</li>
 *   <li>window run ended → DEBUG when ok or cancelled, ERROR otherwise</li>
 * </ul>
 *
 * <p>Every message starts with {@code [name]} and carries one of the markers
 * {@code FAILURE}, {@code RETRY}, {@code WINDOW} or {@code LIFECYCLE}.
 */
public class Log4jOpReporter implements OpReporter {

	private static final Marker FAILURE_MARKER = MarkerManager.getMarker("FAILURE");
	private static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	private static final Marker WINDOW_MARKER = MarkerManager.getMarker("WINDOW");
	private static final Marker LIFECYCLE_MARKER = MarkerManager.getMarker("LIFECYCLE");

	private final Logger logger;

	/**
	 * Creates a Log4jOpReporter using the default logger name.
	 */
	public Log4jOpReporter() {
		this(LogManager.getLogger("org.javai.regular.Engine"));
	}

	public Log4jOpReporter(String loggerName) {
		this(LogManager.getLogger(loggerName));
	}

	public Log4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		logger.atError()
			.withMarker(FAILURE_MARKER)
			.withThrowable(failure.type() == FailureType.DEFECT ? failure.exception() : null)
			.log("[{}] Execution ends with error: {}", failure.operation(), OpReporterUtils.describe(failure));
	}

	@Override
	public void reportRetryScheduled(String name, Failure failure, int consecutiveFailures, Duration delay) {
		logger.atWarn()
			.withMarker(RETRY_MARKER)
			.log("[{}] Failure {} in a row, will continue after {}",
				name,
				consecutiveFailures,
				OpReporterUtils.millis(delay));
	}

	@Override
	public void reportContinueScheduled(String name, long invocations, Duration delay) {
		logger.atDebug()
			.withMarker(RETRY_MARKER)
			.log("[{}] Executed successfully ({} invocations), will continue after {}",
				name,
				invocations,
				OpReporterUtils.millis(delay));
	}

	@Override
	public void reportAlignmentWait(String name, Duration wait) {
		logger.atWarn()
			.withMarker(LIFECYCLE_MARKER)
			.log("[{}] The current second is not 0, waiting {}s before scheduling", name, wait.toSeconds());
	}

	@Override
	public void reportPolling(String name) {
		logger.atDebug()
			.withMarker(WINDOW_MARKER)
			.log("[{}] Looking for an open time window", name);
	}

	@Override
	public void reportWindowOpened(String name, TimeWindow window) {
		logger.atDebug()
			.withMarker(WINDOW_MARKER)
			.log("[{}] Time window {} opened", name, window);
	}

	@Override
	public void reportWindowClosed(String name, TimeWindow window) {
		logger.atDebug()
			.withMarker(WINDOW_MARKER)
			.log("[{}] Time window {} closed", name, window);
	}

	@Override
	public void reportRunEnded(String name, TimeWindow window, Outcome<Void> outcome) {
		logger.atLevel(levelFor(outcome))
			.withMarker(WINDOW_MARKER)
			.log("[{}] Execution in time window {} is over: {}", name, window, OpReporterUtils.describe(outcome));
	}

	@Override
	public void reportStopped(String name) {
		logger.atDebug()
			.withMarker(LIFECYCLE_MARKER)
			.log("[{}] Task stopped", name);
	}

	private static Level levelFor(Outcome<Void> outcome) {
		if (outcome.isOk() || outcome.failedWith(FailureType.CANCELLED)) {
			return Level.DEBUG;
		}
		return Level.ERROR;
	}
}
