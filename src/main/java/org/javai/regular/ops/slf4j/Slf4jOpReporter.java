package org.javai.regular.ops.slf4j;

import org.javai.regular.Failure;
import org.javai.regular.FailureType;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;
import org.javai.regular.ops.OpReporter;
import org.javai.regular.ops.OpReporterUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Reports engine events through SLF4J, with the same levels as
 * {@link org.javai.regular.ops.log4j.Log4jOpReporter}.
 */
public class Slf4jOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.regular.Engine";

	private final Logger logger;

	public Slf4jOpReporter() {
		this(LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	public Slf4jOpReporter(String loggerName) {
		this(LoggerFactory.getLogger(loggerName));
	}

	public Slf4jOpReporter(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		if (failure.type() == FailureType.DEFECT && failure.exception() != null) {
			logger.error("[{}] Execution ends with error: {}", failure.operation(),
				OpReporterUtils.describe(failure), failure.exception());
			return;
		}
		logger.error("[{}] Execution ends with error: {}", failure.operation(), OpReporterUtils.describe(failure));
	}

	@Override
	public void reportRetryScheduled(String name, Failure failure, int consecutiveFailures, Duration delay) {
		logger.warn("[{}] Failure {} in a row, will continue after {}",
			name, consecutiveFailures, OpReporterUtils.millis(delay));
	}

	@Override
	public void reportContinueScheduled(String name, long invocations, Duration delay) {
		logger.debug("[{}] Executed successfully ({} invocations), will continue after {}",
			name, invocations, OpReporterUtils.millis(delay));
	}

	@Override
	public void reportAlignmentWait(String name, Duration wait) {
		logger.warn("[{}] The current second is not 0, waiting {}s before scheduling", name, wait.toSeconds());
	}

	@Override
	public void reportPolling(String name) {
		logger.debug("[{}] Looking for an open time window", name);
	}

	@Override
	public void reportWindowOpened(String name, TimeWindow window) {
		logger.debug("[{}] Time window {} opened", name, window);
	}

	@Override
	public void reportWindowClosed(String name, TimeWindow window) {
		logger.debug("[{}] Time window {} closed", name, window);
	}

	@Override
	public void reportRunEnded(String name, TimeWindow window, Outcome<Void> outcome) {
		if (outcome.isOk() || outcome.failedWith(FailureType.CANCELLED)) {
			logger.debug("[{}] Execution in time window {} is over: {}", name, window, OpReporterUtils.describe(outcome));
		} else {
			logger.error("[{}] Execution in time window {} is over: {}", name, window, OpReporterUtils.describe(outcome));
		}
	}

	@Override
	public void reportStopped(String name) {
		logger.debug("[{}] Task stopped", name);
	}
}
