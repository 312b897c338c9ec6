package org.javai.regular.ops;

import org.javai.regular.Failure;
import org.javai.regular.Outcome;

import java.time.Duration;

/**
 * Shared utilities for OpReporter implementations and configuration lookup.
 */
public final class OpReporterUtils {

	private OpReporterUtils() {
		// Utility class
	}

	/**
	 * Resolves configuration from system property or environment variable.
	 *
	 * @param sysProp the system property name
	 * @param envVar the environment variable name
	 * @return the resolved value
	 * @throws IllegalStateException if neither is set
	 */
	public static String resolveConfig(String sysProp, String envVar) {
		String value = System.getProperty(sysProp);
		if (value == null || value.isBlank()) {
			value = System.getenv(envVar);
		}
		if (value == null || value.isBlank()) {
			throw new IllegalStateException(
				"Missing required configuration: set system property '" + sysProp +
				"' or environment variable '" + envVar + "'"
			);
		}
		return value;
	}

	/**
	 * Formats a failure for a single log line: {@code "task:failed (TASK) disk full"}.
	 */
	public static String describe(Failure failure) {
		return failure.id() + " (" + failure.type() + ") " + failure.message();
	}

	/**
	 * Formats a run loop outcome for a single log line.
	 */
	public static String describe(Outcome<Void> outcome) {
		if (outcome instanceof Outcome.Fail<Void> fail) {
			return describe(fail.failure());
		}
		return "ok";
	}

	/**
	 * Formats a delay the way the engine logs it: {@code "1500ms"}.
	 */
	public static String millis(Duration delay) {
		return delay.toMillis() + "ms";
	}
}
