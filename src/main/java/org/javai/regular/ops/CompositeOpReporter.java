package org.javai.regular.ops;

import org.javai.regular.Failure;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Consumer;

/**
 * An {@link OpReporter} that delegates to multiple reporters.
 *
 * <p>All configured reporters receive every call. If a reporter throws an exception,
 * it is caught and written to stderr, and the remaining reporters still run.
 *
 * <p>Example usage:
 * <pre>{@code
 * OpReporter reporter = CompositeOpReporter.builder()
 *     .add(new Log4jOpReporter())
 *     .addIf(audit, auditReporter)
 *     .build();
 * }</pre>
 */
public final class CompositeOpReporter implements OpReporter {

	private final List<OpReporter> reporters;

	private CompositeOpReporter(List<OpReporter> reporters) {
		this.reporters = List.copyOf(reporters);
	}

	public static CompositeOpReporter of(OpReporter... reporters) {
		return new CompositeOpReporter(Arrays.asList(reporters));
	}

	public static CompositeOpReporter of(Collection<? extends OpReporter> reporters) {
		return new CompositeOpReporter(new ArrayList<>(reporters));
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public void report(Failure failure) {
		fanOut("report", r -> r.report(failure));
	}

	@Override
	public void reportRetryScheduled(String name, Failure failure, int consecutiveFailures, Duration delay) {
		fanOut("reportRetryScheduled", r -> r.reportRetryScheduled(name, failure, consecutiveFailures, delay));
	}

	@Override
	public void reportContinueScheduled(String name, long invocations, Duration delay) {
		fanOut("reportContinueScheduled", r -> r.reportContinueScheduled(name, invocations, delay));
	}

	@Override
	public void reportAlignmentWait(String name, Duration wait) {
		fanOut("reportAlignmentWait", r -> r.reportAlignmentWait(name, wait));
	}

	@Override
	public void reportPolling(String name) {
		fanOut("reportPolling", r -> r.reportPolling(name));
	}

	@Override
	public void reportWindowOpened(String name, TimeWindow window) {
		fanOut("reportWindowOpened", r -> r.reportWindowOpened(name, window));
	}

	@Override
	public void reportWindowClosed(String name, TimeWindow window) {
		fanOut("reportWindowClosed", r -> r.reportWindowClosed(name, window));
	}

	@Override
	public void reportRunEnded(String name, TimeWindow window, Outcome<Void> outcome) {
		fanOut("reportRunEnded", r -> r.reportRunEnded(name, window, outcome));
	}

	@Override
	public void reportStopped(String name) {
		fanOut("reportStopped", r -> r.reportStopped(name));
	}

	/**
	 * Returns the number of reporters in this composite.
	 */
	public int size() {
		return reporters.size();
	}

	private void fanOut(String method, Consumer<OpReporter> call) {
		for (OpReporter reporter : reporters) {
			try {
				call.accept(reporter);
			} catch (Exception e) {
				System.err.println("OpReporter." + method + " failed for " +
					reporter.getClass().getName() + ": " + e.getMessage());
			}
		}
	}

	/**
	 * Builder for creating a {@link CompositeOpReporter}.
	 */
	public static final class Builder {
		private final List<OpReporter> reporters = new ArrayList<>();

		private Builder() {}

		/**
		 * Adds a reporter; null is ignored.
		 */
		public Builder add(OpReporter reporter) {
			if (reporter != null) {
				reporters.add(reporter);
			}
			return this;
		}

		public Builder addIf(boolean condition, OpReporter reporter) {
			if (condition) {
				add(reporter);
			}
			return this;
		}

		public CompositeOpReporter build() {
			return new CompositeOpReporter(reporters);
		}
	}
}
