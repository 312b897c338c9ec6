package org.javai.regular.ops.log4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.javai.regular.Failure;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;
import org.javai.regular.ops.CapturingAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class Log4jOpReporterTest {

	private static final String LOGGER = "org.javai.regular.ops.log4j.Log4jOpReporterTest";
	private static final TimeWindow WINDOW = new TimeWindow(22, 0, 6, 0);

	private CapturingAppender appender;
	private Log4jOpReporter reporter;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attach(LOGGER);
		reporter = new Log4jOpReporter(LOGGER);
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void report_taskFailure_logsErrorWithoutStackTrace() {
		reporter.report(Failure.task("sync", new IOException("disk full")));

		LogEvent event = appender.single();
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMarker().getName()).isEqualTo("FAILURE");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("[sync] Execution ends with error: task:failed (TASK) disk full");
		assertThat(event.getThrown()).isNull();
	}

	@Test
	void report_defect_includesStackTrace() {
		NullPointerException npe = new NullPointerException("config was null");

		reporter.report(Failure.defect("sync", npe));

		assertThat(appender.single().getThrown()).isSameAs(npe);
	}

	@Test
	void reportRetryScheduled_logsWarnWithCountAndDelay() {
		reporter.reportRetryScheduled("sync", Failure.task("sync", new IOException()), 3, Duration.ofMillis(1500));

		LogEvent event = appender.single();
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMarker().getName()).isEqualTo("RETRY");
		assertThat(event.getMessage().getFormattedMessage())
				.isEqualTo("[sync] Failure 3 in a row, will continue after 1500ms");
	}

	@Test
	void reportWindowEvents_logDebugWithWindow() {
		reporter.reportWindowOpened("sync", WINDOW);
		reporter.reportWindowClosed("sync", WINDOW);

		assertThat(appender.events).extracting(e -> e.getMessage().getFormattedMessage())
				.containsExactly("[sync] Time window 22:00-06:00 opened", "[sync] Time window 22:00-06:00 closed");
		assertThat(appender.events).allSatisfy(e -> assertThat(e.getLevel()).isEqualTo(Level.DEBUG));
	}

	@Test
	void reportRunEnded_levelDependsOnOutcome() {
		reporter.reportRunEnded("sync", WINDOW, Outcome.ok());
		reporter.reportRunEnded("sync", WINDOW, Outcome.fail(Failure.cancelled("sync")));
		reporter.reportRunEnded("sync", WINDOW, Outcome.fail(Failure.task("sync", new IOException("gone"))));

		assertThat(appender.events).extracting(LogEvent::getLevel)
				.containsExactly(Level.DEBUG, Level.DEBUG, Level.ERROR);
	}
}
