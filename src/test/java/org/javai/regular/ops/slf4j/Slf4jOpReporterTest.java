package org.javai.regular.ops.slf4j;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.LogEvent;
import org.javai.regular.Failure;
import org.javai.regular.ops.CapturingAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class Slf4jOpReporterTest {

	private static final String LOGGER = "org.javai.regular.ops.slf4j.Slf4jOpReporterTest";

	private CapturingAppender appender;
	private Slf4jOpReporter reporter;

	@BeforeEach
	void setUp() {
		appender = CapturingAppender.attach(LOGGER);
		reporter = new Slf4jOpReporter(LOGGER);
	}

	@AfterEach
	void tearDown() {
		appender.detach();
	}

	@Test
	void report_logsError() {
		reporter.report(Failure.task("sync", new IOException("disk full")));

		LogEvent event = appender.single();
		assertThat(event.getLevel()).isEqualTo(Level.ERROR);
		assertThat(event.getMessage().getFormattedMessage()).contains("[sync]").contains("disk full");
	}

	@Test
	void reportAlignmentWait_logsWarn() {
		reporter.reportAlignmentWait("sync", Duration.ofSeconds(42));

		LogEvent event = appender.single();
		assertThat(event.getLevel()).isEqualTo(Level.WARN);
		assertThat(event.getMessage().getFormattedMessage()).contains("42");
	}

	@Test
	void reportStopped_logsDebug() {
		reporter.reportStopped("sync");

		assertThat(appender.single().getLevel()).isEqualTo(Level.DEBUG);
	}
}
