package org.javai.regular.ops;

import org.javai.regular.Failure;
import org.javai.regular.Outcome;
import org.javai.regular.TimeWindow;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CompositeOpReporterTest {

    private static final TimeWindow WINDOW = new TimeWindow(9, 0, 17, 0);

    @Test
    void fansOutEveryEventToAllReporters() {
        RecordingOpReporter first = new RecordingOpReporter();
        RecordingOpReporter second = new RecordingOpReporter();
        OpReporter composite = OpReporter.composite(first, second);
        Failure failure = Failure.task("sync", new IOException("disk full"));

        composite.report(failure);
        composite.reportRetryScheduled("sync", failure, 2, Duration.ofSeconds(1));
        composite.reportContinueScheduled("sync", 3, Duration.ZERO);
        composite.reportAlignmentWait("sync", Duration.ofSeconds(12));
        composite.reportWindowOpened("sync", WINDOW);
        composite.reportWindowClosed("sync", WINDOW);
        composite.reportRunEnded("sync", WINDOW, Outcome.ok());
        composite.reportStopped("sync");

        for (RecordingOpReporter reporter : List.of(first, second)) {
            assertThat(reporter.failures).containsExactly(failure);
            assertThat(reporter.retries).containsExactly(
                    new RecordingOpReporter.RetryScheduled("sync", failure, 2, Duration.ofSeconds(1)));
            assertThat(reporter.continues).containsExactly(
                    new RecordingOpReporter.ContinueScheduled("sync", 3, Duration.ZERO));
            assertThat(reporter.alignmentWaits).containsExactly(Duration.ofSeconds(12));
            assertThat(reporter.opened).containsExactly(WINDOW);
            assertThat(reporter.closed).containsExactly(WINDOW);
            assertThat(reporter.runsEnded).hasSize(1);
            assertThat(reporter.stopped).containsExactly("sync");
        }
    }

    @Test
    void throwingReporter_doesNotStopOthers() {
        List<Failure> received = new ArrayList<>();
        OpReporter broken = failure -> {
            throw new IllegalStateException("appender closed");
        };
        OpReporter composite = CompositeOpReporter.of(broken, received::add);

        assertThatCode(() -> composite.report(Failure.defect("sync", new NullPointerException())))
                .doesNotThrowAnyException();
        assertThat(received).hasSize(1);
    }

    @Test
    void builder_ignoresNullAndHonoursCondition() {
        RecordingOpReporter included = new RecordingOpReporter();
        RecordingOpReporter excluded = new RecordingOpReporter();

        CompositeOpReporter composite = CompositeOpReporter.builder()
                .add(null)
                .add(included)
                .addIf(false, excluded)
                .addIf(true, OpReporter.noOp())
                .build();

        assertThat(composite.size()).isEqualTo(2);
        composite.reportStopped("sync");
        assertThat(included.stopped).containsExactly("sync");
        assertThat(excluded.stopped).isEmpty();
    }

    @Test
    void of_collection_copiesReporters() {
        List<OpReporter> reporters = new ArrayList<>(List.of(OpReporter.noOp()));
        CompositeOpReporter composite = CompositeOpReporter.of(reporters);

        reporters.add(OpReporter.noOp());

        assertThat(composite.size()).isEqualTo(1);
    }
}
