package net.imadata.cliutils.progress;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

public class TestProgressReporter {

    @Test
    void testStep() {
        TestSuite suite = new TestSuite(true);
        suite.reporter.setStep("Extracting IMA digests");
        assertThat(suite.lines()).containsExactly("\033[progressmanager;s Extracting IMA digests");
    }

    @Test
    void testProgressAndMaxProgress() {
        TestSuite suite = new TestSuite(true);
        suite.reporter.setMaxProgress(10);
        suite.reporter.setProgress(3);
        suite.reporter.setIndeterminate(false);
        assertThat(suite.lines()).containsExactly(
                "\033[progressmanager;m 10",
                "\033[progressmanager;p 3",
                "\033[progressmanager;i false"
        );
    }

    @Test
    void testDisabledReporterWritesNothing() {
        TestSuite suite = new TestSuite(false);
        suite.reporter.setStep("Doing stuff");
        suite.reporter.setProgress(1);
        assertThat(suite.buffer.size()).isZero();
    }

    private static class TestSuite {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final ProgressReporter reporter;

        TestSuite(boolean enabled) {
            reporter = new ProgressReporter(enabled, new PrintStream(buffer, true));
        }

        String[] lines() {
            return new String(buffer.toByteArray(), StandardCharsets.UTF_8).split("\\R");
        }
    }
}
