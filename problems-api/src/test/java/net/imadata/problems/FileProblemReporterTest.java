package net.imadata.problems;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileProblemReporterTest {
    private static final ProblemId BROKEN = ProblemId.create("test/broken", "Broken");

    @TempDir
    Path tempDir;

    @Test
    void testWritesAllReportedProblems() throws Exception {
        Path report = tempDir.resolve("reports/problems.json");
        Problem withLocation = Problem.builder(BROKEN)
                .severity(ProblemSeverity.ERROR)
                .inFileAtOffset(tempDir.resolve("a.rpm"), 96)
                .contextualLabel("Bad header magic")
                .details("Expected 8eade801")
                .solution("Rebuild the package")
                .build();

        try (FileProblemReporter reporter = new FileProblemReporter(report)) {
            reporter.report(withLocation);
            reporter.report(BROKEN, ProblemSeverity.ADVICE, "Nothing to see");
            assertThat(reporter.getProblems()).hasSize(2).first().isEqualTo(withLocation);
        }

        List<Problem> loaded = FileProblemReporter.loadRecords(report);
        assertThat(loaded).hasSize(2);
        assertThat(loaded.get(0)).isEqualTo(withLocation);
        assertThat(loaded.get(1).severity()).isEqualTo(ProblemSeverity.ADVICE);
        assertThat(loaded.get(1).location()).isNull();
        assertThat(loaded.get(1).contextualLabel()).isEqualTo("Nothing to see");
    }

    @Test
    void testEmptyReportIsEmptyArray() throws Exception {
        Path report = tempDir.resolve("problems.json");
        new FileProblemReporter(report).close();

        assertThat(FileProblemReporter.loadRecords(report)).isEmpty();
    }

    @Test
    void testToStringIncludesSeverityAndLocation() {
        Problem problem = Problem.builder(BROKEN)
                .severity(ProblemSeverity.ERROR)
                .inFile(tempDir.resolve("repomd.xml"))
                .contextualLabel("Duplicate")
                .build();

        assertThat(problem.toString())
                .startsWith("[ERROR] test/broken: Duplicate @ ")
                .endsWith("repomd.xml");
    }

    @Test
    void testNegativeOffsetIsRejected() {
        assertThatThrownBy(() -> ProblemLocation.ofOffsetInFile(tempDir, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
