package net.imadata.imatools;

import joptsimple.NonOptionArgumentSpec;
import joptsimple.OptionException;
import joptsimple.OptionParser;
import joptsimple.OptionSet;
import joptsimple.OptionSpec;
import net.imadata.cliutils.progress.ProgressReporter;
import net.imadata.imatools.rpm.RpmFormatException;
import net.imadata.problems.FileProblemReporter;
import net.imadata.problems.Problem;
import net.imadata.problems.ProblemId;
import net.imadata.problems.ProblemReporter;
import net.imadata.problems.ProblemSeverity;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Expands the metadata of an RPM repository with the IMA digests of every packaged file.
 * <p>
 * Writes {@code repodata/imadata.xml}. With {@code --modify}, the document is compressed and registered in
 * {@code repodata/repomd.xml}.
 */
public class ConsoleTool {
    public static final boolean DEBUG = Boolean.getBoolean("net.imadata.imatools.debug");

    static final ProblemId EXTRACTION_FAILED = ProblemId.create("imatools/extraction-failed", "Package header could not be read");
    static final ProblemId DUPLICATE_ENTRY = ProblemId.create("imatools/duplicate-entry", "IMA metadata already registered");
    static final ProblemId IO_FAILURE = ProblemId.create("imatools/io-failure", "I/O failure");
    static final ProblemId NO_FILE_DIGESTS = ProblemId.create("imatools/no-file-digests", "Package has no IMA file digests");

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * @return the process exit status
     */
    static int run(String[] args) {
        OptionParser parser = new OptionParser();
        OptionSpec<Integer> jobsO = parser.acceptsAll(Arrays.asList("j", "jobs"), "Allow N jobs at once, defaults to the number of CPUs")
                .withRequiredArg().ofType(Integer.class).describedAs("N")
                .defaultsTo(Runtime.getRuntime().availableProcessors());
        OptionSpec<Void> modifyO = parser.acceptsAll(Arrays.asList("m", "modify"), "Compress imadata.xml and register it in repodata/repomd.xml");
        OptionSpec<File> problemsReportO = parser.accepts("problems-report", "Write the problems found to this JSON file")
                .withRequiredArg().ofType(File.class);
        OptionSpec<Void> helpO = parser.acceptsAll(Arrays.asList("?", "help"), "Show this help").forHelp();
        NonOptionArgumentSpec<File> repositoryO = parser.nonOptions("Path of the repository").ofType(File.class).describedAs("REPO");

        OptionSet options;
        try {
            options = parser.parse(args);
        } catch (OptionException e) {
            System.err.println(e.getMessage());
            printHelp(parser);
            return 1;
        }

        if (options.has(helpO)) {
            printHelp(parser);
            return 0;
        }

        List<File> repositories = options.valuesOf(repositoryO);
        if (repositories.size() != 1) {
            System.err.println("Exactly one repository path must be given.");
            printHelp(parser);
            return 1;
        }
        int jobs = options.valueOf(jobsO);
        if (jobs < 1) {
            System.err.println("--jobs must be at least 1: " + jobs);
            return 1;
        }

        Path repository = repositories.get(0).toPath().toAbsolutePath();
        File problemsReport = options.valueOf(problemsReportO);
        if (problemsReport == null) {
            return process(repository, jobs, options.has(modifyO), ProblemReporter.NOOP);
        }

        int status;
        // The report is written when the reporter is closed, whatever the outcome of the run
        try (FileProblemReporter reporter = new FileProblemReporter(problemsReport.toPath())) {
            status = process(repository, jobs, options.has(modifyO), reporter);
            debug("Writing " + reporter.getProblems().size() + " problems to " + problemsReport);
        } catch (IOException e) {
            System.err.println("ERROR: Failed to write problems report " + problemsReport + ": " + e);
            return 1;
        }
        return status;
    }

    private static int process(Path repository, int jobs, boolean modify, ProblemReporter reporter) {
        long start = System.nanoTime();

        log("Generating IMA metadata: ");
        log("  Repository: " + repository);
        log("  Jobs:       " + jobs);
        log("  Register:   " + modify);

        try {
            RepositoryScanner scanner = new RepositoryScanner(new DigestExtractor(), ProgressReporter.getDefault(), ConsoleTool::debug);
            List<PackageRecord> records = scanner.scan(repository, jobs);
            log("Read " + records.size() + " packages");
            for (PackageRecord record : records) {
                if (record.lacksFileDigests()) {
                    debug("No IMA digests in " + record);
                    reporter.report(NO_FILE_DIGESTS, ProblemSeverity.WARNING, record.toString());
                }
            }

            Path imadata = ImadataWriter.write(repository, records);
            log("Wrote " + imadata);

            if (modify) {
                FinalizedArtifact artifact = ArtifactFinalizer.finalizeDocument(imadata);
                log("Compressed to " + artifact);
                RepomdPatcher.register(repository, artifact);
                log("Registered " + RepomdPatcher.DATA_TYPE + " in " + RepomdPatcher.getRepomdFile(repository));
            }
        } catch (ExtractionException e) {
            Problem.Builder problem = Problem.builder(EXTRACTION_FAILED)
                    .severity(ProblemSeverity.ERROR)
                    .contextualLabel(e.getMessage())
                    .details(String.valueOf(e.getCause()));
            if (e.getCause() instanceof RpmFormatException) {
                problem.inFileAtOffset(e.getPackageFile(), ((RpmFormatException) e.getCause()).getOffset());
            } else {
                problem.inFile(e.getPackageFile());
            }
            reporter.report(problem.build());
            return fail(e);
        } catch (DuplicateEntryException e) {
            reporter.report(Problem.builder(DUPLICATE_ENTRY)
                    .severity(ProblemSeverity.ERROR)
                    .inFile(e.getIndexFile())
                    .contextualLabel(e.getMessage())
                    .solution("Remove the existing " + e.getType() + " entry and its file, then run again")
                    .build());
            return fail(e);
        } catch (IOException | UncheckedIOException e) {
            reporter.report(IO_FAILURE, ProblemSeverity.ERROR, String.valueOf(e.getMessage()));
            return fail(e);
        }

        logElapsed("overall work", start);
        return 0;
    }

    private static int fail(Exception e) {
        System.err.println("ERROR: " + e.getMessage());
        if (DEBUG) {
            e.printStackTrace();
        }
        return 1;
    }

    private static void printHelp(OptionParser parser) {
        try {
            parser.printHelpOn(System.out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void logElapsed(String what, long startNanos) {
        debug("Finished " + what + " in " + (System.nanoTime() - startNanos) / 1_000_000 + "ms");
    }

    public static void log(String message) {
        System.out.println(message);
    }

    public static void debug(String message) {
        if (DEBUG) {
            log(message);
        }
    }
}
