package net.imadata.imatools;

import net.imadata.cliutils.progress.ProgressManager;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Finds every package below a repository root and extracts all of them on a fixed number of worker threads.
 * Either every package is extracted, or the scan fails with the first extraction error.
 */
public class RepositoryScanner {
    public static final String PACKAGE_EXTENSION = ".rpm";

    private final DigestExtractor extractor;
    private final ProgressManager progress;
    private final Consumer<String> debug;

    public RepositoryScanner(DigestExtractor extractor) {
        this(extractor, ProgressManager.NOOP, message -> {
        });
    }

    public RepositoryScanner(DigestExtractor extractor, ProgressManager progress, Consumer<String> debug) {
        this.extractor = extractor;
        this.progress = progress;
        this.debug = debug;
    }

    /**
     * @return the package files below {@code repository}, sorted by path
     */
    public static List<Path> findPackages(Path repository) throws IOException {
        if (!Files.exists(repository)) {
            throw new NoSuchFileException(repository.toString(), null, "Repository does not exist");
        }
        if (!Files.isDirectory(repository)) {
            throw new NotDirectoryException(repository.toString());
        }

        try (Stream<Path> files = Files.walk(repository)) {
            return files
                    .filter(path -> path.toString().endsWith(PACKAGE_EXTENSION))
                    .filter(Files::isRegularFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    /**
     * Extracts all packages below {@code repository} using up to {@code parallelism} threads.
     * The returned records are in the order of {@link #findPackages(Path)}.
     */
    public List<PackageRecord> scan(Path repository, int parallelism) throws IOException {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be at least 1: " + parallelism);
        }

        progress.setStep("Discovering packages");
        progress.setIndeterminate(true);
        List<Path> packages = findPackages(repository);
        debug.accept("Found " + packages.size() + " packages in " + repository);

        progress.setIndeterminate(false);
        progress.setStep("Extracting IMA digests");
        progress.setMaxProgress(packages.size());
        progress.setProgress(0);

        if (packages.isEmpty()) {
            return new ArrayList<>();
        }

        PackageRecord[] records = new PackageRecord[packages.size()];
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(parallelism, packages.size()), new WorkerThreadFactory());
        try {
            CompletionService<IndexedRecord> completion = new ExecutorCompletionService<>(executor);
            for (int i = 0; i < packages.size(); i++) {
                int index = i;
                Path packageFile = packages.get(i);
                completion.submit(() -> new IndexedRecord(index, extractor.extract(packageFile)));
            }

            for (int done = 1; done <= records.length; done++) {
                IndexedRecord result;
                try {
                    result = completion.take().get();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Interrupted while waiting for package extraction.", e);
                } catch (ExecutionException e) {
                    throw unwrap(e);
                }
                records[result.index] = result.record;
                progress.setProgress(done);
                debug.accept("  " + result.record);
            }
        } finally {
            // Cancels everything still queued or running if an extraction failed
            executor.shutdownNow();
        }

        return new ArrayList<>(Arrays.asList(records));
    }

    private static IOException unwrap(ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof IOException) {
            return (IOException) cause;
        }
        if (cause instanceof RuntimeException) {
            throw (RuntimeException) cause;
        }
        if (cause instanceof Error) {
            throw (Error) cause;
        }
        return new IOException("An off-thread extraction failed.", cause);
    }

    private static final class IndexedRecord {
        private final int index;
        private final PackageRecord record;

        private IndexedRecord(int index, PackageRecord record) {
            this.index = index;
            this.record = record;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "imatools-extract-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
