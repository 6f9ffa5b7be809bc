package net.imadata.imatools;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The header of a package could not be read. A single failed package fails the whole run.
 */
public class ExtractionException extends IOException {
    private final Path packageFile;

    public ExtractionException(Path packageFile, Throwable cause) {
        super("Failed to read package header of " + packageFile + ": " + cause.getMessage(), cause);
        this.packageFile = packageFile;
    }

    public Path getPackageFile() {
        return packageFile;
    }
}
