package net.imadata.imatools;

import net.imadata.imatools.rpm.RpmHeader;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Reads the identity and file digest table from the header of a package file.
 * Implementations must release every file handle they open before returning.
 */
@FunctionalInterface
public interface PackageHeaderReader {
    RpmHeader read(Path packageFile) throws IOException;
}
