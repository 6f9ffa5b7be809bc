package net.imadata.imatools;

import net.imadata.imatools.rpm.RpmFile;
import net.imadata.imatools.rpm.RpmHeader;
import net.imadata.imatools.rpm.RpmHeaderReader;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one package file into a {@link PackageRecord}, keeping only the files that carry a real digest.
 */
public class DigestExtractor {
    /**
     * Digest reported for files that have no measurement.
     */
    public static final String NO_DIGEST = "0000000000000000000000000000000000000000000000000000000000000000";

    private final PackageHeaderReader headerReader;

    public DigestExtractor() {
        this(new RpmHeaderReader());
    }

    public DigestExtractor(PackageHeaderReader headerReader) {
        this.headerReader = headerReader;
    }

    public PackageRecord extract(Path packageFile) throws ExtractionException {
        try {
            return toRecord(headerReader.read(packageFile));
        } catch (IOException | RuntimeException e) {
            throw new ExtractionException(packageFile, e);
        }
    }

    private static PackageRecord toRecord(RpmHeader header) {
        List<PackageRecord.FileDigest> files = new ArrayList<>(header.getFiles().size());
        for (RpmFile file : header.getFiles()) {
            if (!isPlaceholder(file.getDigest())) {
                files.add(new PackageRecord.FileDigest(file.getPath(), file.getDigest()));
            }
        }

        return new PackageRecord(
                header.getName(),
                header.getArch(),
                header.isSourcePackage(),
                header.getEpoch(),
                header.getVersion(),
                header.getRelease(),
                files,
                header.getFiles().size() - files.size()
        );
    }

    /**
     * {@link #NO_DIGEST}, or the all-zero digest of any other length, marks a file without measurement.
     */
    static boolean isPlaceholder(String digest) {
        if (NO_DIGEST.equals(digest)) {
            return true;
        }
        for (int i = 0; i < digest.length(); i++) {
            if (digest.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }
}
