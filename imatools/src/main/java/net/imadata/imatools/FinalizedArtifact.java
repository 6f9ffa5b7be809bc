package net.imadata.imatools;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The compressed, content-addressed metadata file and the values repomd.xml records about it.
 */
public final class FinalizedArtifact {
    private final Path file;
    private final String baseName;
    private final String checksum;
    private final String openChecksum;
    private final long size;
    private final long openSize;
    private final long timestamp;

    public FinalizedArtifact(Path file, String baseName, String checksum, String openChecksum, long size, long openSize, long timestamp) {
        this.file = Objects.requireNonNull(file, "file");
        this.baseName = Objects.requireNonNull(baseName, "baseName");
        this.checksum = Objects.requireNonNull(checksum, "checksum");
        this.openChecksum = Objects.requireNonNull(openChecksum, "openChecksum");
        this.size = size;
        this.openSize = openSize;
        this.timestamp = timestamp;
    }

    /**
     * @return the renamed compressed file
     */
    public Path getFile() {
        return file;
    }

    /**
     * @return the name of the compressed file before the checksum was prepended, e.g. {@code imadata.xml.gz}
     */
    public String getBaseName() {
        return baseName;
    }

    /**
     * @return checksum of the compressed file
     */
    public String getChecksum() {
        return checksum;
    }

    /**
     * @return checksum of the uncompressed document
     */
    public String getOpenChecksum() {
        return openChecksum;
    }

    public long getSize() {
        return size;
    }

    public long getOpenSize() {
        return openSize;
    }

    /**
     * @return creation time of the compressed file, in seconds since the epoch
     */
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return file.getFileName() + " (" + size + " bytes, " + openSize + " uncompressed)";
    }
}
