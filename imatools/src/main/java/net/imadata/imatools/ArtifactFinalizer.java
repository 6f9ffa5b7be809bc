package net.imadata.imatools;

import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipParameters;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.concurrent.TimeUnit;
import java.util.zip.Deflater;

/**
 * Compresses the metadata document and names the result after its own checksum.
 */
public final class ArtifactFinalizer {
    public static final String COMPRESSED_EXTENSION = ".gz";

    private ArtifactFinalizer() {
    }

    /**
     * Replaces {@code document} with {@code <checksum>-<name>.gz} in the same directory.
     * <p>
     * The gzip header records the compression time, so compressing the same document twice gives two different
     * checksums.
     */
    public static FinalizedArtifact finalizeDocument(Path document) throws IOException {
        String openChecksum = HashFunction.SHA256.hash(document);
        long openSize = Files.size(document);

        Path compressed = document.resolveSibling(document.getFileName() + COMPRESSED_EXTENSION);
        compress(document, compressed);
        Files.delete(document);

        String checksum = HashFunction.SHA256.hash(compressed);
        long size = Files.size(compressed);
        long timestamp = Files.readAttributes(compressed, BasicFileAttributes.class).creationTime().to(TimeUnit.SECONDS);

        String baseName = compressed.getFileName().toString();
        Path renamed = Files.move(compressed, compressed.resolveSibling(checksum + "-" + baseName), StandardCopyOption.REPLACE_EXISTING);

        return new FinalizedArtifact(renamed, baseName, checksum, openChecksum, size, openSize, timestamp);
    }

    static void compress(Path source, Path target) throws IOException {
        GzipParameters parameters = new GzipParameters();
        parameters.setCompressionLevel(Deflater.BEST_COMPRESSION);
        parameters.setModificationTime(System.currentTimeMillis());
        parameters.setFilename(source.getFileName().toString());

        try (OutputStream out = new GzipCompressorOutputStream(new BufferedOutputStream(Files.newOutputStream(target)), parameters)) {
            Files.copy(source, out);
        }
    }
}
