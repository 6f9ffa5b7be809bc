package net.imadata.imatools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ArtifactFinalizerTest {
    private static final String CONTENT = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<imadata packages=\"0\">\n</imadata>";

    @TempDir
    Path tempDir;

    @Test
    void testCompressesAndRenames() throws IOException {
        Path document = tempDir.resolve("imadata.xml");
        byte[] content = CONTENT.getBytes(StandardCharsets.UTF_8);
        Files.write(document, content);

        FinalizedArtifact artifact = ArtifactFinalizer.finalizeDocument(document);

        assertThat(document).doesNotExist();
        assertThat(tempDir.resolve("imadata.xml.gz")).doesNotExist();
        assertThat(artifact.getFile()).exists().hasParent(tempDir);
        assertThat(artifact.getFile().getFileName().toString()).isEqualTo(artifact.getChecksum() + "-imadata.xml.gz");
        assertThat(artifact.getBaseName()).isEqualTo("imadata.xml.gz");

        assertThat(artifact.getOpenChecksum()).isEqualTo(HashFunction.SHA256.hash(content));
        assertThat(artifact.getOpenSize()).isEqualTo(content.length);
        assertThat(artifact.getChecksum()).isEqualTo(HashFunction.SHA256.hash(artifact.getFile())).hasSize(64);
        assertThat(artifact.getSize()).isEqualTo(Files.size(artifact.getFile()));
        assertThat(artifact.getTimestamp()).isPositive();

        assertThat(gunzip(artifact.getFile())).isEqualTo(content);
    }

    @Test
    void testGzipHeaderCarriesTimestamp() throws IOException {
        Path document = tempDir.resolve("imadata.xml");
        Files.write(document, CONTENT.getBytes(StandardCharsets.UTF_8));

        byte[] compressed = Files.readAllBytes(ArtifactFinalizer.finalizeDocument(document).getFile());

        long mtime = (compressed[4] & 0xFFL)
                | (compressed[5] & 0xFFL) << 8
                | (compressed[6] & 0xFFL) << 16
                | (compressed[7] & 0xFFL) << 24;
        assertThat(mtime).isGreaterThan(0L);
    }

    private static byte[] gunzip(Path file) throws IOException {
        try (InputStream in = new GZIPInputStream(Files.newInputStream(file))) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            byte[] buffer = new byte[4096];
            int length;
            while ((length = in.read(buffer)) != -1) {
                out.write(buffer, 0, length);
            }
            return out.toByteArray();
        }
    }
}
