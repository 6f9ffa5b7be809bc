package net.imadata.imatools.rpm;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RpmHeaderReaderTest {
    private static final String DIGEST_A = "1111111111111111111111111111111111111111111111111111111111111111";
    private static final String DIGEST_B = "2222222222222222222222222222222222222222222222222222222222222222";

    @TempDir
    Path tempDir;

    private final RpmHeaderReader reader = new RpmHeaderReader();

    @Test
    void testReadsIdentityAndFiles() throws IOException {
        Path rpm = RpmPackageFixture.builder("bash", "5.2.15", "3.fc39")
                .arch("x86_64")
                .epoch(1)
                .file("/usr/bin/bash", DIGEST_A)
                .file("/usr/share/doc/bash", "")
                .file("/usr/bin/sh", DIGEST_B)
                .writeTo(tempDir.resolve("bash.rpm"));

        RpmHeader header = reader.read(rpm);

        assertThat(header.getName()).isEqualTo("bash");
        assertThat(header.getVersion()).isEqualTo("5.2.15");
        assertThat(header.getRelease()).isEqualTo("3.fc39");
        assertThat(header.getArch()).isEqualTo("x86_64");
        assertThat(header.getEpoch()).isEqualTo(1);
        assertThat(header.isSourcePackage()).isFalse();
        assertThat(header.getDigestAlgorithm()).isEqualTo(DigestAlgorithm.SHA256);
        assertThat(header.getFiles()).containsExactly(
                new RpmFile("/usr/bin/bash", DIGEST_A),
                new RpmFile("/usr/share/doc/bash", RpmPackageFixture.ZERO_DIGEST),
                new RpmFile("/usr/bin/sh", DIGEST_B)
        );
    }

    @Test
    void testReadsLegacyFileNames() throws IOException {
        Path rpm = RpmPackageFixture.builder("legacy", "1.0", "1")
                .oldFileNames()
                .file("/etc/legacy.conf", DIGEST_A)
                .file("/usr/lib/legacy.so", DIGEST_B)
                .writeTo(tempDir.resolve("legacy.rpm"));

        assertThat(reader.read(rpm).getFiles()).extracting(RpmFile::getPath)
                .containsExactly("/etc/legacy.conf", "/usr/lib/legacy.so");
    }

    @Test
    void testMissingOptionalTags() throws IOException {
        Path rpm = RpmPackageFixture.builder("empty", "0.1", "0")
                .arch(null)
                .digestAlgorithm(null)
                .writeTo(tempDir.resolve("empty.rpm"));

        RpmHeader header = reader.read(rpm);

        assertThat(header.getEpoch()).isNull();
        assertThat(header.getArch()).isEmpty();
        assertThat(header.getDigestAlgorithm()).isEqualTo(DigestAlgorithm.MD5);
        assertThat(header.getFiles()).isEmpty();
    }

    @Test
    void testPlaceholderMatchesDigestAlgorithm() throws IOException {
        Path rpm = RpmPackageFixture.builder("old", "1.0", "1")
                .digestAlgorithm(null)
                .withoutDigests()
                .file("/usr/bin/old", "")
                .writeTo(tempDir.resolve("old.rpm"));

        assertThat(reader.read(rpm).getFiles()).containsExactly(new RpmFile("/usr/bin/old", "00000000000000000000000000000000"));
    }

    @Test
    void testSourcePackage() throws IOException {
        Path tagged = RpmPackageFixture.builder("tagged", "1.0", "1").source().writeTo(tempDir.resolve("tagged.src.rpm"));
        Path leadOnly = RpmPackageFixture.builder("lead", "1.0", "1").sourceLeadOnly().writeTo(tempDir.resolve("lead.src.rpm"));

        assertThat(reader.read(tagged).isSourcePackage()).isTrue();
        assertThat(reader.read(leadOnly).isSourcePackage()).isTrue();
    }

    @Test
    void testPayloadIsNotRead() throws IOException {
        Path rpm = RpmPackageFixture.builder("nopayload", "1.0", "1")
                .file("/bin/true", DIGEST_A)
                .withoutPayload()
                .writeTo(tempDir.resolve("nopayload.rpm"));

        assertThat(reader.read(rpm).getFiles()).hasSize(1);
    }

    @Test
    void testRejectsNonRpmFile() throws IOException {
        Path file = tempDir.resolve("fake.rpm");
        byte[] content = new byte[200];
        Arrays.fill(content, (byte) 'x');
        Files.write(file, content);

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(RpmFormatException.class)
                .hasMessageContaining("Bad lead magic")
                .extracting(e -> ((RpmFormatException) e).getOffset())
                .isEqualTo(0L);
    }

    @Test
    void testRejectsTruncatedHeader() throws IOException {
        byte[] complete = RpmPackageFixture.builder("cut", "1.0", "1")
                .file("/bin/cut", DIGEST_A)
                .withoutPayload()
                .toByteArray();
        Path file = tempDir.resolve("cut.rpm");
        Files.write(file, Arrays.copyOf(complete, complete.length - 10));

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(RpmFormatException.class)
                .hasMessageContaining("Unexpected end of file");
    }

    @Test
    void testRejectsBadHeaderMagic() throws IOException {
        byte[] content = RpmPackageFixture.builder("magic", "1.0", "1").toByteArray();
        // The main header starts after the lead and the padded signature (16 + 16 + 4 bytes, padded to 40)
        int headerStart = RpmHeaderReader.LEAD_SIZE + 40;
        content[headerStart] = 0;
        Path file = tempDir.resolve("magic.rpm");
        Files.write(file, content);

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(RpmFormatException.class)
                .hasMessageContaining("Bad header magic")
                .extracting(e -> ((RpmFormatException) e).getOffset())
                .isEqualTo((long) headerStart);
    }

    @Test
    void testRejectsDigestTableOfWrongLength() throws IOException {
        RpmPackageFixture.HeaderBuilder header = new RpmPackageFixture.HeaderBuilder()
                .string(RpmTag.NAME, "broken")
                .string(RpmTag.VERSION, "1")
                .string(RpmTag.RELEASE, "1")
                .stringArray(RpmTag.OLDFILENAMES, Arrays.asList("/a", "/b"))
                .stringArray(RpmTag.FILEDIGESTS, Arrays.asList(DIGEST_A));
        Path file = writeWithHeader("broken.rpm", header);

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(RpmFormatException.class)
                .hasMessageContaining("1 entries for 2 files");
    }

    @Test
    void testRejectsMissingName() throws IOException {
        RpmPackageFixture.HeaderBuilder header = new RpmPackageFixture.HeaderBuilder()
                .string(RpmTag.VERSION, "1")
                .string(RpmTag.RELEASE, "1");
        Path file = writeWithHeader("noname.rpm", header);

        assertThatThrownBy(() -> reader.read(file))
                .isInstanceOf(RpmFormatException.class)
                .hasMessageContaining("Missing required tag NAME");
    }

    @Test
    void testRejectsNegativeEpoch() throws IOException {
        Path rpm = RpmPackageFixture.builder("negative", "1.0", "1").epoch(-1).writeTo(tempDir.resolve("negative.rpm"));

        assertThatThrownBy(() -> reader.read(rpm))
                .isInstanceOf(RpmFormatException.class)
                .hasMessageContaining("Negative EPOCH -1");
    }

    private Path writeWithHeader(String fileName, RpmPackageFixture.HeaderBuilder header) throws IOException {
        byte[] prefix = RpmPackageFixture.builder("prefix", "1", "1").withoutPayload().toByteArray();
        byte[] lead = Arrays.copyOf(prefix, RpmHeaderReader.LEAD_SIZE);
        byte[] signature = new RpmPackageFixture.HeaderBuilder().build();
        byte[] main = header.build();

        byte[] content = new byte[lead.length + signature.length + main.length];
        System.arraycopy(lead, 0, content, 0, lead.length);
        System.arraycopy(signature, 0, content, lead.length, signature.length);
        System.arraycopy(main, 0, content, lead.length + signature.length, main.length);

        Path file = tempDir.resolve(fileName);
        Files.write(file, content);
        return file;
    }
}
