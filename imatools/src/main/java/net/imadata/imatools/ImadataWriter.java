package net.imadata.imatools;

import net.imadata.imatools.xml.XmlFiles;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Writes {@code repodata/imadata.xml}: every package sorted by name, with the digest of each measured file.
 * The output only depends on the given records, so the same records always produce the same bytes.
 */
public final class ImadataWriter {
    public static final String REPODATA_DIRECTORY = "repodata";
    public static final String FILE_NAME = "imadata.xml";

    private ImadataWriter() {
    }

    public static Path getImadataFile(Path repository) {
        return repository.resolve(REPODATA_DIRECTORY).resolve(FILE_NAME);
    }

    /**
     * Writes the document for {@code records}, replacing any previous one.
     *
     * @return the written file
     */
    public static Path write(Path repository, Collection<PackageRecord> records) throws IOException {
        Path imadata = getImadataFile(repository);
        Files.createDirectories(imadata.getParent());
        try (Writer writer = Files.newBufferedWriter(imadata, StandardCharsets.UTF_8)) {
            write(records, writer);
        }
        return imadata;
    }

    public static void write(Collection<PackageRecord> records, Writer writer) throws IOException {
        // List.sort is stable, packages with the same name keep their scan order
        List<PackageRecord> sorted = new ArrayList<>(records);
        sorted.sort(Comparator.comparing(PackageRecord::getName));

        writer.write(XmlFiles.DECLARATION);
        writer.write('\n');
        writer.write("<imadata packages=\"" + sorted.size() + "\">\n");
        for (PackageRecord record : sorted) {
            writer.write("<package name=\"" + attr(record.getName()) + "\" arch=\"" + attr(record.isSource() ? "src" : record.getArch()) + "\">\n");
            int epoch = record.getEpoch() == null ? 0 : record.getEpoch();
            writer.write("  <version epoch=\"" + epoch + "\" ver=\"" + attr(record.getVersion()) + "\" rel=\"" + attr(record.getRelease()) + "\"/>\n");
            for (PackageRecord.FileDigest file : record.getFiles()) {
                writer.write("  <file hash=\"" + attr(file.getDigest()) + "\">" + XmlFiles.escapeText(file.getPath()) + "</file>\n");
            }
            writer.write("</package>\n");
        }
        writer.write("</imadata>");
    }

    private static String attr(String value) {
        return XmlFiles.escapeAttribute(value);
    }
}
