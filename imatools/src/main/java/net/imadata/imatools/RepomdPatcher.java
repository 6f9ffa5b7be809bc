package net.imadata.imatools;

import net.imadata.imatools.xml.XmlFiles;
import net.imadata.imatools.xml.XmlIndenter;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.jdom2.Text;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Registers the compressed metadata file as a new {@code <data>} entry of {@code repodata/repomd.xml}.
 * <p>
 * Only the new entry is formatted. The rest of the document, including its namespace declarations, is written
 * back with its original layout; empty elements come out in the short {@code <name />} form.
 */
public final class RepomdPatcher {
    public static final String REPO_NAMESPACE = "http://linux.duke.edu/metadata/repo";
    public static final String RPM_NAMESPACE = "http://linux.duke.edu/metadata/rpm";
    public static final String FILE_NAME = "repomd.xml";
    public static final String DATA_TYPE = "imadata";

    private RepomdPatcher() {
    }

    public static Path getRepomdFile(Path repository) {
        return repository.resolve(ImadataWriter.REPODATA_DIRECTORY).resolve(FILE_NAME);
    }

    /**
     * Adds the {@value #DATA_TYPE} entry for {@code artifact} to the repository's repomd.xml.
     *
     * @throws DuplicateEntryException if the index already has such an entry; the file is not modified then
     */
    public static void register(Path repository, FinalizedArtifact artifact) throws IOException {
        Path repomd = getRepomdFile(repository);
        if (!Files.isRegularFile(repomd)) {
            throw new NoSuchFileException(repomd.toString(), null, "Repository has no master index");
        }

        byte[] content = Files.readAllBytes(repomd);
        Document document = XmlFiles.parse(content, repomd.toString());
        addDataEntry(document, repomd, artifact);
        boolean trailingLineSeparator = content.length > 0 && content[content.length - 1] == '\n';
        writeAtomically(document, repomd, trailingLineSeparator);
    }

    static void addDataEntry(Document document, Path repomd, FinalizedArtifact artifact) throws IOException {
        Element root = document.getRootElement();
        if (!"repomd".equals(root.getName())) {
            throw new IOException(repomd + " is not a repomd document, its root element is " + root.getQualifiedName());
        }

        // Shallow check: only the type attribute of the top-level entries is inspected
        for (Element data : root.getChildren("data", root.getNamespace())) {
            if (DATA_TYPE.equals(data.getAttributeValue("type"))) {
                throw new DuplicateEntryException(repomd, DATA_TYPE);
            }
        }

        int last = root.getContentSize() - 1;
        if (last >= 0 && XmlIndenter.isIndentation(root.getContent(last))) {
            root.removeContent(last);
        }
        root.addContent(new Text("\n  "));
        root.addContent(XmlIndenter.indent(createDataElement(root.getNamespace(), artifact), 1));
        root.addContent(new Text("\n"));
    }

    static Element createDataElement(Namespace namespace, FinalizedArtifact artifact) {
        String checksumType = HashFunction.SHA256.getTypeName();

        Element data = new Element("data", namespace).setAttribute("type", DATA_TYPE);
        data.addContent(new Element("checksum", namespace).setAttribute("type", checksumType).setText(artifact.getChecksum()));
        data.addContent(new Element("open-checksum", namespace).setAttribute("type", checksumType).setText(artifact.getOpenChecksum()));
        data.addContent(new Element("location", namespace).setAttribute("href", ImadataWriter.REPODATA_DIRECTORY + "/" + artifact.getChecksum() + "_" + artifact.getBaseName()));
        data.addContent(new Element("timestamp", namespace).setText(String.valueOf(artifact.getTimestamp())));
        data.addContent(new Element("size", namespace).setText(String.valueOf(artifact.getSize())));
        data.addContent(new Element("open-size", namespace).setText(String.valueOf(artifact.getOpenSize())));
        return data;
    }

    private static void writeAtomically(Document document, Path repomd, boolean trailingLineSeparator) throws IOException {
        Path temp = Files.createTempFile(repomd.getParent(), FILE_NAME, ".tmp");
        boolean moved = false;
        try {
            if (repomd.getFileSystem().supportedFileAttributeViews().contains("posix")) {
                Files.setPosixFilePermissions(temp, Files.getPosixFilePermissions(repomd));
            }
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                XmlFiles.write(document, writer, trailingLineSeparator);
            }
            try {
                Files.move(temp, repomd, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, repomd, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) {
                Files.deleteIfExists(temp);
            }
        }
    }
}
