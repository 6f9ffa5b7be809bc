package net.imadata.imatools;

import java.nio.file.Path;

/**
 * The master index already registers metadata of the type being added.
 */
public class DuplicateEntryException extends IllegalStateException {
    private final Path indexFile;
    private final String type;

    public DuplicateEntryException(Path indexFile, String type) {
        super("Data type " + type + " is already present in " + indexFile);
        this.indexFile = indexFile;
        this.type = type;
    }

    public Path getIndexFile() {
        return indexFile;
    }

    public String getType() {
        return type;
    }
}
