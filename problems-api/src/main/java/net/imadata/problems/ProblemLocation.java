package net.imadata.problems;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identifies the file a problem was found in, optionally narrowed down to a byte offset.
 */
public final class ProblemLocation {
    private final Path file;
    @Nullable
    private final Long offset;

    private ProblemLocation(Path file, @Nullable Long offset) {
        this.file = Objects.requireNonNull(file, "file");
        if (offset != null && offset < 0) {
            throw new IllegalArgumentException("Byte-Offset for problem location must not be negative: " + offset);
        }
        this.offset = offset;
    }

    public static ProblemLocation ofFile(Path file) {
        return new ProblemLocation(file, null);
    }

    /**
     * @param offset 0-based byte offset into the file.
     */
    public static ProblemLocation ofOffsetInFile(Path file, long offset) {
        return new ProblemLocation(file, offset);
    }

    public Path file() {
        return file;
    }

    @Nullable
    public Long offset() {
        return offset;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ProblemLocation that = (ProblemLocation) o;
        return file.equals(that.file) && Objects.equals(offset, that.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, offset);
    }

    @Override
    public String toString() {
        if (offset != null) {
            return file + ":" + offset + "b";
        }
        return file.toString();
    }
}
