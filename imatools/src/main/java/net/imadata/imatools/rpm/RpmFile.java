package net.imadata.imatools.rpm;

import java.util.Objects;

/**
 * A file listed in a package header together with its hex digest. Files without a stored digest (directories,
 * symlinks, ghosts) carry an all-zero placeholder.
 */
public final class RpmFile {
    private final String path;
    private final String digest;

    public RpmFile(String path, String digest) {
        this.path = Objects.requireNonNull(path, "path");
        this.digest = Objects.requireNonNull(digest, "digest");
    }

    public String getPath() {
        return path;
    }

    public String getDigest() {
        return digest;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        RpmFile other = (RpmFile) o;
        return path.equals(other.path) && digest.equals(other.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, digest);
    }

    @Override
    public String toString() {
        return path + " " + digest;
    }
}
