package net.imadata.imatools;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The IMA relevant part of one package: its identity and the files that carry a digest.
 */
public final class PackageRecord {
    private final String name;
    private final String arch;
    private final boolean source;
    @Nullable
    private final Integer epoch;
    private final String version;
    private final String release;
    private final List<FileDigest> files;
    private final int unmeasuredFiles;

    public PackageRecord(String name,
                         String arch,
                         boolean source,
                         @Nullable Integer epoch,
                         String version,
                         String release,
                         List<FileDigest> files) {
        this(name, arch, source, epoch, version, release, files, 0);
    }

    /**
     * @param unmeasuredFiles number of packaged files that were left out because they carry no digest
     */
    public PackageRecord(String name,
                         String arch,
                         boolean source,
                         @Nullable Integer epoch,
                         String version,
                         String release,
                         List<FileDigest> files,
                         int unmeasuredFiles) {
        if (unmeasuredFiles < 0) {
            throw new IllegalArgumentException("Unmeasured file count of " + name + " must not be negative: " + unmeasuredFiles);
        }
        if (epoch != null && epoch < 0) {
            throw new IllegalArgumentException("Epoch of " + name + " must not be negative: " + epoch);
        }
        this.name = Objects.requireNonNull(name, "name");
        this.arch = Objects.requireNonNull(arch, "arch");
        this.source = source;
        this.epoch = epoch;
        this.version = Objects.requireNonNull(version, "version");
        this.release = Objects.requireNonNull(release, "release");
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
        this.unmeasuredFiles = unmeasuredFiles;
    }

    public String getName() {
        return name;
    }

    public String getArch() {
        return arch;
    }

    public boolean isSource() {
        return source;
    }

    @Nullable
    public Integer getEpoch() {
        return epoch;
    }

    public String getVersion() {
        return version;
    }

    public String getRelease() {
        return release;
    }

    public List<FileDigest> getFiles() {
        return files;
    }

    public int getUnmeasuredFiles() {
        return unmeasuredFiles;
    }

    /**
     * @return true if the package ships files, but none of them has a digest
     */
    public boolean lacksFileDigests() {
        return files.isEmpty() && unmeasuredFiles > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        PackageRecord other = (PackageRecord) o;
        return source == other.source
                && unmeasuredFiles == other.unmeasuredFiles
                && name.equals(other.name)
                && arch.equals(other.arch)
                && Objects.equals(epoch, other.epoch)
                && version.equals(other.version)
                && release.equals(other.release)
                && files.equals(other.files);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, arch, source, epoch, version, release, files, unmeasuredFiles);
    }

    @Override
    public String toString() {
        return name + "-" + version + "-" + release + "." + (source ? "src" : arch) + " (" + files.size() + " files)";
    }

    public static final class FileDigest {
        private final String path;
        private final String digest;

        public FileDigest(String path, String digest) {
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
            FileDigest other = (FileDigest) o;
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
}
