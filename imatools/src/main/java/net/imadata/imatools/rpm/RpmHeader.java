package net.imadata.imatools.rpm;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The identity and file table of one package, as read from its main header.
 */
public final class RpmHeader {
    private final String name;
    private final String arch;
    private final boolean sourcePackage;
    @Nullable
    private final Integer epoch;
    private final String version;
    private final String release;
    private final DigestAlgorithm digestAlgorithm;
    private final List<RpmFile> files;

    public RpmHeader(String name,
                     String arch,
                     boolean sourcePackage,
                     @Nullable Integer epoch,
                     String version,
                     String release,
                     DigestAlgorithm digestAlgorithm,
                     List<RpmFile> files) {
        this.name = Objects.requireNonNull(name, "name");
        this.arch = Objects.requireNonNull(arch, "arch");
        this.sourcePackage = sourcePackage;
        this.epoch = epoch;
        this.version = Objects.requireNonNull(version, "version");
        this.release = Objects.requireNonNull(release, "release");
        this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
    }

    public String getName() {
        return name;
    }

    public String getArch() {
        return arch;
    }

    public boolean isSourcePackage() {
        return sourcePackage;
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

    public DigestAlgorithm getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public List<RpmFile> getFiles() {
        return files;
    }

    @Override
    public String toString() {
        return name + "-" + (epoch != null ? epoch + ":" : "") + version + "-" + release + "." + (sourcePackage ? "src" : arch);
    }
}
