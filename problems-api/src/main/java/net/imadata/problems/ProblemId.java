package net.imadata.problems;

import java.util.Objects;

/**
 * Identifies a kind of problem, e.g. {@code imatools/extraction-failed}.
 */
public final class ProblemId {
    private final String id;
    private final String displayName;

    private ProblemId(String id, String displayName) {
        this.id = Objects.requireNonNull(id, "id");
        this.displayName = Objects.requireNonNull(displayName, "displayName");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Problem id must not be empty");
        }
    }

    public static ProblemId create(String id, String displayName) {
        return new ProblemId(id, displayName);
    }

    public String id() {
        return id;
    }

    public String displayName() {
        return displayName;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        ProblemId other = (ProblemId) o;
        return id.equals(other.id) && displayName.equals(other.displayName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, displayName);
    }

    @Override
    public String toString() {
        return id + " (" + displayName + ")";
    }
}
