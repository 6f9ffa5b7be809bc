package net.imadata.problems;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Objects;

public final class Problem {
    private final ProblemId problemId;
    private final ProblemSeverity severity;
    @Nullable
    private final ProblemLocation location;
    @Nullable
    private final String contextualLabel;
    @Nullable
    private final String details;
    @Nullable
    private final String solution;

    private Problem(ProblemId problemId,
                    ProblemSeverity severity,
                    @Nullable ProblemLocation location,
                    @Nullable String contextualLabel,
                    @Nullable String details,
                    @Nullable String solution) {
        this.problemId = Objects.requireNonNull(problemId, "problemId");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.location = location;
        this.contextualLabel = contextualLabel;
        this.details = details;
        this.solution = solution;
    }

    public ProblemId problemId() {
        return problemId;
    }

    public ProblemSeverity severity() {
        return severity;
    }

    public @Nullable ProblemLocation location() {
        return location;
    }

    public @Nullable String contextualLabel() {
        return contextualLabel;
    }

    public @Nullable String details() {
        return details;
    }

    public @Nullable String solution() {
        return solution;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Problem problem = (Problem) o;
        return problemId.equals(problem.problemId)
                && severity == problem.severity
                && Objects.equals(location, problem.location)
                && Objects.equals(contextualLabel, problem.contextualLabel)
                && Objects.equals(details, problem.details)
                && Objects.equals(solution, problem.solution);
    }

    @Override
    public int hashCode() {
        return Objects.hash(problemId, severity, location, contextualLabel, details, solution);
    }

    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        result.append('[').append(severity).append("] ").append(problemId.id());
        if (contextualLabel != null) {
            result.append(": ").append(contextualLabel);
        }
        if (location != null) {
            result.append(" @ ").append(location);
        }
        return result.toString();
    }

    public static Builder builder(ProblemId id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final ProblemId problemId;
        private ProblemSeverity severity = ProblemSeverity.WARNING;
        @Nullable
        private ProblemLocation location;
        @Nullable
        private String contextualLabel;
        @Nullable
        private String details;
        @Nullable
        private String solution;

        private Builder(ProblemId problemId) {
            this.problemId = problemId;
        }

        public Builder severity(ProblemSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder location(@Nullable ProblemLocation location) {
            this.location = location;
            return this;
        }

        public Builder inFile(Path file) {
            return location(ProblemLocation.ofFile(file));
        }

        /**
         * @param offset 0-based byte offset into the file.
         */
        public Builder inFileAtOffset(Path file, long offset) {
            return location(ProblemLocation.ofOffsetInFile(file, offset));
        }

        public Builder contextualLabel(@Nullable String contextualLabel) {
            this.contextualLabel = contextualLabel;
            return this;
        }

        public Builder details(@Nullable String details) {
            this.details = details;
            return this;
        }

        public Builder solution(@Nullable String solution) {
            this.solution = solution;
            return this;
        }

        public Problem build() {
            return new Problem(problemId, severity, location, contextualLabel, details, solution);
        }
    }
}
