package net.imadata.problems;

/**
 * Receives problems found while running a tool.
 */
public interface ProblemReporter {
    ProblemReporter NOOP = problem -> {
    };

    /**
     * Reports a location independent problem.
     */
    default void report(ProblemId problemId, ProblemSeverity severity, String contextualLabel) {
        report(Problem.builder(problemId).severity(severity).contextualLabel(contextualLabel).build());
    }

    default void report(ProblemId problemId, ProblemSeverity severity, ProblemLocation location, String contextualLabel) {
        report(Problem.builder(problemId).severity(severity).location(location).contextualLabel(contextualLabel).build());
    }

    void report(Problem problem);
}
