package net.imadata.problems;

public enum ProblemSeverity {
    ADVICE,
    WARNING,
    ERROR
}
