package net.imadata.cliutils.progress;

public enum ProgressActionType {
    STEP('s'),
    PROGRESS('p'),
    MAX_PROGRESS('m'),
    INDETERMINATE('i');

    public final char identifier;

    ProgressActionType(char identifier) {
        this.identifier = identifier;
    }
}
