package net.imadata.cliutils.progress;

import java.io.PrintStream;

/**
 * A {@link ProgressManager} that writes every change to a print stream as an ANSI escape line of the form
 * <code>\033[{@value #MODIFIER_KEY};action value</code>, so that a launcher wrapping the tool can render a progress bar.
 * <p>
 * The {@link #getDefault() default reporter} is only enabled if the {@value #ENABLED_PROPERTY} system property
 * is set to {@code true}, and writes to {@link System#err}.
 */
public class ProgressReporter implements ProgressManager {
    public static final String MODIFIER_KEY = "progressmanager";
    public static final String ENABLED_PROPERTY = "net.imadata.progressmanager.enabled";

    protected final boolean enabled;
    protected final PrintStream output;

    public ProgressReporter(boolean enabled, PrintStream output) {
        this.enabled = enabled;
        this.output = output;
    }

    public static ProgressReporter getDefault() {
        return new ProgressReporter(Boolean.getBoolean(ENABLED_PROPERTY), System.err);
    }

    @Override
    public void setMaxProgress(int maxProgress) {
        write(ProgressActionType.MAX_PROGRESS, String.valueOf(maxProgress));
    }

    @Override
    public void setProgress(int progress) {
        write(ProgressActionType.PROGRESS, String.valueOf(progress));
    }

    @Override
    public void setStep(String name) {
        write(ProgressActionType.STEP, name);
    }

    @Override
    public void setIndeterminate(boolean indeterminate) {
        write(ProgressActionType.INDETERMINATE, String.valueOf(indeterminate));
    }

    protected synchronized void write(ProgressActionType type, String value) {
        if (!enabled) return;

        // PrintStream never throws, it only records the error
        output.println("\033[" + MODIFIER_KEY + ";" + type.identifier + " " + value);
        if (output.checkError()) {
            System.err.println("Failed to write progress " + type + " " + value);
        }
    }
}
