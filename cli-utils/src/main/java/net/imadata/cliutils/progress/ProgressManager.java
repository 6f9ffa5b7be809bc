package net.imadata.cliutils.progress;

/**
 * A manager that changes the progress of a progress bar, to indicate the current progress to users.
 */
public interface ProgressManager {
    ProgressManager NOOP = new ProgressManager() {
        @Override
        public void setMaxProgress(int maxProgress) {
        }

        @Override
        public void setProgress(int progress) {
        }

        @Override
        public void setStep(String name) {
        }

        @Override
        public void setIndeterminate(boolean indeterminate) {
        }
    };

    /**
     * Sets the max progress of the manager.
     */
    void setMaxProgress(int maxProgress);

    /**
     * Sets the current progress of the manager.
     */
    void setProgress(int progress);

    /**
     * Sets the current step to be shown to the user.
     */
    void setStep(String name);

    /**
     * Sets whether the max progress is known or not.
     */
    void setIndeterminate(boolean indeterminate);
}
