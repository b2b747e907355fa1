package work.lcod.context.runtime;

/**
 * Lifecycle of an {@link ExecutionContext}. {@code COMPLETED} and {@code FAILED} are terminal.
 */
public enum Phase {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
