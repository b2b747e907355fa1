package work.lcod.context.failure;

/**
 * Primary failure categories reported in an outcome. Cleanup failures are reported separately.
 */
public enum FailureKind {
    /** Raised by handler or builder logic. */
    HANDLER,
    /** Request cancelled or timed out. */
    CANCELLED,
    /** The environment could not be constructed; no handler ran. */
    ENVIRONMENT
}
