package work.lcod.context.runtime;

/**
 * Raised by {@link Context#ensureNotCancelled()} once the request has been cancelled.
 */
public final class ContextCancelledException extends RuntimeException {
    public ContextCancelledException(String message) {
        super(message);
    }
}
