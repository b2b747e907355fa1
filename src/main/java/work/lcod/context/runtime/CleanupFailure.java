package work.lcod.context.runtime;

import java.util.Objects;

/**
 * Failure raised by a single cleanup action during drain.
 */
public record CleanupFailure(String name, long sequence, String message, Throwable cause) {
    public CleanupFailure {
        Objects.requireNonNull(name, "name");
    }

    static CleanupFailure of(CleanupToken token, Throwable cause) {
        String message = cause.getMessage() != null && !cause.getMessage().isBlank()
            ? cause.getMessage()
            : cause.getClass().getSimpleName();
        return new CleanupFailure(token.name(), token.sequence(), message, cause);
    }
}
