package work.lcod.context.runtime;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw result of driving one context to a terminal phase, before conversion to a caller-facing outcome.
 */
public record Execution<T>(
    Phase phase,
    T value,
    Throwable failure,
    List<CleanupFailure> cleanupFailures,
    Map<String, Object> state
) {
    public Execution {
        if (!phase.isTerminal()) {
            throw new IllegalArgumentException("Execution must be terminal, got " + phase);
        }
        cleanupFailures = cleanupFailures == null ? List.of() : List.copyOf(cleanupFailures);
        state = state == null ? Map.of() : state;
    }

    public boolean completed() {
        return phase == Phase.COMPLETED;
    }

    public Optional<Throwable> failureCause() {
        return Optional.ofNullable(failure);
    }
}
