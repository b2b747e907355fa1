package work.lcod.context.runtime;

import java.util.List;
import java.util.Objects;

/**
 * Concrete request context. Owns the state cell and cleanup registry, shares the environment.
 * Only {@link ContextRunner} creates and tears it down.
 */
public final class ExecutionContext implements Context {
    private final Environment environment;
    private final StateCell state = new StateCell();
    private final CleanupRegistry cleanup = new CleanupRegistry();
    private final CancellationToken cancellationToken;
    private volatile Phase phase = Phase.CREATED;

    ExecutionContext(Environment environment) {
        this(environment, new CancellationToken());
    }

    ExecutionContext(Environment environment, CancellationToken token) {
        this.environment = Objects.requireNonNull(environment, "environment");
        this.cancellationToken = token == null ? new CancellationToken() : token;
    }

    @Override
    public Environment environment() {
        return environment;
    }

    @Override
    public StateCell state() {
        return state;
    }

    @Override
    public CleanupRegistry cleanup() {
        return cleanup;
    }

    @Override
    public CancellationToken cancellation() {
        return cancellationToken;
    }

    public Phase phase() {
        return phase;
    }

    synchronized void start() {
        if (phase != Phase.CREATED) {
            throw new IllegalStateException("Context already started (" + phase + ")");
        }
        phase = Phase.RUNNING;
    }

    /**
     * Moves the context to its terminal phase and drains the cleanup registry. Callable once.
     */
    List<CleanupFailure> teardown(boolean failed) {
        synchronized (this) {
            if (phase.isTerminal()) {
                throw new IllegalStateException("Context already torn down (" + phase + ")");
            }
            phase = failed ? Phase.FAILED : Phase.COMPLETED;
        }
        return cleanup.drain();
    }
}
