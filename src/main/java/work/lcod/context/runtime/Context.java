package work.lcod.context.runtime;

/**
 * Capability set shared by plain handlers and builders: environment, state, cleanup and cancellation.
 * Collaborators take a {@code Context} and work unchanged inside either mode.
 */
public interface Context {
    Environment environment();

    StateCell state();

    CleanupRegistry cleanup();

    CancellationToken cancellation();

    default void ensureNotCancelled() {
        var token = cancellation();
        if (token.isCancelled()) {
            throw new ContextCancelledException(token.reason());
        }
    }

    default CleanupToken defer(CleanupAction action) {
        return cleanup().register(action);
    }

    default CleanupToken defer(String name, CleanupAction action) {
        return cleanup().register(name, action);
    }
}
