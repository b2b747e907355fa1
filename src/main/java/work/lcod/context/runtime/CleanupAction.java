package work.lcod.context.runtime;

/**
 * Zero-argument finalizer registered with a {@link CleanupRegistry}.
 */
@FunctionalInterface
public interface CleanupAction {
    void run() throws Exception;
}
