package work.lcod.context.api;

import work.lcod.context.runtime.Environment;

/**
 * Builds the environment for one inbound request. Failures here surface as
 * {@link work.lcod.context.failure.FailureKind#ENVIRONMENT} outcomes.
 */
@FunctionalInterface
public interface EnvironmentSupplier {
    Environment get() throws Exception;

    static EnvironmentSupplier of(Environment environment) {
        return () -> environment;
    }
}
