package work.lcod.context.runtime;

import java.util.Objects;

/**
 * Result of a builder run: the builder's return value and its finalized output.
 */
public record Built<T, F>(T value, OutputAccumulator<F> output) {
    public Built {
        Objects.requireNonNull(output, "output");
    }
}
