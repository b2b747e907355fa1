package work.lcod.context.runtime;

import java.util.Collection;
import java.util.Objects;

/**
 * Context that accumulates output fragments while delegating every capability to the
 * request's root context. State and cleanup calls made through a builder are the same
 * calls the enclosing handler would make.
 */
public final class BuilderContext<F> implements Context {
    private final Context root;
    private final OutputAccumulator<F> output = new OutputAccumulator<>();

    BuilderContext(Context base) {
        Objects.requireNonNull(base, "base");
        this.root = base instanceof BuilderContext<?> builder ? builder.root : base;
    }

    /**
     * Runs {@code builder} against {@code ctx}. This is how a plain handler produces output;
     * the context is not torn down afterwards.
     */
    public static <T, F> Built<T, F> open(Context ctx, BuilderFunction<T, F> builder) throws Exception {
        Objects.requireNonNull(builder, "builder");
        var builderCtx = new BuilderContext<F>(ctx);
        ctx.ensureNotCancelled();
        T value = builder.build(builderCtx);
        return new Built<>(value, builderCtx.output.finish());
    }

    @Override
    public Environment environment() {
        return root.environment();
    }

    @Override
    public StateCell state() {
        return root.state();
    }

    @Override
    public CleanupRegistry cleanup() {
        return root.cleanup();
    }

    @Override
    public CancellationToken cancellation() {
        return root.cancellation();
    }

    public BuilderContext<F> append(F fragment) {
        output.append(fragment);
        return this;
    }

    public BuilderContext<F> appendAll(Collection<? extends F> fragments) {
        for (F fragment : fragments) {
            output.append(fragment);
        }
        return this;
    }

    public BuilderContext<F> mergeMetadata(Object entry) {
        output.mergeMetadata(entry);
        return this;
    }

    public BuilderContext<F> mergeOutput(OutputAccumulator<? extends F> other) {
        output.merge(Objects.requireNonNull(other, "other"));
        return this;
    }

    /**
     * Drops down to a plain handler on the root context and returns its result.
     */
    public <T> T runAsHandler(HandlerFunction<T> handler) throws Exception {
        Objects.requireNonNull(handler, "handler");
        ensureNotCancelled();
        return handler.handle(root);
    }

    /**
     * Runs a nested builder on the same root context with its own accumulator. The nested
     * output is returned finalized and is not merged; see {@link #include}.
     */
    public <T, G> Built<T, G> runBuilder(BuilderFunction<T, G> nested) throws Exception {
        return open(root, nested);
    }

    /**
     * Runs a nested builder and merges its output into this one.
     */
    public <T> T include(BuilderFunction<T, ? extends F> nested) throws Exception {
        var built = open(root, nested);
        output.merge(built.output());
        return built.value();
    }

    /**
     * Live view of the output accumulated so far.
     */
    public OutputAccumulator<F> output() {
        return output;
    }
}
