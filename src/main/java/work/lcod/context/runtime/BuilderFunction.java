package work.lcod.context.runtime;

/**
 * Output-producing unit of work; appends fragments of type {@code F} while computing a value.
 */
@FunctionalInterface
public interface BuilderFunction<T, F> {
    T build(BuilderContext<F> ctx) throws Exception;
}
