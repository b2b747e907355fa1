package work.lcod.context.runtime;

/**
 * Unit of request work executed against a {@link Context}.
 */
@FunctionalInterface
public interface HandlerFunction<T> {
    T handle(Context ctx) throws Exception;
}
