package work.lcod.context.runtime;

import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives a handler through {@code CREATED -> RUNNING -> COMPLETED|FAILED}. The cleanup registry
 * is drained on every exit path, including errors that are not converted into a failure.
 */
public final class ContextRunner {
    private static final Logger log = LoggerFactory.getLogger(ContextRunner.class);

    private ContextRunner() {}

    public static <T> Execution<T> execute(Environment environment, HandlerFunction<T> handler) {
        return execute(environment, new CancellationToken(), handler);
    }

    public static <T> Execution<T> execute(Environment environment, CancellationToken token, HandlerFunction<T> handler) {
        Objects.requireNonNull(handler, "handler");
        var ctx = new ExecutionContext(environment, token);
        ctx.start();
        log.debug("Request {} running", environment.requestId());

        T value = null;
        Exception failure = null;
        boolean returned = false;
        List<CleanupFailure> cleanupFailures;
        try {
            ctx.ensureNotCancelled();
            value = handler.handle(ctx);
            if (ctx.cancellation().isCancelled()) {
                // a result produced after cancellation is discarded
                value = null;
                failure = new ContextCancelledException(ctx.cancellation().reason());
            } else {
                returned = true;
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            failure = ex;
        } catch (Exception ex) {
            failure = ex;
        } finally {
            cleanupFailures = ctx.teardown(!returned);
        }

        log.debug(
            "Request {} {} with {} cleanup failure(s)",
            environment.requestId(),
            ctx.phase(),
            cleanupFailures.size()
        );
        return new Execution<>(ctx.phase(), value, failure, cleanupFailures, ctx.state().snapshot());
    }
}
