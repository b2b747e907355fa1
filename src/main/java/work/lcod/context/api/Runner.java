package work.lcod.context.api;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.context.failure.Failure;
import work.lcod.context.failure.Failures;
import work.lcod.context.runtime.BuilderContext;
import work.lcod.context.runtime.BuilderFunction;
import work.lcod.context.runtime.Built;
import work.lcod.context.runtime.CancellationToken;
import work.lcod.context.runtime.ContextRunner;
import work.lcod.context.runtime.Environment;
import work.lcod.context.runtime.Execution;
import work.lcod.context.runtime.HandlerFunction;

/**
 * Public entry point for running handlers and builders, one fresh context per call.
 */
public final class Runner {
    private static final Logger log = LoggerFactory.getLogger(Runner.class);

    private final RunnerSettings settings;

    public Runner() {
        this(RunnerSettings.defaults());
    }

    public Runner(RunnerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public RunnerSettings settings() {
        return settings;
    }

    public <T> Outcome<T> run(Environment environment, HandlerFunction<T> handler) {
        return run(EnvironmentSupplier.of(environment), handler, new CancellationToken());
    }

    public <T> Outcome<T> run(EnvironmentSupplier environment, HandlerFunction<T> handler) {
        return run(environment, handler, new CancellationToken());
    }

    /**
     * Runs {@code handler}; {@code token} lets the transport cancel the request (client disconnect).
     */
    public <T> Outcome<T> run(EnvironmentSupplier environment, HandlerFunction<T> handler, CancellationToken token) {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(handler, "handler");
        var started = Instant.now();
        var cancellation = token == null ? new CancellationToken() : token;

        Environment env;
        try {
            env = Objects.requireNonNull(environment.get(), "environment supplier returned null");
        } catch (Exception ex) {
            log.debug("Environment construction failed: {}", ex.toString());
            return Outcome.failure(null, Failures.fromEnvironment(ex), List.of(), Map.of(), started);
        }

        Execution<T> execution;
        ScheduledFuture<?> deadline = scheduleTimeout(cancellation);
        try {
            execution = ContextRunner.execute(env, cancellation, handler);
        } finally {
            if (deadline != null) {
                deadline.cancel(false);
            }
        }
        return toOutcome(env, execution, started);
    }

    public <T, F> Outcome<Built<T, F>> runBuilder(EnvironmentSupplier environment, BuilderFunction<T, F> builder) {
        return runBuilder(environment, builder, new CancellationToken());
    }

    public <T, F> Outcome<Built<T, F>> runBuilder(
        EnvironmentSupplier environment,
        BuilderFunction<T, F> builder,
        CancellationToken token
    ) {
        Objects.requireNonNull(builder, "builder");
        return run(environment, ctx -> BuilderContext.open(ctx, builder), token);
    }

    /**
     * Runs the handler on {@code executor}. The returned future always completes with the
     * run's outcome; to cancel the request use {@link #runAsync(EnvironmentSupplier, HandlerFunction,
     * CancellationToken, Executor)} and cancel the token.
     */
    public <T> CompletableFuture<Outcome<T>> runAsync(
        EnvironmentSupplier environment,
        HandlerFunction<T> handler,
        Executor executor
    ) {
        return runAsync(environment, handler, new CancellationToken(), executor);
    }

    /**
     * Runs the handler on {@code executor} under {@code token}. Cancelling the token cancels the
     * request, which still drains its cleanups and completes the future with a cancelled outcome.
     * Cancelling the future itself also cancels the token, but the outcome is then lost to the caller.
     */
    public <T> CompletableFuture<Outcome<T>> runAsync(
        EnvironmentSupplier environment,
        HandlerFunction<T> handler,
        CancellationToken token,
        Executor executor
    ) {
        Objects.requireNonNull(executor, "executor");
        Objects.requireNonNull(token, "token");
        var result = new CompletableFuture<Outcome<T>>();
        result.whenComplete((outcome, error) -> {
            if (result.isCancelled()) {
                token.cancel("Request cancelled by caller");
            }
        });
        try {
            executor.execute(() -> {
                try {
                    result.complete(run(environment, handler, token));
                } catch (Throwable ex) {
                    result.completeExceptionally(ex);
                }
            });
        } catch (RuntimeException ex) {
            result.completeExceptionally(ex);
        }
        return result;
    }

    private ScheduledFuture<?> scheduleTimeout(CancellationToken token) {
        if (settings.timeout().isEmpty()) {
            return null;
        }
        Duration timeout = settings.timeout().get();
        return Timer.INSTANCE.schedule(
            () -> token.cancel("Timed out after " + timeout.toMillis() + "ms"),
            timeout.toMillis(),
            TimeUnit.MILLISECONDS
        );
    }

    private static <T> Outcome<T> toOutcome(Environment env, Execution<T> execution, Instant started) {
        if (execution.completed()) {
            return Outcome.success(env.requestId(), execution.value(), execution.cleanupFailures(), execution.state(), started);
        }
        Failure failure = Failures.fromHandler(execution.failure());
        log.debug("Request {} failed ({}): {}", env.requestId(), failure.kind(), failure.message());
        return Outcome.failure(env.requestId(), failure, execution.cleanupFailures(), execution.state(), started);
    }

    private static final class Timer {
        private static final ScheduledThreadPoolExecutor INSTANCE = create();

        private static ScheduledThreadPoolExecutor create() {
            var executor = new ScheduledThreadPoolExecutor(1, runnable -> {
                var thread = new Thread(runnable, "context-runner-timeout");
                thread.setDaemon(true);
                return thread;
            });
            executor.setRemoveOnCancelPolicy(true);
            return executor;
        }
    }
}
