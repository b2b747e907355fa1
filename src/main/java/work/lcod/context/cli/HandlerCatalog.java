package work.lcod.context.cli;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.context.failure.HandlerFailureException;
import work.lcod.context.runtime.BuilderContext;
import work.lcod.context.runtime.Context;
import work.lcod.context.runtime.HandlerFunction;

/**
 * Built-in handlers exposed by {@code context-run} for exercising the runtime from the command line.
 */
final class HandlerCatalog {
    private static final Logger log = LoggerFactory.getLogger(HandlerCatalog.class);

    private final Map<String, Entry> handlers = new LinkedHashMap<>();

    private HandlerCatalog() {}

    static HandlerCatalog builtIn() {
        var catalog = new HandlerCatalog();
        catalog.register("echo", "Return the request payload and application name.", HandlerCatalog::echo);
        catalog.register("annotate", "Record session annotations in state and audit them on cleanup.", HandlerCatalog::annotate);
        catalog.register("render", "Render a paragraph through a builder, collecting required assets.", HandlerCatalog::render);
        catalog.register("fail", "Abort with a handler failure after registering a cleanup.", HandlerCatalog::fail);
        catalog.register("wait", "Poll for cancellation for request.millis milliseconds.", HandlerCatalog::waitFor);
        return catalog;
    }

    void register(String name, String description, HandlerFunction<Object> handler) {
        handlers.put(name, new Entry(name, description, handler));
    }

    Optional<Entry> find(String name) {
        return Optional.ofNullable(handlers.get(name));
    }

    Map<String, Entry> entries() {
        return Collections.unmodifiableMap(handlers);
    }

    record Entry(String name, String description, HandlerFunction<Object> handler) {}

    private static Object echo(Context ctx) {
        var env = ctx.environment();
        var result = new LinkedHashMap<String, Object>();
        result.put("requestId", env.requestId());
        result.put("request", env.request());
        env.config("app.name").ifPresent(name -> result.put("app", name));
        return result;
    }

    private static Object annotate(Context ctx) {
        String message = ctx.environment().requestValue("message").map(String::valueOf).orElse("hello");
        ctx.state().write("session.flash", message);
        ctx.state().modify("session.visits", current -> current
            .filter(Number.class::isInstance)
            .map(value -> ((Number) value).longValue() + 1)
            .orElse(1L));
        ctx.defer("audit", () -> log.info("Session annotations for {}: {}", ctx.environment().requestId(), ctx.state().snapshot()));
        return Map.of("annotated", true);
    }

    private static Object render(Context ctx) throws Exception {
        String title = ctx.environment().requestValue("title").map(String::valueOf).orElse("untitled");
        var built = BuilderContext.<Integer, String>open(ctx, page -> {
            page.append("<p>");
            page.include(heading -> {
                heading.mergeMetadata("style:/assets/heading.css");
                heading.append("<span class=\"title\">").append(title).append("</span>");
                return null;
            });
            int renders = page.runAsHandler(handler -> {
                handler.state().modify("render.count", current -> current
                    .filter(Number.class::isInstance)
                    .map(value -> ((Number) value).intValue() + 1)
                    .orElse(1));
                return handler.state().read("render.count", Integer.class).orElse(0);
            });
            page.mergeMetadata("style:/assets/heading.css");
            page.append("</p>");
            return renders;
        });
        var result = new LinkedHashMap<String, Object>();
        result.put("html", built.output().join());
        result.put("assets", new ArrayList<>(built.output().metadata()));
        result.put("renders", built.value());
        return result;
    }

    private static Object fail(Context ctx) {
        ctx.defer("release", () -> log.info("Released resources for {}", ctx.environment().requestId()));
        String message = ctx.environment().requestValue("message").map(String::valueOf).orElse("Requested failure");
        throw new HandlerFailureException("demo_failure", message, Map.of("handler", "fail"));
    }

    private static Object waitFor(Context ctx) throws InterruptedException {
        long millis = ctx.environment().requestValue("millis")
            .filter(Number.class::isInstance)
            .map(value -> ((Number) value).longValue())
            .orElse(1_000L);
        long started = System.nanoTime();
        long budget = TimeUnit.MILLISECONDS.toNanos(millis);
        while (System.nanoTime() - started < budget) {
            ctx.ensureNotCancelled();
            Thread.sleep(10);
        }
        return Map.of("waited", millis);
    }
}
