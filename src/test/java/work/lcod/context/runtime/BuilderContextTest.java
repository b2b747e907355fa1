package work.lcod.context.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class BuilderContextTest {
    @Test
    void runAsHandlerWritesStateBetweenFragments() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> {
            var built = BuilderContext.<Void, String>open(ctx, b -> {
                b.append("<p>");
                b.runAsHandler(h -> {
                    h.state().write("x", 1);
                    return null;
                });
                b.append("</p>");
                return null;
            });
            assertEquals(Optional.of(1), ctx.state().read("x"));
            return built;
        });

        assertTrue(execution.completed());
        assertEquals(List.of("<p>", "</p>"), execution.value().output().fragments());
        assertEquals(1, execution.state().get("x"));
    }

    @Test
    void consecutiveHandlerCallsSeeEarlierWrites() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> BuilderContext.<Object, String>open(ctx, b -> {
            b.runAsHandler(h -> {
                h.state().write("user", "ada");
                return null;
            });
            return b.runAsHandler(h -> h.state().read("user").orElse("nobody"));
        }));

        assertEquals("ada", execution.value().value());
    }

    @Test
    void nestedBuilderSharesStateWithEnclosingBuilder() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> BuilderContext.<Object, String>open(ctx, outer -> {
            var nested = outer.runBuilder(inner -> {
                inner.state().write("title", "Invoices");
                inner.append("<h1>");
                return "nested-result";
            });
            assertEquals("nested-result", nested.value());
            assertTrue(nested.output().isFinalized());
            return outer.state().read("title").orElse(null);
        }));

        assertEquals("Invoices", execution.value().value());
        assertTrue(execution.value().output().fragments().isEmpty());
    }

    @Test
    void includeMergesNestedOutputInOrder() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> BuilderContext.<Void, String>open(ctx, page -> {
            page.append("<body>");
            page.include(widget -> {
                widget.append("<div>").append("</div>");
                widget.mergeMetadata("script:/widget.js");
                return null;
            });
            page.mergeMetadata("script:/widget.js");
            page.mergeMetadata("style:/page.css");
            page.append("</body>");
            return null;
        }));

        var output = execution.value().output();
        assertEquals(List.of("<body>", "<div>", "</div>", "</body>"), output.fragments());
        assertEquals(List.of("script:/widget.js", "style:/page.css"), new ArrayList<>(output.metadata()));
    }

    @Test
    void cleanupRegisteredInsideBuilderBelongsToRequest() {
        List<String> calls = new ArrayList<>();
        var execution = ContextRunner.execute(Environment.empty(), ctx -> {
            BuilderContext.<Void, String>open(ctx, b -> {
                b.defer("cursor", () -> calls.add("cursor closed"));
                b.runBuilder(inner -> {
                    inner.defer("nested", () -> calls.add("nested closed"));
                    return null;
                });
                return null;
            });
            assertEquals(2, ctx.cleanup().pending());
            assertTrue(calls.isEmpty());
            return null;
        });

        assertTrue(execution.completed());
        assertEquals(List.of("nested closed", "cursor closed"), calls);
    }

    @Test
    void builderDelegatesToRootContext() {
        var env = Environment.builder().requestId("req-7").build();
        var execution = ContextRunner.execute(env, ctx -> BuilderContext.<Boolean, String>open(ctx, outer ->
            outer.runBuilder(inner ->
                inner.environment() == ctx.environment()
                    && inner.state() == ctx.state()
                    && inner.cleanup() == ctx.cleanup()
                    && inner.runAsHandler(h -> h == ctx)
            ).value()
        ));

        assertEquals(Boolean.TRUE, execution.value().value());
    }

    @Test
    void finalizedOutputRejectsAppends() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> {
            var escaped = new ArrayList<BuilderContext<String>>();
            BuilderContext.<Void, String>open(ctx, b -> {
                escaped.add(b);
                b.append("a");
                return null;
            });
            assertThrows(IllegalStateException.class, () -> escaped.get(0).append("late"));
            return escaped.get(0).output().fragments();
        });

        assertEquals(List.of("a"), execution.value());
    }

    @Test
    void builderFailurePropagatesAndKeepsState() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> BuilderContext.<Void, String>open(ctx, b -> {
            b.append("<table>");
            b.state().write("rows", 3);
            throw new IllegalStateException("query failed");
        }));

        assertEquals(Phase.FAILED, execution.phase());
        assertEquals("query failed", execution.failure().getMessage());
        assertEquals(3, execution.state().get("rows"));
    }

    @Test
    void builderChecksCancellationBeforeHandlerCalls() {
        var token = new CancellationToken();
        var execution = ContextRunner.execute(Environment.empty(), token, ctx -> BuilderContext.<Void, String>open(ctx, b -> {
            b.append("<p>");
            token.cancel("timeout");
            b.runAsHandler(h -> "unreachable");
            return null;
        }));

        assertTrue(execution.failure() instanceof ContextCancelledException);
    }

    @Test
    void emptyAccumulatorIsFinalized() {
        var empty = OutputAccumulator.<String>empty();
        assertTrue(empty.isFinalized());
        assertTrue(empty.fragments().isEmpty());
        assertEquals(Set.of(), empty.metadata());
    }

    @Test
    void typedMetadataLookupAndJoin() {
        record Asset(String href) {}
        var execution = ContextRunner.execute(Environment.empty(), ctx -> BuilderContext.<Void, String>open(ctx, b -> {
            b.appendAll(List.of("<ul>", "<li>one</li>", "</ul>"));
            b.mergeMetadata(new Asset("/list.css"));
            b.mergeMetadata(new Asset("/list.css"));
            b.mergeMetadata("inline-marker");
            return null;
        }));

        var output = execution.value().output();
        assertEquals("<ul><li>one</li></ul>", output.join());
        assertEquals(List.of(new Asset("/list.css")), output.metadata(Asset.class));
        assertEquals(2, output.metadata().size());
    }

    @Test
    void mergeOutputAppendsForeignAccumulator() {
        var execution = ContextRunner.execute(Environment.empty(), ctx -> {
            var header = BuilderContext.<Void, String>open(ctx, b -> {
                b.append("<header/>");
                b.mergeMetadata("style:/header.css");
                return null;
            });
            return BuilderContext.<Void, String>open(ctx, b -> {
                b.mergeOutput(header.output());
                b.append("<main/>");
                return null;
            });
        });

        var output = execution.value().output();
        assertEquals(List.of("<header/>", "<main/>"), output.fragments());
        assertEquals(1, output.metadata().size());
    }
}
