package work.lcod.context.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class CleanupRegistryTest {
    @Test
    void drainRunsActionsInReverseRegistrationOrder() {
        var registry = new CleanupRegistry();
        List<String> calls = new ArrayList<>();
        registry.register("A", () -> calls.add("A"));
        registry.register("B", () -> calls.add("B"));
        registry.register("C", () -> calls.add("C"));

        var failures = registry.drain();

        assertTrue(failures.isEmpty());
        assertEquals(List.of("C", "B", "A"), calls);
        assertTrue(registry.isDrained());
        assertEquals(0, registry.pending());
    }

    @Test
    void failingActionDoesNotStopTheRest() {
        var registry = new CleanupRegistry();
        List<String> calls = new ArrayList<>();
        registry.register("A", () -> calls.add("A"));
        registry.register("B", () -> {
            calls.add("B");
            throw new IOException("socket already closed");
        });
        registry.register("C", () -> calls.add("C"));

        var failures = registry.drain();

        assertEquals(List.of("C", "B", "A"), calls);
        assertEquals(1, failures.size());
        assertEquals("B", failures.get(0).name());
        assertEquals(1L, failures.get(0).sequence());
        assertEquals("socket already closed", failures.get(0).message());
        assertTrue(failures.get(0).cause() instanceof IOException);
    }

    @Test
    void errorInOneActionDoesNotStopTheRest() {
        var registry = new CleanupRegistry();
        List<String> calls = new ArrayList<>();
        registry.register("A", () -> calls.add("A"));
        registry.register("B", () -> {
            calls.add("B");
            throw new AssertionError("B broke");
        });
        registry.register("C", () -> calls.add("C"));

        var failures = registry.drain();

        assertEquals(List.of("C", "B", "A"), calls);
        assertEquals(1, failures.size());
        assertEquals("B broke", failures.get(0).message());
        assertTrue(failures.get(0).cause() instanceof AssertionError);
    }

    @Test
    void everyFailureIsCollected() {
        var registry = new CleanupRegistry();
        registry.register("first", () -> {
            throw new IllegalStateException("first broke");
        });
        registry.register("second", () -> {
            throw new IllegalStateException();
        });

        var failures = registry.drain();

        assertEquals(2, failures.size());
        assertEquals("second", failures.get(0).name());
        assertEquals("IllegalStateException", failures.get(0).message());
        assertEquals("first", failures.get(1).name());
    }

    @Test
    void cancelBeforeDrainPreventsAction() {
        var registry = new CleanupRegistry();
        List<String> calls = new ArrayList<>();
        var keep = registry.register("keep", () -> calls.add("keep"));
        var drop = registry.register("drop", () -> calls.add("drop"));

        assertTrue(registry.cancel(drop));
        assertFalse(registry.cancel(drop));
        registry.drain();

        assertEquals(List.of("keep"), calls);
        assertFalse(registry.cancel(keep));
    }

    @Test
    void cancelIsRejectedOnceDrainHasBegun() {
        var registry = new CleanupRegistry();
        List<Boolean> cancelResults = new ArrayList<>();
        List<String> calls = new ArrayList<>();
        var first = registry.register("first", () -> calls.add("first"));
        registry.register("second", () -> {
            calls.add("second");
            cancelResults.add(registry.cancel(first));
        });

        registry.drain();

        assertEquals(List.of(false), cancelResults);
        assertEquals(List.of("second", "first"), calls);
    }

    @Test
    void unnamedActionsGetSequentialNames() {
        var registry = new CleanupRegistry();
        var first = registry.register(() -> {});
        var second = registry.register(() -> {});
        assertEquals("cleanup-0", first.name());
        assertEquals("cleanup-1", second.name());
    }

    @Test
    void tokensFromAnotherRegistryAreIgnored() {
        var registry = new CleanupRegistry();
        var other = new CleanupRegistry();
        registry.register(() -> {});
        var foreign = other.register(() -> {});
        assertFalse(registry.cancel(foreign));
        assertEquals(1, registry.pending());
    }

    @Test
    void registeringDuringDrainFailsFast() {
        var registry = new CleanupRegistry();
        List<String> calls = new ArrayList<>();
        registry.register("reentrant", () -> registry.register("late", () -> calls.add("late")));

        var failures = registry.drain();

        assertTrue(calls.isEmpty());
        assertEquals(1, failures.size());
        assertTrue(failures.get(0).cause() instanceof IllegalStateException);
        assertThrows(IllegalStateException.class, () -> registry.register(() -> {}));
    }

    @Test
    void drainIsSingleShot() {
        var registry = new CleanupRegistry();
        List<String> calls = new ArrayList<>();
        registry.register(() -> calls.add("once"));

        registry.drain();
        assertThrows(IllegalStateException.class, registry::drain);
        assertEquals(List.of("once"), calls);
    }
}
