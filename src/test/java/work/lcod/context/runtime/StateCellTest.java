package work.lcod.context.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class StateCellTest {
    @Test
    void readReturnsLatestWrite() {
        var state = new StateCell();
        assertEquals(Optional.empty(), state.read("flash"));

        state.write("flash", "saved");
        state.write("flash", "updated");
        assertEquals(Optional.of("updated"), state.read("flash"));
    }

    @Test
    void writingNullRemovesKey() {
        var state = new StateCell();
        state.write("flash", "saved");
        state.write("flash", null);
        assertFalse(state.contains("flash"));
        assertTrue(state.read("flash").isEmpty());
    }

    @Test
    void typedReadFiltersByType() {
        var state = new StateCell();
        state.write("visits", 3L);
        assertEquals(Optional.of(3L), state.read("visits", Long.class));
        assertTrue(state.read("visits", String.class).isEmpty());
    }

    @Test
    void modifySeesCurrentValue() {
        var state = new StateCell();
        state.modify("visits", current -> current.map(v -> (Integer) v + 1).orElse(1));
        state.modify("visits", current -> current.map(v -> (Integer) v + 1).orElse(1));
        assertEquals(Optional.of(2), state.read("visits"));

        state.modify("visits", current -> null);
        assertFalse(state.contains("visits"));
    }

    @Test
    void modifyIsAtomicUnderConcurrentCallers() throws Exception {
        var state = new StateCell();
        int threads = 8;
        int increments = 1_000;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        var start = new CountDownLatch(1);
        try {
            for (int t = 0; t < threads; t++) {
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < increments; i++) {
                        state.modify("counter", current -> current.map(v -> (Integer) v + 1).orElse(1));
                    }
                    return null;
                });
            }
            start.countDown();
        } finally {
            pool.shutdown();
        }
        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(Optional.of(threads * increments), state.read("counter"));
    }

    @Test
    void modifyMayTouchOtherKeys() {
        var state = new StateCell();
        state.write("visits", 2);

        state.modify("visits", current -> {
            state.write("visits.last", "now");
            state.modify("visits.total", total -> total.map(v -> (Integer) v + 1).orElse(1));
            return current.map(v -> (Integer) v + 1).orElse(1);
        });

        assertEquals(Optional.of(3), state.read("visits"));
        assertEquals(Optional.of("now"), state.read("visits.last"));
        assertEquals(Optional.of(1), state.read("visits.total"));
    }

    @Test
    void snapshotIsDetachedAndReadOnly() {
        var state = new StateCell();
        state.write("a", 1);
        var snapshot = state.snapshot();
        state.write("b", 2);

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", 3));
    }

    @Test
    void removeReturnsPreviousValue() {
        var state = new StateCell();
        state.write("token", "abc");
        assertEquals(Optional.of("abc"), state.remove("token"));
        assertEquals(Optional.empty(), state.remove("token"));
    }
}
