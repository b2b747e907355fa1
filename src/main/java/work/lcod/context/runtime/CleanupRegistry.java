package work.lcod.context.runtime;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered finalizers owned by one context. Every action still registered when {@link #drain()}
 * starts runs exactly once, newest first. Registration is rejected once drain has begun.
 */
public final class CleanupRegistry {
    private static final Logger log = LoggerFactory.getLogger(CleanupRegistry.class);

    private final Map<Long, Entry> pending = new LinkedHashMap<>();
    private long nextSequence = 0;
    private boolean draining = false;

    CleanupRegistry() {}

    public CleanupToken register(CleanupAction action) {
        return register(null, action);
    }

    public synchronized CleanupToken register(String name, CleanupAction action) {
        Objects.requireNonNull(action, "action");
        if (draining) {
            throw new IllegalStateException("Cleanup registry is draining; cannot register " + (name == null ? "action" : name));
        }
        long sequence = nextSequence++;
        var token = new CleanupToken(this, sequence, name == null || name.isBlank() ? "cleanup-" + sequence : name);
        pending.put(sequence, new Entry(token, action));
        return token;
    }

    /**
     * Removes a pending action. Returns {@code false} when the token is unknown, already cancelled
     * or drain has already begun.
     */
    public synchronized boolean cancel(CleanupToken token) {
        if (token == null || token.owner() != this || draining) {
            return false;
        }
        return pending.remove(token.sequence()) != null;
    }

    public synchronized int pending() {
        return pending.size();
    }

    public synchronized boolean isDrained() {
        return draining;
    }

    /**
     * Runs every pending action in reverse registration order. Failures, including {@link Error}s,
     * are collected and never rethrown, so one failing action cannot prevent the rest from running.
     */
    public List<CleanupFailure> drain() {
        List<Entry> actions;
        synchronized (this) {
            if (draining) {
                throw new IllegalStateException("Cleanup registry already drained");
            }
            draining = true;
            actions = new ArrayList<>(pending.values());
            pending.clear();
        }
        log.debug("Draining {} cleanup action(s)", actions.size());
        List<CleanupFailure> failures = new ArrayList<>();
        for (int i = actions.size() - 1; i >= 0; i--) {
            var entry = actions.get(i);
            try {
                entry.action().run();
            } catch (Throwable ex) {
                log.warn("Cleanup action {} failed: {}", entry.token().name(), ex.toString());
                failures.add(CleanupFailure.of(entry.token(), ex));
            }
        }
        return List.copyOf(failures);
    }

    private record Entry(CleanupToken token, CleanupAction action) {}
}
