package work.lcod.context.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Mutable per-request state slot. Values are never rolled back when the handler fails;
 * whatever was last written stays visible until the context is discarded. All access is
 * serialized on the cell's monitor, which is reentrant, so a {@link #modify} function may
 * read or write other keys.
 */
public final class StateCell {
    private final Map<String, Object> values = new LinkedHashMap<>();

    StateCell() {}

    public synchronized Optional<Object> read(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    public <T> Optional<T> read(String key, Class<T> type) {
        return read(key).filter(type::isInstance).map(type::cast);
    }

    /**
     * Replaces the value stored under {@code key}; a {@code null} value removes the key.
     */
    public synchronized void write(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    /**
     * Atomic read-modify-write. {@code fn} sees the current value and returns the replacement;
     * returning {@code null} removes the key.
     */
    public synchronized void modify(String key, Function<Optional<Object>, Object> fn) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fn, "fn");
        write(key, fn.apply(Optional.ofNullable(values.get(key))));
    }

    public synchronized Optional<Object> remove(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.remove(key));
    }

    public synchronized boolean contains(String key) {
        return key != null && values.containsKey(key);
    }

    public synchronized Map<String, Object> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
