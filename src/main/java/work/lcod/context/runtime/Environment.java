package work.lcod.context.runtime;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Immutable request-scoped data: request metadata, application configuration and shared handles.
 * Request and configuration maps are deep-copied and frozen; handles are shared by reference.
 */
public record Environment(
    String requestId,
    Map<String, Object> request,
    Map<String, Object> configuration,
    Map<String, Object> handles,
    Instant receivedAt
) {
    public Environment {
        Objects.requireNonNull(requestId, "requestId");
        Objects.requireNonNull(receivedAt, "receivedAt");
        request = freeze(request);
        configuration = freeze(configuration);
        handles = handles == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(handles));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Environment empty() {
        return builder().build();
    }

    public Optional<Object> requestValue(String key) {
        return Optional.ofNullable(request.get(key));
    }

    /**
     * Looks up a configuration value by dotted path ({@code app.name}).
     */
    public Optional<Object> config(String path) {
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        Object current = configuration;
        for (String part : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return Optional.empty();
            }
            current = map.get(part);
            if (current == null) {
                return Optional.empty();
            }
        }
        return Optional.of(current);
    }

    public <T> Optional<T> handle(String name, Class<T> type) {
        Object value = handles.get(name);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    public Builder toBuilder() {
        return new Builder()
            .requestId(requestId)
            .request(request)
            .configuration(configuration)
            .handles(handles)
            .receivedAt(receivedAt);
    }

    private static Map<String, Object> freeze(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> frozen = (Map<String, Object>) deepFreeze(source);
        return frozen;
    }

    // Map.copyOf rejects null values, so nested copies go through unmodifiable wrappers.
    private static Object deepFreeze(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), deepFreeze(entry.getValue()));
            }
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object item : list) {
                copy.add(deepFreeze(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    public static final class Builder {
        private String requestId;
        private final Map<String, Object> request = new LinkedHashMap<>();
        private final Map<String, Object> configuration = new LinkedHashMap<>();
        private final Map<String, Object> handles = new LinkedHashMap<>();
        private Instant receivedAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder request(Map<String, Object> request) {
            if (request != null) {
                this.request.putAll(request);
            }
            return this;
        }

        public Builder requestValue(String key, Object value) {
            this.request.put(key, value);
            return this;
        }

        public Builder configuration(Map<String, Object> configuration) {
            if (configuration != null) {
                this.configuration.putAll(configuration);
            }
            return this;
        }

        public Builder handles(Map<String, Object> handles) {
            if (handles != null) {
                this.handles.putAll(handles);
            }
            return this;
        }

        public Builder handle(String name, Object handle) {
            this.handles.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(handle, "handle"));
            return this;
        }

        public Builder receivedAt(Instant receivedAt) {
            this.receivedAt = receivedAt;
            return this;
        }

        public Environment build() {
            return new Environment(
                requestId == null || requestId.isBlank() ? UUID.randomUUID().toString() : requestId,
                request,
                configuration,
                handles,
                receivedAt == null ? Instant.now() : receivedAt
            );
        }
    }
}
