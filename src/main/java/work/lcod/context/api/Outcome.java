package work.lcod.context.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.lcod.context.failure.Failure;
import work.lcod.context.failure.FailureKind;
import work.lcod.context.runtime.Built;
import work.lcod.context.runtime.CleanupFailure;

/**
 * Terminal result of a {@link Runner} call: a success value or the primary failure, plus every
 * cleanup failure and the final state snapshot. Cleanup failures are attached on success too.
 */
public record Outcome<T>(
    Status status,
    String requestId,
    Optional<T> value,
    Optional<Failure> failure,
    List<CleanupFailure> cleanupFailures,
    Map<String, Object> state,
    Instant startedAt,
    Instant finishedAt
) {
    private static final ObjectWriter WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    public Outcome {
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(failure, "failure");
        if (status == Status.FAILURE && failure.isEmpty()) {
            throw new IllegalArgumentException("Failure outcome requires a failure");
        }
        cleanupFailures = cleanupFailures == null ? List.of() : List.copyOf(cleanupFailures);
        state = state == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    public static <T> Outcome<T> success(
        String requestId,
        T value,
        List<CleanupFailure> cleanupFailures,
        Map<String, Object> state,
        Instant startedAt
    ) {
        return new Outcome<>(
            Status.SUCCESS,
            requestId,
            Optional.ofNullable(value),
            Optional.empty(),
            cleanupFailures,
            state,
            startedAt,
            Instant.now()
        );
    }

    public static <T> Outcome<T> failure(
        String requestId,
        Failure failure,
        List<CleanupFailure> cleanupFailures,
        Map<String, Object> state,
        Instant startedAt
    ) {
        return new Outcome<>(
            Status.FAILURE,
            requestId,
            Optional.empty(),
            Optional.of(failure),
            cleanupFailures,
            state,
            startedAt,
            Instant.now()
        );
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public boolean hasCleanupFailures() {
        return !cleanupFailures.isEmpty();
    }

    public Optional<FailureKind> failureKind() {
        return failure.map(Failure::kind);
    }

    /**
     * Returns the success value or throws {@link IllegalStateException} describing the failure.
     */
    public T orElseThrow() {
        if (status == Status.FAILURE) {
            var primary = failure.orElseThrow();
            throw new IllegalStateException(primary.kind() + ": " + primary.message(), primary.cause());
        }
        return value.orElse(null);
    }

    public Map<String, Object> toSerializableMap() {
        Map<String, Object> serializable = new LinkedHashMap<>();
        serializable.put("status", status.name().toLowerCase());
        if (requestId != null) {
            serializable.put("requestId", requestId);
        }
        value.ifPresent(v -> serializable.put("value", serializableValue(v)));
        failure.ifPresent(f -> serializable.put("failure", f.toMap()));
        List<Map<String, Object>> cleanup = new ArrayList<>();
        for (var entry : cleanupFailures) {
            var map = new LinkedHashMap<String, Object>();
            map.put("name", entry.name());
            map.put("sequence", entry.sequence());
            map.put("message", entry.message());
            cleanup.add(map);
        }
        serializable.put("cleanupFailures", cleanup);
        serializable.put("state", state);
        serializable.put("startedAt", String.valueOf(startedAt));
        serializable.put("finishedAt", String.valueOf(finishedAt));
        return serializable;
    }

    public String toPrettyJson() {
        try {
            return WRITER.writeValueAsString(toSerializableMap());
        } catch (Exception ex) {
            return "{\"status\":\"error\",\"message\":\"" + ex.getMessage() + "\"}";
        }
    }

    private static Object serializableValue(Object value) {
        if (value instanceof Built<?, ?> built) {
            var map = new LinkedHashMap<String, Object>();
            map.put("value", built.value() == null ? null : serializableValue(built.value()));
            map.put("fragments", built.output().fragments());
            map.put("metadata", new ArrayList<>(built.output().metadata()));
            return map;
        }
        return value;
    }

    public enum Status {
        SUCCESS(0),
        FAILURE(1);

        private final int exitCode;

        Status(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }
}
