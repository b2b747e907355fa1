package work.lcod.context.failure;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Primary failure of a run.
 */
public record Failure(FailureKind kind, String code, String message, Object data, Throwable cause) {
    public Failure {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.name().toLowerCase());
        map.put("code", code);
        map.put("message", message);
        if (data != null) {
            map.put("data", data);
        }
        return map;
    }
}
