package work.lcod.context.failure;

/**
 * Explicit abort raised by handler or builder code, carrying a machine-readable code and optional data.
 */
public final class HandlerFailureException extends RuntimeException {
    private final String code;
    private final Object data;

    public HandlerFailureException(String code, String message) {
        this(code, message, null, null);
    }

    public HandlerFailureException(String code, String message, Object data) {
        this(code, message, data, null);
    }

    public HandlerFailureException(String code, String message, Object data, Throwable cause) {
        super(message, cause);
        this.code = code == null || code.isBlank() ? "handler_failure" : code;
        this.data = data;
    }

    public String code() {
        return code;
    }

    public Object data() {
        return data;
    }
}
