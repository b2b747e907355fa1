package work.lcod.context.runtime;

/**
 * Cooperative cancellation flag shared between a request's transport and its context.
 */
public final class CancellationToken {
    private volatile String reason;

    public void cancel() {
        cancel("Execution cancelled");
    }

    public void cancel(String reason) {
        if (this.reason == null) {
            this.reason = reason == null || reason.isBlank() ? "Execution cancelled" : reason;
        }
    }

    public boolean isCancelled() {
        return reason != null;
    }

    public String reason() {
        return reason;
    }
}
