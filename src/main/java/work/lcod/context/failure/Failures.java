package work.lcod.context.failure;

import java.util.concurrent.CancellationException;
import work.lcod.context.runtime.ContextCancelledException;

/**
 * Maps throwables raised during a run onto {@link Failure} values.
 */
public final class Failures {
    private Failures() {}

    public static Failure fromHandler(Throwable error) {
        if (error == null) {
            return new Failure(FailureKind.HANDLER, "unexpected_error", "Unexpected error", null, null);
        }
        if (isCancellation(error)) {
            return new Failure(FailureKind.CANCELLED, "cancelled", messageOf(error, "Execution cancelled"), null, error);
        }
        if (error instanceof HandlerFailureException hf) {
            return new Failure(FailureKind.HANDLER, hf.code(), messageOf(hf, "Handler failure"), hf.data(), hf);
        }
        return new Failure(FailureKind.HANDLER, "unexpected_error", messageOf(error, "Unexpected error"), null, error);
    }

    public static Failure fromEnvironment(Throwable error) {
        return new Failure(
            FailureKind.ENVIRONMENT,
            "environment_unavailable",
            messageOf(error, "Unable to build environment"),
            null,
            error
        );
    }

    static boolean isCancellation(Throwable error) {
        return error instanceof ContextCancelledException
            || error instanceof InterruptedException
            || error instanceof CancellationException;
    }

    private static String messageOf(Throwable error, String fallback) {
        var message = error.getMessage();
        if (message == null || message.isBlank()) {
            return fallback;
        }
        return message;
    }
}
