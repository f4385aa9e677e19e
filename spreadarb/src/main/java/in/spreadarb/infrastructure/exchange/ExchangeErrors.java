package in.spreadarb.infrastructure.exchange;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Helpers for interpreting failures that come back through futures.
 */
public final class ExchangeErrors {

    /**
     * Strip CompletionException/ExecutionException wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Timeouts and {@link ExchangeException#isTransient()} failures.
     */
    public static boolean isTransient(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) return true;
        return cause instanceof ExchangeException && ((ExchangeException) cause).isTransient();
    }

    public static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return "timed out";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    private ExchangeErrors() {}
}
