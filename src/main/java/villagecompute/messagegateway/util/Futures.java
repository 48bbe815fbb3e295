package villagecompute.messagegateway.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Helpers for {@link CompletionStage} based orchestration.
 */
public final class Futures {

    private Futures() {
        // Utility class, no instantiation
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers added by stage composition.
     */
    public static Throwable unwrap(Throwable failure) {
        Throwable current = failure;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Invokes {@code action}, turning a synchronous throw or a null result into a failed stage so callers only have
     * one failure path to handle.
     */
    public static <T> CompletionStage<T> invoke(Supplier<? extends CompletionStage<T>> action) {
        try {
            CompletionStage<T> stage = action.get();
            if (stage == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("Action returned no result"));
            }
            return stage;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Human-readable message of an unwrapped failure, falling back to its class name.
     */
    public static String describe(Throwable failure) {
        Throwable cause = unwrap(failure);
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
