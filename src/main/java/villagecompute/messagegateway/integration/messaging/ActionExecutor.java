package villagecompute.messagegateway.integration.messaging;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * Boundary to the host messaging client.
 *
 * <p>
 * The scheduling core decides when and how fast things happen; implementations decide what an action means. All
 * methods return stages that complete exceptionally on failure:
 * <ul>
 * <li>{@link villagecompute.messagegateway.exceptions.BackoffSignalException} when the host is rate limiting us</li>
 * <li>{@link villagecompute.messagegateway.exceptions.ActionExecutionException} for any other single-action
 * failure</li>
 * </ul>
 */
public interface ActionExecutor {

    CompletionStage<SendReceipt> send(String target, String payload);

    /**
     * Fetches up to {@code count} history records of {@code targetId} starting after {@code cursor} (null for the
     * newest end). A page with a null {@code nextCursor} or no records means the source is exhausted.
     */
    CompletionStage<HistoryPage> fetchBatch(String targetId, String cursor, int count);

    /**
     * @return true while the host has asked us to back off (flood wait)
     */
    boolean signalsBackoff();

    /**
     * Runs one batch verb against one item (a target for sends, a message id for the others).
     *
     * @return verb-specific result data, never null
     */
    CompletionStage<Map<String, Object>> perform(BatchVerb verb, String target, String item, Map<String, Object> params);
}
