package villagecompute.messagegateway.integration.messaging;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.exceptions.ActionExecutionException;
import villagecompute.messagegateway.exceptions.BackoffSignalException;
import villagecompute.messagegateway.util.SchedulingClock;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link ActionExecutor} that forwards actions as JSON over HTTP to the host client bridge.
 *
 * <p>
 * <b>Bridge endpoints:</b>
 * <ul>
 * <li>{@code POST /send} with {@code {target, payload}} returning {@code {message_id, sent_at}}</li>
 * <li>{@code POST /history} with {@code {target_id, cursor, count}} returning {@code {records, next_cursor}}</li>
 * <li>{@code POST /actions/{verb}} with {@code {target, item, params}} returning a JSON object</li>
 * </ul>
 *
 * <p>
 * <b>Flood wait:</b> an HTTP 429 response (or a body carrying {@code flood_wait_seconds}) is translated into a
 * {@link BackoffSignalException} and remembered, so {@link #signalsBackoff()} stays true until the wait has passed.
 */
@ApplicationScoped
public class HttpActionExecutor implements ActionExecutor {

    private static final Logger LOG = Logger.getLogger(HttpActionExecutor.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    @ConfigProperty(
            name = "messagegateway.host.base-url")
    String baseUrl;

    @ConfigProperty(
            name = "messagegateway.host.timeout-seconds",
            defaultValue = "30")
    int timeoutSeconds;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    SchedulingClock clock;

    private final AtomicReference<Instant> backoffUntil = new AtomicReference<>(Instant.EPOCH);

    private HttpClient httpClient;

    @PostConstruct
    void init() {
        httpClient = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(timeoutSeconds)).build();
        LOG.infof("Host bridge configured at %s (timeout %ds)", baseUrl, timeoutSeconds);
    }

    @Override
    public CompletionStage<SendReceipt> send(String target, String payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("target", target);
        body.put("payload", payload);
        return post("/send", body).thenApply(root -> {
            String messageId = root.path("message_id").asText(null);
            String sentAt = root.path("sent_at").asText(null);
            return new SendReceipt(messageId, sentAt == null ? clock.now() : Instant.parse(sentAt));
        });
    }

    @Override
    public CompletionStage<HistoryPage> fetchBatch(String targetId, String cursor, int count) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("target_id", targetId);
        body.put("cursor", cursor);
        body.put("count", count);
        return post("/history", body).thenApply(root -> {
            List<HistoryRecord> records = new ArrayList<>();
            for (JsonNode node : root.path("records")) {
                String date = node.path("date").asText(null);
                records.add(new HistoryRecord(node.path("id").asLong(), date == null ? null : Instant.parse(date),
                        node.path("author").asText(null), node.path("text").asText("")));
            }
            JsonNode next = root.get("next_cursor");
            return new HistoryPage(records, next == null || next.isNull() ? null : next.asText());
        });
    }

    @Override
    public boolean signalsBackoff() {
        return clock.now().isBefore(backoffUntil.get());
    }

    @Override
    public CompletionStage<Map<String, Object>> perform(BatchVerb verb, String target, String item,
            Map<String, Object> params) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("target", target);
        body.put("item", item);
        body.put("params", params == null ? Map.of() : params);
        return post("/actions/" + verb.pathSegment(), body).thenApply(root -> {
            Map<String, Object> result = objectMapper.convertValue(root, MAP_TYPE);
            return result == null ? Map.of() : result;
        });
    }

    private CompletionStage<JsonNode> post(String path, Map<String, Object> body) {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder().uri(URI.create(baseUrl + path))
                    .timeout(Duration.ofSeconds(timeoutSeconds)).header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body))).build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(
                    new ActionExecutionException("Failed to build host request for " + path, e));
        }
        LOG.debugf("POST %s%s", baseUrl, path);
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> parse(path, response));
    }

    private JsonNode parse(String path, HttpResponse<String> response) {
        JsonNode root;
        try {
            root = response.body() == null || response.body().isBlank() ? objectMapper.createObjectNode()
                    : objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new ActionExecutionException("Host bridge returned malformed JSON for " + path, e);
        }

        long floodWait = root.path("flood_wait_seconds").asLong(0);
        if (response.statusCode() == 429 || floodWait > 0) {
            long waitSeconds = floodWait > 0 ? floodWait
                    : response.headers().firstValueAsLong("Retry-After").orElse(0);
            backoffUntil.set(clock.now().plusSeconds(waitSeconds));
            LOG.warnf("Host bridge requested backoff of %ds on %s", waitSeconds, path);
            throw new BackoffSignalException(waitSeconds, "Host is rate limiting, wait " + waitSeconds + "s");
        }
        if (response.statusCode() / 100 != 2) {
            String error = root.path("error").asText(response.body());
            throw new ActionExecutionException(
                    "Host bridge returned status " + response.statusCode() + " for " + path + ": " + error);
        }
        return root;
    }
}
