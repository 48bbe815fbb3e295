package villagecompute.messagegateway.services;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Typed access to the JSON arguments of a tool call. Missing or ill-typed values raise {@link ValidationException}
 * with kind {@code INVALID_ARGUMENT}.
 *
 * <p>
 * Chat and message ids are accepted as JSON numbers or strings and handed on as strings.
 */
final class ToolArguments {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonNode node;

    private ToolArguments(JsonNode node) {
        this.node = node;
    }

    static ToolArguments of(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return new ToolArguments(JsonNodeFactory.instance.objectNode());
        }
        if (!node.isObject()) {
            throw invalid("Tool arguments must be a JSON object");
        }
        return new ToolArguments(node);
    }

    boolean has(String name) {
        JsonNode value = node.get(name);
        return value != null && !value.isNull();
    }

    String requiredText(String name) {
        return optionalText(name).orElseThrow(() -> invalid(name + " is required"));
    }

    Optional<String> optionalText(String name) {
        if (!has(name)) {
            return Optional.empty();
        }
        JsonNode value = node.get(name);
        if (!value.isValueNode()) {
            throw invalid(name + " must be a string or number");
        }
        String text = value.asText();
        return text.isBlank() ? Optional.empty() : Optional.of(text);
    }

    long requiredLong(String name) {
        return optionalLong(name).orElseThrow(() -> invalid(name + " is required"));
    }

    Optional<Long> optionalLong(String name) {
        if (!has(name)) {
            return Optional.empty();
        }
        JsonNode value = node.get(name);
        if (value.isNumber() && value.canConvertToExactIntegral()) {
            return Optional.of(value.asLong());
        }
        if (value.isTextual()) {
            try {
                return Optional.of(Long.parseLong(value.asText().trim()));
            } catch (NumberFormatException e) {
                throw new ValidationException(ErrorKind.INVALID_ARGUMENT, name + " must be a whole number", e);
            }
        }
        throw invalid(name + " must be a whole number");
    }

    Optional<Integer> optionalInt(String name) {
        return optionalLong(name).map(value -> {
            if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
                throw invalid(name + " is out of range");
            }
            return value.intValue();
        });
    }

    Optional<Boolean> optionalBoolean(String name) {
        if (!has(name)) {
            return Optional.empty();
        }
        JsonNode value = node.get(name);
        if (value.isBoolean()) {
            return Optional.of(value.booleanValue());
        }
        throw invalid(name + " must be true or false");
    }

    /**
     * Non-empty array of ids, each rendered as text.
     */
    List<String> requiredIdList(String name) {
        JsonNode value = node.get(name);
        if (value == null || !value.isArray() || value.isEmpty()) {
            throw invalid(name + " must be a non-empty array");
        }
        List<String> ids = new ArrayList<>();
        for (JsonNode element : value) {
            if (!element.isValueNode() || element.isNull() || element.asText().isBlank()) {
                throw invalid(name + " must only contain ids");
            }
            ids.add(element.asText());
        }
        return ids;
    }

    /**
     * Arguments other than {@code excluded}, converted to plain Java values.
     */
    Map<String, Object> remainingAsMap(Set<String> excluded) {
        Map<String, Object> values = new LinkedHashMap<>();
        node.fields().forEachRemaining(entry -> {
            if (!excluded.contains(entry.getKey())) {
                values.put(entry.getKey(), MAPPER.convertValue(entry.getValue(), Object.class));
            }
        });
        return values;
    }

    private static ValidationException invalid(String message) {
        return new ValidationException(ErrorKind.INVALID_ARGUMENT, message);
    }
}
