package org.sandcastle.migrations.store;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * One error entry from an API response body. Single-record calls report {@code errorCode},
 * composite calls report {@code statusCode}; both land in {@link #code()}.
 */
record ApiError(String code, String message, List<String> fields) {
    static final String DUPLICATE_VALUE = "DUPLICATE_VALUE";
    static final String NOT_FOUND = "NOT_FOUND";

    private static final Pattern DUPLICATE_ID = Pattern.compile("with id:\\s*([A-Za-z0-9]{15,18})");

    static List<ApiError> parse(ObjectMapper objectMapper, String body) {
        if (body == null || body.isBlank()) {
            return List.of();
        }
        try {
            return fromNode(objectMapper.readTree(body));
        } catch (JsonProcessingException e) {
            return List.of(new ApiError(null, body, List.of()));
        }
    }

    static List<ApiError> fromNode(JsonNode node) {
        var errors = new ArrayList<ApiError>();
        if (node == null || node.isNull()) {
            return errors;
        }
        if (node.isArray()) {
            node.forEach(n -> errors.addAll(fromNode(n)));
            return errors;
        }
        String code = node.hasNonNull("errorCode") ? node.get("errorCode").asText()
            : node.hasNonNull("statusCode") ? node.get("statusCode").asText() : null;
        var fields = new ArrayList<String>();
        if (node.has("fields")) {
            node.get("fields").forEach(f -> fields.add(f.asText()));
        }
        errors.add(new ApiError(code, node.path("message").asText(""), fields));
        return errors;
    }

    static String describe(List<ApiError> errors) {
        return errors.stream().map(ApiError::toString).collect(Collectors.joining("; "));
    }

    /** The existing record named by the first duplicate-value error, if any names one. */
    static Optional<String> duplicateId(List<ApiError> errors) {
        for (ApiError error : errors) {
            if (error.isDuplicate() && error.message() != null) {
                Matcher matcher = DUPLICATE_ID.matcher(error.message());
                if (matcher.find()) {
                    return Optional.of(matcher.group(1));
                }
            }
        }
        return Optional.empty();
    }

    static boolean anyDuplicate(List<ApiError> errors) {
        return errors.stream().anyMatch(ApiError::isDuplicate);
    }

    boolean isDuplicate() {
        return DUPLICATE_VALUE.equals(code);
    }

    @Override
    public String toString() {
        return (code != null ? code + ": " : "") + message + (fields.isEmpty() ? "" : " " + fields);
    }
}
