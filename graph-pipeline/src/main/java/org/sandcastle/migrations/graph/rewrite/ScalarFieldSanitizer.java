package org.sandcastle.migrations.graph.rewrite;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Collectors;

import org.sandcastle.migrations.graph.ir.FieldSpec;

import lombok.extern.slf4j.Slf4j;

/**
 * Makes scalar source values acceptable to the target: enumerated values outside the target's
 * domain are replaced or dropped, string booleans become booleans, and e-mail addresses can be
 * made undeliverable.
 */
@Slf4j
public class ScalarFieldSanitizer {

    public static final String OTHER_VALUE = "Other";
    public static final String INVALID_EMAIL_SUFFIX = ".invalid";
    public static final int MULTI_VALUE_MAX_LENGTH = 255;
    private static final String MULTI_VALUE_SEPARATOR = ";";

    private final boolean maskEmails;

    public ScalarFieldSanitizer(boolean maskEmails) {
        this.maskEmails = maskEmails;
    }

    /** @return the value to send, or empty to leave the field out of the payload */
    public Optional<Object> sanitize(String entityType, FieldSpec field, Object value) {
        if (value == null || value instanceof Map) {
            return Optional.empty();
        }
        if (field.isEnumerated() && value instanceof String) {
            return field.multiValued()
                ? sanitizeMultiValue(entityType, field, (String) value)
                : sanitizeSingleValue(entityType, field, (String) value);
        }
        switch (field.valueType()) {
            case BOOLEAN:
                return sanitizeBoolean(entityType, field, value);
            case EMAIL:
                if (maskEmails && value instanceof String && !((String) value).endsWith(INVALID_EMAIL_SUFFIX)) {
                    return Optional.of(value + INVALID_EMAIL_SUFFIX);
                }
                return Optional.of(value);
            default:
                return Optional.of(value);
        }
    }

    private Optional<Object> sanitizeSingleValue(String entityType, FieldSpec field, String value) {
        if (field.allowedValues().contains(value)) {
            return Optional.of(value);
        }
        if (field.required()) {
            String replacement = field.allowedValues().contains(OTHER_VALUE)
                ? OTHER_VALUE
                : new TreeSet<>(field.allowedValues()).first();
            log.warn("{}.{}: '{}' is not allowed, using '{}'", entityType, field.name(), value, replacement);
            return Optional.of(replacement);
        }
        if (field.allowedValues().contains(OTHER_VALUE)) {
            log.warn("{}.{}: '{}' is not allowed, using '{}'", entityType, field.name(), value, OTHER_VALUE);
            return Optional.of(OTHER_VALUE);
        }
        log.warn("{}.{}: '{}' is not allowed, leaving the field out", entityType, field.name(), value);
        return Optional.empty();
    }

    private Optional<Object> sanitizeMultiValue(String entityType, FieldSpec field, String value) {
        List<String> selected = Arrays.stream(value.split(MULTI_VALUE_SEPARATOR))
            .map(String::trim)
            .filter(v -> !v.isEmpty())
            .collect(Collectors.toList());
        List<String> kept = selected.stream().filter(field.allowedValues()::contains).collect(Collectors.toList());
        if (kept.size() < selected.size()) {
            log.warn("{}.{}: dropped values not allowed by the target from '{}'", entityType, field.name(), value);
        }
        var fitting = new ArrayList<String>();
        int length = 0;
        for (String v : kept) {
            int needed = v.length() + (fitting.isEmpty() ? 0 : 1);
            if (length + needed > MULTI_VALUE_MAX_LENGTH) {
                log.warn("{}.{}: truncated to {} of {} values", entityType, field.name(), fitting.size(), kept.size());
                break;
            }
            fitting.add(v);
            length += needed;
        }
        if (fitting.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(String.join(MULTI_VALUE_SEPARATOR, fitting));
    }

    private static Optional<Object> sanitizeBoolean(String entityType, FieldSpec field, Object value) {
        if (value instanceof Boolean) {
            return Optional.of(value);
        }
        String text = String.valueOf(value);
        if ("true".equalsIgnoreCase(text)) {
            return Optional.of(Boolean.TRUE);
        }
        if ("false".equalsIgnoreCase(text)) {
            return Optional.of(Boolean.FALSE);
        }
        log.warn("{}.{}: '{}' is not a boolean, leaving the field out", entityType, field.name(), text);
        return Optional.empty();
    }
}
