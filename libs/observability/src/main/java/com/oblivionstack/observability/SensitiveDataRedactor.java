package com.oblivionstack.observability;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive fields from row snapshots and log data before they are persisted or logged.
 * <p>
 * Matching is by field name, case-insensitive, on substrings: {@code password_hash},
 * {@code token_hash} and {@code credentials} all match the default patterns. Nested maps and
 * lists of maps (JSON columns such as integration credentials) are redacted recursively.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    /** Default field name fragments considered sensitive. */
    public static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /** Creates a redactor with the default sensitive field patterns. */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name fragments to treat as sensitive; must not be empty
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream().map(Pattern::quote).toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}. Null input returns
     * null so that "no snapshot" stays distinguishable from "empty snapshot".
     *
     * @param data row snapshot or log data (keys are field names)
     * @return a redacted copy, preserving key order
     */
    public Map<String, Object> redact(Map<String, Object> data) {
        if (data == null) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, Object> entry : data.entrySet()) {
            String key = entry.getKey();
            result.put(key, isSensitive(key) ? REDACTED : redactValue(entry.getValue()));
        }
        return result;
    }

    /**
     * Checks whether a field name contains any sensitive pattern (case-insensitive).
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    /** Returns the set of sensitive patterns this redactor uses. */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    @SuppressWarnings("unchecked")
    private Object redactValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return redact((Map<String, Object>) nested);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            for (Object element : list) {
                copy.add(redactValue(element));
            }
            return copy;
        }
        return value;
    }
}
