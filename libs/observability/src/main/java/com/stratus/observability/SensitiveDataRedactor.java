package com.stratus.observability;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Redacts sensitive fields from log record metadata before it leaves the function.
 * <p>
 * Default sensitive patterns: password, token, secret, authorization, apikey, api_key,
 * credential. A key matches if it contains a pattern, case-insensitively. Nested maps and
 * collections of maps (request headers, query parameters) are redacted recursively.
 */
public final class SensitiveDataRedactor {

    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "apikey", "api_key", "credential"
    );

    private static final int MAX_DEPTH = 8;

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns key fragments to redact; matched case-insensitively anywhere in the key
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Copies the metadata, replacing the value of every sensitive key with {@value #REDACTED}.
     * Key order is preserved; null becomes an empty map. Below {@code MAX_DEPTH} levels of
     * nesting values are copied as they are.
     */
    public Map<String, Object> redact(Map<String, ?> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        return redactMap(metadata, 0);
    }

    /** True if the key contains one of the patterns, ignoring case. */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }

    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }

    private Map<String, Object> redactMap(Map<?, ?> data, int depth) {
        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<?, ?> entry : data.entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (isSensitive(key)) {
                result.put(key, REDACTED);
            } else {
                result.put(key, redactValue(entry.getValue(), depth + 1));
            }
        }
        return result;
    }

    private Object redactValue(Object value, int depth) {
        if (depth > MAX_DEPTH) {
            return value;
        }
        if (value instanceof Map<?, ?> nested) {
            return redactMap(nested, depth);
        }
        if (value instanceof Collection<?> items) {
            List<Object> copy = new ArrayList<>(items.size());
            for (Object item : items) {
                copy.add(redactValue(item, depth + 1));
            }
            return copy;
        }
        return value;
    }
}
