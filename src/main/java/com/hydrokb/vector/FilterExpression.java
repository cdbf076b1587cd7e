package com.hydrokb.vector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Conjunction of equality tests over record metadata. Supported fields are {@code category},
 * {@code region} (matches any of the record's region tags) and {@code language}.
 */
public final class FilterExpression {
    public static final String CATEGORY = "category";
    public static final String REGION = "region";
    public static final String LANGUAGE = "language";

    private static final List<String> FIELDS = List.of(CATEGORY, REGION, LANGUAGE);
    private static final FilterExpression NONE = new FilterExpression(Map.of());

    private final Map<String, String> equalities;

    private FilterExpression(Map<String, String> equalities) {
        this.equalities = equalities;
    }

    public static FilterExpression none() {
        return NONE;
    }

    public static FilterExpression of(String category, String region, String language) {
        return none().and(CATEGORY, category).and(REGION, region).and(LANGUAGE, language);
    }

    /**
     * Adds {@code field == value}. Null or blank values leave the expression unchanged.
     */
    public FilterExpression and(String field, String value) {
        if (!FIELDS.contains(field)) {
            throw new IllegalArgumentException("Unsupported filter field: " + field);
        }
        if (value == null || value.isBlank()) {
            return this;
        }
        Map<String, String> next = new LinkedHashMap<>(equalities);
        next.put(field, value);
        return new FilterExpression(Collections.unmodifiableMap(next));
    }

    public boolean isEmpty() {
        return equalities.isEmpty();
    }

    public Map<String, String> equalities() {
        return equalities;
    }

    public boolean matches(VectorRecord record) {
        for (Map.Entry<String, String> entry : equalities.entrySet()) {
            String wanted = entry.getValue();
            boolean ok = switch (entry.getKey()) {
                case CATEGORY -> wanted.equals(record.category());
                case LANGUAGE -> wanted.equals(record.language());
                case REGION -> record.regions().stream()
                        .anyMatch(tag -> tag.toLowerCase(Locale.ROOT).equals(wanted.toLowerCase(Locale.ROOT)));
                default -> false;
            };
            if (!ok) {
                return false;
            }
        }
        return true;
    }

    /**
     * Milvus boolean expression over the JSON {@code metadata} field, or an empty string.
     */
    public String toMilvus() {
        return equalities.entrySet().stream()
                .map(entry -> entry.getKey().equals(REGION)
                        ? "json_contains(metadata[\"regions\"], " + quote(entry.getValue()) + ")"
                        : "metadata[\"" + entry.getKey() + "\"] == " + quote(entry.getValue()))
                .collect(Collectors.joining(" && "));
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    @Override
    public String toString() {
        return isEmpty() ? "<none>" : toMilvus();
    }
}
