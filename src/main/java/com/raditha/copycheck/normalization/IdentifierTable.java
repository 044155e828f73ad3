package com.raditha.copycheck.normalization;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps identifier spellings to placeholders for one normalization pass.
 * The first identifier seen becomes {@code VAR_1}, the next new one
 * {@code VAR_2}, and so on for the whole document. A fresh table is created
 * for every pass so numbering never carries over between documents.
 */
public final class IdentifierTable {

    public static final String PLACEHOLDER_PREFIX = "VAR_";

    private final Map<String, String> placeholders = new LinkedHashMap<>();
    private int nextId = 1;

    /**
     * Placeholder for the identifier, assigning the next one on first sight.
     */
    public String placeholderFor(String identifier) {
        String placeholder = placeholders.get(identifier);
        if (placeholder == null) {
            placeholder = PLACEHOLDER_PREFIX + nextId;
            nextId++;
            placeholders.put(identifier, placeholder);
        }
        return placeholder;
    }

    public int size() {
        return placeholders.size();
    }

    /**
     * Identifier to placeholder mapping in encounter order.
     */
    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(placeholders);
    }
}
