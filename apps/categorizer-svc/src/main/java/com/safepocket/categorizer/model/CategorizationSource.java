package com.safepocket.categorizer.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CategorizationSource {
    INTERNAL_TRANSFER("internal_transfer"),
    MANUAL_RULE("manual_rule"),
    AI("ai"),
    UNCATEGORIZED("uncategorized");

    private final String wireName;

    CategorizationSource(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
