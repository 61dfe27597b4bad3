package io.laneboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Who performed an action. Supplied by the caller, never inferred.
 */
public enum Author {
    HUMAN("human"),
    AI("ai");

    private final String wireName;

    Author(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Author fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return AI;
        }
        for (Author value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown author: " + raw);
    }
}
