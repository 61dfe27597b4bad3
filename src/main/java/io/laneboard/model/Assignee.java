package io.laneboard.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Assignee {
    HUMAN("human"),
    AI("ai"),
    UNASSIGNED("unassigned");

    private final String wireName;

    Assignee(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static Assignee fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNASSIGNED;
        }
        for (Assignee value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown assignee: " + raw);
    }
}
