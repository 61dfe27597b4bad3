package io.laneboard.config;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WipPolicy {
    HARD_FAIL("hard_fail"),
    WARN("warn");

    private final String wireName;

    WipPolicy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static WipPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return HARD_FAIL;
        }
        for (WipPolicy value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown WIP policy: " + raw);
    }
}
