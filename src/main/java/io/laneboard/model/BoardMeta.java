package io.laneboard.model;

public record BoardMeta(String name, int taskCount, long version, long createdAtMs, long updatedAtMs) {
}
