package io.laneboard.model;

public record Comment(String id, String taskId, Author author, String content, long createdAtMs) {
}
