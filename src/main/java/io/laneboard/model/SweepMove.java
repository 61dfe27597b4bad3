package io.laneboard.model;

public record SweepMove(String id, String column) {
}
