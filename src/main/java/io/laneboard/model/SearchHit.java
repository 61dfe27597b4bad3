package io.laneboard.model;

/**
 * Match from a search across every board, tagged with the board it came from.
 */
public record SearchHit(String board, TaskView task) {
}
