package io.laneboard.model;

public record ColumnSpec(String name, Integer wipLimit) {
    public static ColumnSpec of(String name) {
        return new ColumnSpec(name, null);
    }
}
