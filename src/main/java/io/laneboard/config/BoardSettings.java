package io.laneboard.config;

import io.laneboard.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Effective engine settings. Read from {@code laneboard-settings.json} in the namespace root;
 * every field is optional and out-of-range values fall back to (or are clamped against) the
 * defaults.
 */
public record BoardSettings(
        WipPolicy wipPolicy,
        List<String> defaultColumns,
        Map<String, Integer> defaultWipLimits,
        List<String> gatedColumns,
        long lockTimeoutMs,
        long lockLeaseMs,
        int doneRetention,
        int staleDoneDays,
        int archiveRetentionDays,
        boolean autoCreateBoards
) {
    public static final String BACKLOG = "Backlog";
    public static final String DONE = "Done";
    public static final List<String> DEFAULT_COLUMNS = List.of(BACKLOG, "Todo", "In Progress", "Review", DONE);
    public static final long DEFAULT_LOCK_TIMEOUT_MS = 5_000L;
    public static final long DEFAULT_LOCK_LEASE_MS = 30_000L;
    public static final int DEFAULT_DONE_RETENTION = 50;
    public static final int DEFAULT_STALE_DONE_DAYS = 7;
    public static final int DEFAULT_ARCHIVE_RETENTION_DAYS = 30;

    public BoardSettings {
        defaultColumns = List.copyOf(defaultColumns);
        defaultWipLimits = Map.copyOf(defaultWipLimits);
        gatedColumns = gatedColumns == null ? null : List.copyOf(gatedColumns);
    }

    public static BoardSettings defaults() {
        return new BoardSettings(
                WipPolicy.HARD_FAIL,
                DEFAULT_COLUMNS,
                Map.of(),
                null,
                DEFAULT_LOCK_TIMEOUT_MS,
                DEFAULT_LOCK_LEASE_MS,
                DEFAULT_DONE_RETENTION,
                DEFAULT_STALE_DONE_DAYS,
                DEFAULT_ARCHIVE_RETENTION_DAYS,
                true
        );
    }

    public static BoardSettings load(Path file) {
        BoardSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    static BoardSettings fromFile(SettingsFile file, BoardSettings defaults) {
        if (file == null) {
            return defaults;
        }
        WipPolicy policy = file.wipPolicy() == null ? defaults.wipPolicy() : WipPolicy.fromString(file.wipPolicy());
        List<String> columns = sanitizeColumns(file.defaultColumns(), defaults.defaultColumns());
        Map<String, Integer> limits = new LinkedHashMap<>();
        if (file.defaultWipLimits() != null) {
            for (Map.Entry<String, Integer> e : file.defaultWipLimits().entrySet()) {
                if (e.getKey() != null && columns.contains(e.getKey().trim()) && e.getValue() != null && e.getValue() > 0) {
                    limits.put(e.getKey().trim(), e.getValue());
                }
            }
        }
        List<String> gated = null;
        if (file.gatedColumns() != null) {
            LinkedHashSet<String> unique = new LinkedHashSet<>();
            for (String raw : file.gatedColumns()) {
                if (raw != null && !raw.isBlank()) {
                    unique.add(raw.trim());
                }
            }
            gated = new ArrayList<>(unique);
        }
        long lockTimeout = sanitizeLong(file.lockTimeoutMs(), defaults.lockTimeoutMs(), 0L);
        long lockLease = sanitizeLong(file.lockLeaseMs(), defaults.lockLeaseMs(), 100L);
        int doneRetention = sanitizeInt(file.doneRetention(), defaults.doneRetention(), 0);
        int staleDays = sanitizeInt(file.staleDoneDays(), defaults.staleDoneDays(), 1);
        int archiveDays = sanitizeInt(file.archiveRetentionDays(), defaults.archiveRetentionDays(), 1);
        boolean autoCreate = file.autoCreateBoards() == null ? defaults.autoCreateBoards() : file.autoCreateBoards();
        return new BoardSettings(policy, columns, limits, gated, lockTimeout, lockLease,
                doneRetention, staleDays, archiveDays, autoCreate);
    }

    public BoardSettings withWipPolicy(WipPolicy policy) {
        return new BoardSettings(policy, defaultColumns, defaultWipLimits, gatedColumns, lockTimeoutMs,
                lockLeaseMs, doneRetention, staleDoneDays, archiveRetentionDays, autoCreateBoards);
    }

    public BoardSettings withLockTimeoutMs(long timeoutMs) {
        return new BoardSettings(wipPolicy, defaultColumns, defaultWipLimits, gatedColumns, Math.max(0L, timeoutMs),
                lockLeaseMs, doneRetention, staleDoneDays, archiveRetentionDays, autoCreateBoards);
    }

    public BoardSettings withDoneRetention(int retention) {
        return new BoardSettings(wipPolicy, defaultColumns, defaultWipLimits, gatedColumns, lockTimeoutMs,
                lockLeaseMs, Math.max(0, retention), staleDoneDays, archiveRetentionDays, autoCreateBoards);
    }

    public BoardSettings withAutoCreateBoards(boolean autoCreate) {
        return new BoardSettings(wipPolicy, defaultColumns, defaultWipLimits, gatedColumns, lockTimeoutMs,
                lockLeaseMs, doneRetention, staleDoneDays, archiveRetentionDays, autoCreate);
    }

    /**
     * Keeps declared order, drops blanks and duplicates, and pins Backlog first and Done last.
     */
    public static List<String> sanitizeColumns(List<String> raw, List<String> fallback) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        LinkedHashSet<String> middle = new LinkedHashSet<>();
        for (String name : raw) {
            if (name == null || name.isBlank()) {
                continue;
            }
            String trimmed = name.trim();
            if (!BACKLOG.equals(trimmed) && !DONE.equals(trimmed)) {
                middle.add(trimmed);
            }
        }
        List<String> out = new ArrayList<>(middle.size() + 2);
        out.add(BACKLOG);
        out.addAll(middle);
        out.add(DONE);
        return out;
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    record SettingsFile(
            String wipPolicy,
            List<String> defaultColumns,
            Map<String, Integer> defaultWipLimits,
            List<String> gatedColumns,
            Long lockTimeoutMs,
            Long lockLeaseMs,
            Integer doneRetention,
            Integer staleDoneDays,
            Integer archiveRetentionDays,
            Boolean autoCreateBoards
    ) {
    }
}
