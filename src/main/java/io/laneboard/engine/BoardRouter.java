package io.laneboard.engine;

import io.laneboard.config.BoardSettings;
import io.laneboard.config.LaneBoardConfig;
import io.laneboard.error.NotFoundException;
import io.laneboard.error.ValidationException;
import io.laneboard.model.Board;
import io.laneboard.model.Column;
import io.laneboard.model.ColumnSpec;
import io.laneboard.storage.BoardStore;
import io.laneboard.storage.BoardStore.StoredBoard;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Maps instance names (a project, a repository) to board store keys and materializes boards on
 * first use when the settings allow it.
 */
public final class BoardRouter {
    public static final String DEFAULT_BOARD = "default";

    private final BoardStore store;
    private final BoardSettings settings;

    public BoardRouter(BoardStore store, BoardSettings settings) {
        this.store = store;
        this.settings = settings;
    }

    /**
     * Stable store key for an instance name; {@code owner/repo} becomes {@code owner-repo}.
     */
    public String key(String instance) {
        return LaneBoardConfig.sanitizeName(instance, DEFAULT_BOARD);
    }

    public Optional<StoredBoard> find(String key) {
        return store.get(key);
    }

    /**
     * Current snapshot for {@code key}. A missing board is created with the default columns when
     * {@code autoCreateBoards} is on (the default board always is), otherwise NOT_FOUND.
     */
    public StoredBoard load(String key, long nowMs) {
        Optional<StoredBoard> existing = store.get(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        if (!settings.autoCreateBoards() && !DEFAULT_BOARD.equals(key)) {
            throw NotFoundException.board(key);
        }
        store.insert(newBoard(key, null, nowMs));
        return store.get(key).orElseThrow(() -> NotFoundException.board(key));
    }

    /**
     * Fresh board with {@code specs} as its columns, or the configured defaults when null/empty.
     * Backlog and Done are always present, first and last.
     */
    public Board newBoard(String key, List<ColumnSpec> specs, long nowMs) {
        Map<String, Integer> limits = new LinkedHashMap<>();
        List<String> names;
        if (specs == null || specs.isEmpty()) {
            names = settings.defaultColumns();
            limits.putAll(settings.defaultWipLimits());
        } else {
            List<String> raw = new ArrayList<>();
            for (ColumnSpec spec : specs) {
                if (spec == null || spec.name() == null || spec.name().isBlank()) {
                    throw new ValidationException("Column name must not be blank");
                }
                if (spec.wipLimit() != null && spec.wipLimit() < 0) {
                    throw new ValidationException("WIP limit must not be negative: " + spec.name());
                }
                raw.add(spec.name().trim());
                if (spec.wipLimit() != null && spec.wipLimit() > 0) {
                    limits.put(spec.name().trim(), spec.wipLimit());
                }
            }
            names = BoardSettings.sanitizeColumns(raw, settings.defaultColumns());
        }
        List<Column> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(new Column(name, List.of(), limits.get(name)));
        }
        return new Board(key, columns, Map.of(), List.of(), null, nowMs, nowMs);
    }
}
