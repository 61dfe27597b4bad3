package io.laneboard.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.laneboard.model.ArchivedTask;
import io.laneboard.model.Board;
import io.laneboard.model.BoardMeta;
import io.laneboard.model.Task;
import io.laneboard.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Whole-board snapshots keyed by board id. Writes are compare-and-swap on the row version; the
 * store never merges, callers re-read and re-apply on conflict.
 */
public class BoardStore {
    private final Database database;
    private final String namespace;

    public BoardStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    public Optional<StoredBoard> get(String boardId) {
        String sql = "SELECT snapshot,version FROM boards WHERE namespace=? AND board_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, boardId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                Board board = readSnapshot(rs.getString("snapshot"), boardId);
                return Optional.of(new StoredBoard(board, rs.getLong("version")));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read board: " + boardId, e);
        }
    }

    /**
     * Inserts a new board at version 1. Returns false when a board with that id already exists.
     */
    public boolean insert(Board board) {
        String sql = "INSERT OR IGNORE INTO boards(board_id,namespace,snapshot,task_count,version,created_at_ms,updated_at_ms) VALUES(?,?,?,?,1,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, board.name());
            ps.setString(2, namespace);
            ps.setString(3, writeSnapshot(board));
            ps.setInt(4, board.tasks().size());
            ps.setLong(5, board.createdAtMs());
            ps.setLong(6, board.updatedAtMs());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to insert board: " + board.name(), e);
        }
    }

    /**
     * Replaces the snapshot if the stored version still equals {@code expectedVersion}, and records
     * {@code archived} in the same transaction.
     *
     * @return the new version, or empty when another writer got there first
     */
    public OptionalLong compareAndSet(Board next, long expectedVersion, List<ArchivedTask> archived) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement update = c.prepareStatement(
                    "UPDATE boards SET snapshot=?,task_count=?,version=version+1,updated_at_ms=? WHERE namespace=? AND board_id=? AND version=?");
                 PreparedStatement archive = c.prepareStatement(
                         "INSERT INTO archived_tasks(namespace,board_id,task_id,from_column,payload,archived_at_ms) VALUES(?,?,?,?,?,?)")) {
                update.setString(1, writeSnapshot(next));
                update.setInt(2, next.tasks().size());
                update.setLong(3, next.updatedAtMs());
                update.setString(4, namespace);
                update.setString(5, next.name());
                update.setLong(6, expectedVersion);
                if (update.executeUpdate() == 0) {
                    c.rollback();
                    return OptionalLong.empty();
                }
                if (archived != null) {
                    for (ArchivedTask row : archived) {
                        archive.setString(1, namespace);
                        archive.setString(2, next.name());
                        archive.setString(3, row.task().id());
                        archive.setString(4, row.column());
                        archive.setString(5, Jsons.toCompactJson(row.task()));
                        archive.setLong(6, row.archivedAtMs());
                        archive.addBatch();
                    }
                    archive.executeBatch();
                }
                c.commit();
                return OptionalLong.of(expectedVersion + 1L);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to write board: " + next.name(), e);
        }
    }

    public boolean delete(String boardId) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement board = c.prepareStatement("DELETE FROM boards WHERE namespace=? AND board_id=?");
                 PreparedStatement archive = c.prepareStatement("DELETE FROM archived_tasks WHERE namespace=? AND board_id=?")) {
                board.setString(1, namespace);
                board.setString(2, boardId);
                int removed = board.executeUpdate();
                archive.setString(1, namespace);
                archive.setString(2, boardId);
                archive.executeUpdate();
                c.commit();
                return removed > 0;
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to delete board: " + boardId, e);
        }
    }

    public List<BoardMeta> list() {
        String sql = "SELECT board_id,task_count,version,created_at_ms,updated_at_ms FROM boards WHERE namespace=? ORDER BY updated_at_ms DESC, board_id";
        List<BoardMeta> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new BoardMeta(
                            rs.getString("board_id"),
                            rs.getInt("task_count"),
                            rs.getLong("version"),
                            rs.getLong("created_at_ms"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list boards", e);
        }
    }

    public List<ArchivedTask> listArchived(String boardId, int limit) {
        String sql = """
                SELECT from_column,payload,archived_at_ms FROM archived_tasks
                WHERE namespace=? AND board_id=?
                ORDER BY archived_at_ms DESC, id DESC
                LIMIT ?
                """;
        List<ArchivedTask> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setString(2, boardId);
            ps.setInt(3, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    Task task = Jsons.mapper().readValue(rs.getString("payload"), Task.class);
                    out.add(new ArchivedTask(boardId, task, rs.getString("from_column"), rs.getLong("archived_at_ms")));
                }
            }
            return out;
        } catch (SQLException | JsonProcessingException e) {
            throw new RuntimeException("Failed to list archived tasks: " + boardId, e);
        }
    }

    public int purgeArchivedOlderThan(long cutoffMs) {
        String sql = "DELETE FROM archived_tasks WHERE namespace=? AND archived_at_ms<?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, namespace);
            ps.setLong(2, cutoffMs);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to purge archived tasks", e);
        }
    }

    private Board readSnapshot(String json, String boardId) {
        try {
            return Jsons.mapper().readValue(json, Board.class);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt board snapshot: " + boardId, e);
        }
    }

    private String writeSnapshot(Board board) {
        return Jsons.toCompactJson(board);
    }

    public record StoredBoard(Board board, long version) {
    }
}
