package io.laneboard.lock;

import io.laneboard.error.LockTimeoutException;
import io.laneboard.storage.Database;
import io.laneboard.util.Ids;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Function;

/**
 * Lease-based lock stored in the {@code board_locks} table. A lease that outlives
 * {@code leaseMs} (crashed holder) may be taken over; each grant bumps the fencing epoch.
 */
public final class SqliteLockManager implements LockManager {
    private static final long MIN_BACKOFF_MS = 5L;
    private static final long MAX_BACKOFF_MS = 50L;

    private final Database database;
    private final String owner;
    private final long timeoutMs;
    private final long leaseMs;
    private final Clock clock;

    public SqliteLockManager(Database database, String owner, long timeoutMs, long leaseMs, Clock clock) {
        this.database = database;
        this.owner = owner == null || owner.isBlank() ? "laneboard" : owner.trim();
        this.timeoutMs = Math.max(0L, timeoutMs);
        this.leaseMs = Math.max(1L, leaseMs);
        this.clock = clock;
    }

    @Override
    public <T> T withLock(String key, Function<LockGrant, T> body) {
        LockGrant grant = acquire(key);
        try {
            return body.apply(grant);
        } finally {
            release(grant);
        }
    }

    LockGrant acquire(String key) {
        long started = clock.millis();
        String token = Ids.newLockToken();
        while (true) {
            Optional<LockGrant> grant = tryAcquire(key, token, clock.millis());
            if (grant.isPresent()) {
                return grant.get();
            }
            long waited = clock.millis() - started;
            if (waited >= timeoutMs) {
                throw new LockTimeoutException(key, waited, currentHolder(key));
            }
            long backoff = ThreadLocalRandom.current().nextLong(MIN_BACKOFF_MS, MAX_BACKOFF_MS + 1);
            try {
                Thread.sleep(Math.min(backoff, Math.max(1L, timeoutMs - waited)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockTimeoutException(key, clock.millis() - started, currentHolder(key));
            }
        }
    }

    Optional<LockGrant> tryAcquire(String key, String token, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement seed = c.prepareStatement(
                    "INSERT OR IGNORE INTO board_locks(lock_key,fencing_epoch,updated_at_ms) VALUES(?,0,?)");
                 PreparedStatement take = c.prepareStatement(
                         "UPDATE board_locks SET lock_owner=?,lock_token=?,fencing_epoch=fencing_epoch+1,acquired_at_ms=?,expires_at_ms=?,updated_at_ms=? "
                                 + "WHERE lock_key=? AND (lock_token IS NULL OR expires_at_ms<?)");
                 PreparedStatement epoch = c.prepareStatement("SELECT fencing_epoch FROM board_locks WHERE lock_key=?")) {
                seed.setString(1, key);
                seed.setLong(2, nowMs);
                seed.executeUpdate();
                take.setString(1, owner);
                take.setString(2, token);
                take.setLong(3, nowMs);
                take.setLong(4, nowMs + leaseMs);
                take.setLong(5, nowMs);
                take.setString(6, key);
                take.setLong(7, nowMs);
                if (take.executeUpdate() == 0) {
                    c.rollback();
                    return Optional.empty();
                }
                long fencingEpoch;
                epoch.setString(1, key);
                try (ResultSet rs = epoch.executeQuery()) {
                    fencingEpoch = rs.next() ? rs.getLong(1) : 0L;
                }
                c.commit();
                return Optional.of(new LockGrant(key, owner, token, fencingEpoch));
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            if (isBusy(e)) {
                return Optional.empty();
            }
            throw new RuntimeException("Failed to acquire lock: " + key, e);
        }
    }

    /**
     * Releases only if {@code grant} still holds the lease; a holder that was taken over after
     * expiry cannot clear the new holder's row.
     */
    boolean release(LockGrant grant) {
        String sql = "UPDATE board_locks SET lock_owner=NULL,lock_token=NULL,expires_at_ms=NULL,updated_at_ms=? WHERE lock_key=? AND lock_token=? AND fencing_epoch=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, clock.millis());
            ps.setString(2, grant.key());
            ps.setString(3, grant.token());
            ps.setLong(4, grant.fencingEpoch());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to release lock: " + grant.key(), e);
        }
    }

    private String currentHolder(String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT lock_owner FROM board_locks WHERE lock_key=?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read lock holder: " + key, e);
        }
    }

    private static boolean isBusy(SQLException e) {
        String message = e.getMessage();
        return message != null && (message.contains("SQLITE_BUSY") || message.contains("database is locked"));
    }
}
