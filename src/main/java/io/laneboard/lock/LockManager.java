package io.laneboard.lock;

import java.util.function.Function;

/**
 * Cross-process mutual exclusion keyed by name. Implementations must release the lock on every
 * exit path of {@code body}, including exceptions.
 */
public interface LockManager {
    <T> T withLock(String key, Function<LockGrant, T> body);

    static String boardWriteKey(String board) {
        return "board:" + board + ":write";
    }

    record LockGrant(String key, String owner, String token, long fencingEpoch) {
    }
}
