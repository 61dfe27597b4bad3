package io.laneboard.error;

import java.util.Map;

public final class LockTimeoutException extends BoardException {
    public LockTimeoutException(String lockKey, long waitedMs, String holder) {
        super(
                ErrorKind.LOCK_TIMEOUT,
                "Timed out after " + waitedMs + "ms waiting for lock " + lockKey,
                Map.of("lockKey", lockKey, "waitedMs", waitedMs, "holder", holder == null ? "" : holder)
        );
    }
}
