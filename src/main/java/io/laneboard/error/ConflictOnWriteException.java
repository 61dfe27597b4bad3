package io.laneboard.error;

import java.util.Map;

public final class ConflictOnWriteException extends BoardException {
    public ConflictOnWriteException(String board, long expectedVersion, int attempts) {
        super(
                ErrorKind.CONFLICT_ON_WRITE,
                "Board " + board + " changed concurrently (expected version " + expectedVersion + ")",
                Map.of("board", board, "expectedVersion", expectedVersion, "attempts", attempts)
        );
    }
}
