package io.laneboard.error;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of every typed engine failure. Details are small JSON-friendly values describing the
 * rejected call.
 */
public class BoardException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> details;

    public BoardException(ErrorKind kind, String message, Map<String, Object> details) {
        this(kind, message, details, null);
    }

    public BoardException(ErrorKind kind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }

    public ErrorKind kind() {
        return kind;
    }

    public Map<String, Object> details() {
        return details;
    }

    /**
     * Same failure with extra details merged in; used to tag a sweep move's failure with its index.
     */
    public BoardException withDetail(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(details);
        merged.put(key, value);
        return new BoardException(kind, getMessage(), merged, this);
    }
}
