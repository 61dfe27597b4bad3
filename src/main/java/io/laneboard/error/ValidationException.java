package io.laneboard.error;

import java.util.Map;

public final class ValidationException extends BoardException {
    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_ERROR, message, Map.of());
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorKind.VALIDATION_ERROR, message, details);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_ERROR, message, Map.of(), cause);
    }
}
