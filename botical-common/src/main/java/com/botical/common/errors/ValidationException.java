package com.botical.common.errors;

/**
 * Malformed request: bad frame, missing payload field, unknown channel shape.
 */
public class ValidationException extends BoticalException {

    public static final String CODE = "VALIDATION_ERROR";

    public ValidationException(String message) {
        super(CODE, message);
    }

    public ValidationException(String message, Object details) {
        super(CODE, message, details);
    }
}
