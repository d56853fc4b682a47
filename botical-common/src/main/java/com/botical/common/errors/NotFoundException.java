package com.botical.common.errors;

/**
 * A referenced resource does not exist.
 */
public class NotFoundException extends BoticalException {

    public static final String CODE = "NOT_FOUND";

    public NotFoundException(String message) {
        super(CODE, message);
    }

    public NotFoundException(String resource, String id) {
        super(CODE, resource + " not found: " + id);
    }
}
