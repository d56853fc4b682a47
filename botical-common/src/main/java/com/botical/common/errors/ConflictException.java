package com.botical.common.errors;

/**
 * The operation collides with existing state, e.g. registering a second
 * pending approval for the same call id.
 */
public class ConflictException extends BoticalException {

    public static final String CODE = "CONFLICT";

    public ConflictException(String message) {
        super(CODE, message);
    }
}
