package com.botical.common.errors;

/**
 * The caller is authenticated but may not touch the requested resource.
 */
public class ForbiddenException extends BoticalException {

    public static final String CODE = "FORBIDDEN";

    public ForbiddenException(String message) {
        super(CODE, message);
    }
}
