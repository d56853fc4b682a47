package com.botical.common.errors;

/**
 * Base type for errors that are reported back to a requesting client.
 * The {@link #getCode()} value is the stable identifier carried in the
 * {@code error.code} field of a failed response.
 */
public abstract class BoticalException extends RuntimeException {

    private final String code;
    private final transient Object details;

    protected BoticalException(String code, String message) {
        this(code, message, null);
    }

    protected BoticalException(String code, String message, Object details) {
        super(message);
        this.code = code;
        this.details = details;
    }

    public String getCode() {
        return code;
    }

    public Object getDetails() {
        return details;
    }
}
