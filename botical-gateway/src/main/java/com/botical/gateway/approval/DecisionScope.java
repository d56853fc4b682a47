package com.botical.gateway.approval;

import java.util.Locale;

/**
 * How long a user's answer applies.
 */
public enum DecisionScope {
    /** This call only. */
    ONCE,
    /** Every call of the same tool in the same session, until the session ends. */
    SESSION;

    public static DecisionScope parse(String value) {
        if (value == null || value.isBlank()) {
            return ONCE;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
