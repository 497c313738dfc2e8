package com.cardintel.catalog.model;

import java.util.Locale;

public enum RunMode {
    FRESH, RESUME, RETRY_FAILED, CATEGORY, STATUS;

    /** Accepts the command-line spelling, e.g. "retry-failed". */
    public static RunMode parse(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
