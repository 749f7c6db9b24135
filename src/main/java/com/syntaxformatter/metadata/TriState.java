package com.syntaxformatter.metadata;

/**
 * A yes/no answer that may also be left open for a fallback to decide.
 */
public enum TriState {
    TRUE,
    FALSE,
    UNSET;

    public static TriState of(Boolean value) {
        if (value == null) {
            return UNSET;
        }
        return value ? TRUE : FALSE;
    }

    public boolean isSet() {
        return this != UNSET;
    }

    /**
     * The decided value, or {@code fallback} when unset.
     */
    public boolean orElse(boolean fallback) {
        return switch (this) {
            case TRUE -> true;
            case FALSE -> false;
            case UNSET -> fallback;
        };
    }
}
