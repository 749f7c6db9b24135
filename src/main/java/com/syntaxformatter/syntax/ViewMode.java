package com.syntaxformatter.syntax;

/**
 * Filter deciding which tokens traversal and navigation can see.
 */
public enum ViewMode {
    /** Only tokens written in the source. */
    SOURCE_ACCURATE,
    /** Source tokens plus the placeholders the parser synthesized. */
    FIXED_UP;

    public boolean includes(Token token) {
        return this == FIXED_UP || token.getPresence() == SourcePresence.PRESENT;
    }
}
