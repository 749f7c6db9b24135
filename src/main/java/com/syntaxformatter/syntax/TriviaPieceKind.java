package com.syntaxformatter.syntax;

/**
 * Kinds of trivia pieces. Whitespace kinds carry a repeat count, the
 * remaining kinds carry their literal text.
 */
public enum TriviaPieceKind {
    SPACES(" "),
    TABS("\t"),
    VERTICAL_TABS("\u000B"),
    FORMFEEDS("\f"),
    NEWLINES("\n"),
    CARRIAGE_RETURNS("\r"),
    CARRIAGE_RETURN_LINE_FEEDS("\r\n"),
    LINE_COMMENT(null),
    BLOCK_COMMENT(null),
    DOC_LINE_COMMENT(null),
    DOC_BLOCK_COMMENT(null),
    UNEXPECTED_TEXT(null);

    private final String unit;

    TriviaPieceKind(String unit) {
        this.unit = unit;
    }

    /**
     * The text repeated by a counted piece, or null for text-carrying kinds.
     */
    public String getUnit() {
        return unit;
    }

    public boolean isCounted() {
        return unit != null;
    }
}
