package com.syntaxformatter.syntax;

import java.util.Objects;

/**
 * A single run of trivia: a counted whitespace run or a comment.
 */
public final class TriviaPiece {
    private final TriviaPieceKind kind;
    private final int count;
    private final String text;

    private TriviaPiece(TriviaPieceKind kind, int count, String text) {
        this.kind = kind;
        this.count = count;
        this.text = text;
    }

    public static TriviaPiece spaces(int count) {
        return counted(TriviaPieceKind.SPACES, count);
    }

    public static TriviaPiece tabs(int count) {
        return counted(TriviaPieceKind.TABS, count);
    }

    public static TriviaPiece newlines(int count) {
        return counted(TriviaPieceKind.NEWLINES, count);
    }

    public static TriviaPiece carriageReturns(int count) {
        return counted(TriviaPieceKind.CARRIAGE_RETURNS, count);
    }

    public static TriviaPiece carriageReturnLineFeeds(int count) {
        return counted(TriviaPieceKind.CARRIAGE_RETURN_LINE_FEEDS, count);
    }

    public static TriviaPiece lineComment(String text) {
        return textual(TriviaPieceKind.LINE_COMMENT, text);
    }

    public static TriviaPiece blockComment(String text) {
        return textual(TriviaPieceKind.BLOCK_COMMENT, text);
    }

    public static TriviaPiece docLineComment(String text) {
        return textual(TriviaPieceKind.DOC_LINE_COMMENT, text);
    }

    public static TriviaPiece docBlockComment(String text) {
        return textual(TriviaPieceKind.DOC_BLOCK_COMMENT, text);
    }

    public static TriviaPiece unexpectedText(String text) {
        return textual(TriviaPieceKind.UNEXPECTED_TEXT, text);
    }

    public static TriviaPiece counted(TriviaPieceKind kind, int count) {
        if (!kind.isCounted()) {
            throw new IllegalArgumentException(kind + " is not a counted trivia kind");
        }
        if (count < 1) {
            throw new IllegalArgumentException("Trivia count must be positive: " + count);
        }
        return new TriviaPiece(kind, count, null);
    }

    private static TriviaPiece textual(TriviaPieceKind kind, String text) {
        Objects.requireNonNull(text, "text");
        return new TriviaPiece(kind, 0, text);
    }

    public TriviaPieceKind getKind() {
        return kind;
    }

    /**
     * Repeat count of a counted piece; 0 for comments and unexpected text.
     */
    public int getCount() {
        return count;
    }

    public boolean isNewline() {
        return switch (kind) {
            case NEWLINES, CARRIAGE_RETURNS, CARRIAGE_RETURN_LINE_FEEDS -> true;
            default -> false;
        };
    }

    /**
     * Any whitespace, newlines included.
     */
    public boolean isBlank() {
        return kind.isCounted();
    }

    /**
     * Whitespace that may make up the indentation of a line.
     */
    public boolean isIndentationWhitespace() {
        return kind == TriviaPieceKind.SPACES || kind == TriviaPieceKind.TABS;
    }

    public boolean isComment() {
        return switch (kind) {
            case LINE_COMMENT, BLOCK_COMMENT, DOC_LINE_COMMENT, DOC_BLOCK_COMMENT -> true;
            default -> false;
        };
    }

    public String getText() {
        if (kind.isCounted()) {
            return kind.getUnit().repeat(count);
        }
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TriviaPiece)) {
            return false;
        }
        TriviaPiece other = (TriviaPiece) o;
        return kind == other.kind && count == other.count && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, count, text);
    }

    @Override
    public String toString() {
        if (kind.isCounted()) {
            return kind.name().toLowerCase() + "(" + count + ")";
        }
        return kind.name().toLowerCase() + "(" + text + ")";
    }
}
