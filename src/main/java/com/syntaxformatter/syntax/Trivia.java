package com.syntaxformatter.syntax;

import java.util.*;

/**
 * Immutable sequence of trivia pieces attached before or after a token.
 */
public final class Trivia {
    public static final Trivia EMPTY = new Trivia(Collections.emptyList());

    private final List<TriviaPiece> pieces;

    private Trivia(List<TriviaPiece> pieces) {
        this.pieces = pieces;
    }

    public static Trivia of(TriviaPiece... pieces) {
        return of(List.of(pieces));
    }

    public static Trivia of(List<TriviaPiece> pieces) {
        if (pieces.isEmpty()) {
            return EMPTY;
        }
        return new Trivia(List.copyOf(pieces));
    }

    public static Trivia spaces(int count) {
        return count == 0 ? EMPTY : of(TriviaPiece.spaces(count));
    }

    public static Trivia tabs(int count) {
        return count == 0 ? EMPTY : of(TriviaPiece.tabs(count));
    }

    public static Trivia space() {
        return spaces(1);
    }

    public static Trivia newline() {
        return of(TriviaPiece.newlines(1));
    }

    /**
     * Splits raw whitespace and comment text into trivia pieces.
     */
    public static Trivia parse(String text) {
        if (text == null || text.isEmpty()) {
            return EMPTY;
        }
        return of(_lexPieces(text));
    }

    public List<TriviaPiece> getPieces() {
        return pieces;
    }

    public boolean isEmpty() {
        return pieces.isEmpty();
    }

    public int size() {
        return pieces.size();
    }

    public Optional<TriviaPiece> first() {
        return pieces.isEmpty() ? Optional.empty() : Optional.of(pieces.get(0));
    }

    public Optional<TriviaPiece> last() {
        return pieces.isEmpty() ? Optional.empty() : Optional.of(pieces.get(pieces.size() - 1));
    }

    public boolean startsWithNewline() {
        return first().map(TriviaPiece::isNewline).orElse(false);
    }

    public boolean startsWithBlank() {
        return first().map(TriviaPiece::isBlank).orElse(false);
    }

    public boolean endsWithNewline() {
        return last().map(TriviaPiece::isNewline).orElse(false);
    }

    public boolean endsWithBlank() {
        return last().map(TriviaPiece::isBlank).orElse(false);
    }

    public Trivia append(Trivia other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        List<TriviaPiece> combined = new ArrayList<>(pieces.size() + other.pieces.size());
        combined.addAll(pieces);
        combined.addAll(other.pieces);
        return new Trivia(Collections.unmodifiableList(combined));
    }

    public Trivia append(TriviaPiece piece) {
        return append(of(piece));
    }

    public Trivia prepend(TriviaPiece piece) {
        return of(piece).append(this);
    }

    /**
     * The run of spaces and tabs this trivia starts with.
     */
    public Trivia leadingIndentationWhitespace() {
        int end = 0;
        while (end < pieces.size() && pieces.get(end).isIndentationWhitespace()) {
            end++;
        }
        return end == pieces.size() ? this : of(pieces.subList(0, end));
    }

    /**
     * Removes every blank run that directly precedes a newline so that no line
     * ends in whitespace.
     *
     * @param isBeforeNewline whether the text following this trivia starts on a new line
     */
    public Trivia trimmingTrailingBlanksBeforeNewline(boolean isBeforeNewline) {
        List<TriviaPiece> reversed = new ArrayList<>(pieces.size());
        boolean beforeNewline = isBeforeNewline;
        for (int i = pieces.size() - 1; i >= 0; i--) {
            TriviaPiece piece = pieces.get(i);
            if (piece.isNewline()) {
                beforeNewline = true;
                reversed.add(piece);
                continue;
            }
            if (beforeNewline && piece.isBlank()) {
                continue;
            }
            reversed.add(piece);
            beforeNewline = false;
        }
        if (reversed.size() == pieces.size()) {
            return this;
        }
        Collections.reverse(reversed);
        return of(reversed);
    }

    /**
     * Whether a space or tab follows a newline in this trivia, or starts it
     * when the preceding text already ended on a newline.
     */
    public boolean containsIndentation(boolean isOnNewline) {
        boolean afterNewline = isOnNewline;
        for (TriviaPiece piece : pieces) {
            if (piece.isNewline()) {
                afterNewline = true;
            } else if (afterNewline && piece.isIndentationWhitespace()) {
                return true;
            }
        }
        return false;
    }

    /**
     * The indentation of the first line that starts inside this trivia.
     * Leading newlines are skipped. Empty when no line starts here; a present
     * but empty trivia when the line starts without indentation.
     */
    public Optional<Trivia> indentation(boolean isOnNewline) {
        boolean onNewline = isOnNewline;
        int index = 0;
        while (index < pieces.size() && pieces.get(index).isNewline()) {
            index++;
            onNewline = true;
        }
        if (!onNewline) {
            return Optional.empty();
        }
        int start = index;
        while (index < pieces.size() && pieces.get(index).isIndentationWhitespace()) {
            index++;
        }
        return Optional.of(of(pieces.subList(start, index)));
    }

    /**
     * Inserts {@code indentation} after every newline, and in front of the
     * first piece when {@code isOnNewline} is set.
     */
    public Trivia indented(Trivia indentation, boolean isOnNewline) {
        if (isEmpty()) {
            return isOnNewline ? indentation : this;
        }
        if (indentation.isEmpty()) {
            return this;
        }
        List<TriviaPiece> indentedPieces = new ArrayList<>();
        if (isOnNewline) {
            indentedPieces.addAll(indentation.pieces);
        }
        for (TriviaPiece piece : pieces) {
            indentedPieces.add(piece);
            if (piece.isNewline()) {
                indentedPieces.addAll(indentation.pieces);
            }
        }
        return of(indentedPieces);
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        for (TriviaPiece piece : pieces) {
            sb.append(piece.getText());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof Trivia && pieces.equals(((Trivia) o).pieces);
    }

    @Override
    public int hashCode() {
        return pieces.hashCode();
    }

    @Override
    public String toString() {
        return pieces.toString();
    }

    private static List<TriviaPiece> _lexPieces(String text) {
        List<TriviaPiece> result = new ArrayList<>();
        int i = 0;
        int length = text.length();
        while (i < length) {
            char c = text.charAt(i);
            if (c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n') {
                int start = i;
                while (i + 1 < length && text.charAt(i) == '\r' && text.charAt(i + 1) == '\n') {
                    i += 2;
                }
                result.add(TriviaPiece.carriageReturnLineFeeds((i - start) / 2));
            } else if (_counterpartKind(c) != null) {
                TriviaPieceKind kind = _counterpartKind(c);
                int start = i;
                while (i < length && text.charAt(i) == c
                        && !(c == '\r' && i + 1 < length && text.charAt(i + 1) == '\n')) {
                    i++;
                }
                result.add(TriviaPiece.counted(kind, i - start));
            } else if (text.startsWith("//", i)) {
                int end = i;
                while (end < length && text.charAt(end) != '\n' && text.charAt(end) != '\r') {
                    end++;
                }
                // trailing blanks stay separate pieces so they can be trimmed
                while (end > i + 2 && (text.charAt(end - 1) == ' ' || text.charAt(end - 1) == '\t')) {
                    end--;
                }
                String comment = text.substring(i, end);
                result.add(comment.startsWith("///")
                        ? TriviaPiece.docLineComment(comment)
                        : TriviaPiece.lineComment(comment));
                i = end;
            } else if (text.startsWith("/*", i)) {
                int close = text.indexOf("*/", i + 2);
                int end = close < 0 ? length : close + 2;
                String comment = text.substring(i, end);
                result.add(comment.startsWith("/**") && !comment.equals("/**/")
                        ? TriviaPiece.docBlockComment(comment)
                        : TriviaPiece.blockComment(comment));
                i = end;
            } else {
                int end = i;
                while (end < length && _counterpartKind(text.charAt(end)) == null
                        && !text.startsWith("//", end) && !text.startsWith("/*", end)) {
                    end++;
                }
                result.add(TriviaPiece.unexpectedText(text.substring(i, end)));
                i = end;
            }
        }
        return result;
    }

    private static TriviaPieceKind _counterpartKind(char c) {
        return switch (c) {
            case ' ' -> TriviaPieceKind.SPACES;
            case '\t' -> TriviaPieceKind.TABS;
            case '\u000B' -> TriviaPieceKind.VERTICAL_TABS;
            case '\f' -> TriviaPieceKind.FORMFEEDS;
            case '\n' -> TriviaPieceKind.NEWLINES;
            case '\r' -> TriviaPieceKind.CARRIAGE_RETURNS;
            default -> null;
        };
    }
}
