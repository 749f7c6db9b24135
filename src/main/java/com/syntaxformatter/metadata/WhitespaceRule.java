package com.syntaxformatter.metadata;

import com.syntaxformatter.syntax.TokenKind;

import java.util.Objects;

/**
 * One entry of the pairwise whitespace table: whether a blank belongs
 * between a token matching {@code left} and a following token matching
 * {@code right}.
 */
public final class WhitespaceRule {
    private final Side left;
    private final Side right;
    private final boolean whitespace;

    public WhitespaceRule(Side left, Side right, boolean whitespace) {
        this.left = Objects.requireNonNull(left, "left");
        this.right = Objects.requireNonNull(right, "right");
        this.whitespace = whitespace;
    }

    public static WhitespaceRule never(Side left, Side right) {
        return new WhitespaceRule(left, right, false);
    }

    public static WhitespaceRule always(Side left, Side right) {
        return new WhitespaceRule(left, right, true);
    }

    /**
     * @param first  kind of the earlier token, null at the start of the stream
     * @param second kind of the later token, null at the end of the stream
     */
    public boolean matches(TokenKind first, TokenKind second) {
        return left.matches(first) && right.matches(second);
    }

    public Side getLeft() {
        return left;
    }

    public Side getRight() {
        return right;
    }

    public boolean requiresWhitespace() {
        return whitespace;
    }

    @Override
    public String toString() {
        return "(" + left + ", " + right + ") -> " + whitespace;
    }

    /**
     * A pattern for one side of the pair: any token or edge, the stream
     * edge only, or one token kind.
     */
    public static final class Side {
        public static final Side ANY = new Side(null, false);
        public static final Side EDGE = new Side(null, true);

        private final TokenKind kind;
        private final boolean edge;

        private Side(TokenKind kind, boolean edge) {
            this.kind = kind;
            this.edge = edge;
        }

        public static Side of(TokenKind kind) {
            return new Side(Objects.requireNonNull(kind, "kind"), false);
        }

        /**
         * Parses {@code *}, {@code EDGE} or a token kind name.
         *
         * @throws IllegalArgumentException for an unknown token kind
         */
        public static Side parse(String text) {
            String trimmed = text.trim();
            if (trimmed.equals("*")) {
                return ANY;
            }
            if (trimmed.equals("EDGE")) {
                return EDGE;
            }
            return of(TokenKind.valueOf(trimmed));
        }

        public boolean matches(TokenKind candidate) {
            if (edge) {
                return candidate == null;
            }
            return kind == null || kind == candidate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Side)) {
                return false;
            }
            Side other = (Side) o;
            return edge == other.edge && kind == other.kind;
        }

        @Override
        public int hashCode() {
            return Objects.hash(kind, edge);
        }

        @Override
        public String toString() {
            if (edge) {
                return "EDGE";
            }
            return kind == null ? "*" : kind.name();
        }
    }
}
