package com.syntaxformatter.syntax;

import java.util.Objects;

/**
 * Immutable leaf of the syntax tree: kind, text and the trivia around it.
 */
public final class Token extends SyntaxElement {
    private final TokenKind kind;
    private final String text;
    private final Trivia leadingTrivia;
    private final Trivia trailingTrivia;
    private final SourcePresence presence;

    public Token(TokenKind kind, String text, Trivia leadingTrivia, Trivia trailingTrivia,
                 SourcePresence presence) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.leadingTrivia = Objects.requireNonNull(leadingTrivia, "leadingTrivia");
        this.trailingTrivia = Objects.requireNonNull(trailingTrivia, "trailingTrivia");
        this.presence = Objects.requireNonNull(presence, "presence");
    }

    /**
     * A present token of a kind with fixed text and no trivia.
     */
    public static Token of(TokenKind kind) {
        if (!kind.hasFixedText()) {
            throw new IllegalArgumentException(kind + " has no fixed text; pass the token text explicitly");
        }
        return of(kind, kind.getFixedText());
    }

    public static Token of(TokenKind kind, String text) {
        return new Token(kind, text, Trivia.EMPTY, Trivia.EMPTY, SourcePresence.PRESENT);
    }

    public static Token identifier(String name) {
        return of(TokenKind.IDENTIFIER, name);
    }

    /**
     * A placeholder for a token the parser expected but did not find.
     */
    public static Token missing(TokenKind kind) {
        String text = kind.hasFixedText() ? kind.getFixedText() : "";
        return new Token(kind, text, Trivia.EMPTY, Trivia.EMPTY, SourcePresence.MISSING);
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getText() {
        return text;
    }

    public Trivia getLeadingTrivia() {
        return leadingTrivia;
    }

    public Trivia getTrailingTrivia() {
        return trailingTrivia;
    }

    public SourcePresence getPresence() {
        return presence;
    }

    public boolean isMissing() {
        return presence == SourcePresence.MISSING;
    }

    public Token withLeadingTrivia(Trivia trivia) {
        return new Token(kind, text, trivia, trailingTrivia, presence);
    }

    public Token withTrailingTrivia(Trivia trivia) {
        return new Token(kind, text, leadingTrivia, trivia, presence);
    }

    public Token withTrivia(Trivia leading, Trivia trailing) {
        return new Token(kind, text, leading, trailing, presence);
    }

    @Override
    public Token firstToken(ViewMode viewMode) {
        return viewMode.includes(this) ? this : null;
    }

    @Override
    public Token lastToken(ViewMode viewMode) {
        return firstToken(viewMode);
    }

    @Override
    public Token detachedCopy() {
        return new Token(kind, text, leadingTrivia, trailingTrivia, presence);
    }

    @Override
    void renderTo(StringBuilder sb) {
        if (presence == SourcePresence.MISSING) {
            return;
        }
        sb.append(leadingTrivia.render()).append(text).append(trailingTrivia.render());
    }
}
