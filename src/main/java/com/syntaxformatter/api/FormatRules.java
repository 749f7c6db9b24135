package com.syntaxformatter.api;

import com.syntaxformatter.syntax.Node;
import com.syntaxformatter.syntax.Token;
import com.syntaxformatter.syntax.TokenKind;
import com.syntaxformatter.syntax.ViewMode;

/**
 * The decisions a formatting run asks about the tree. Implementations may
 * override single predicates without touching the traversal.
 */
public interface FormatRules {
    /**
     * Whether entering {@code node} opens a new indentation scope.
     */
    boolean requiresIndent(Node node);

    /**
     * Whether every child of {@code node} starts on its own line.
     */
    boolean childrenSeparatedByNewline(Node node);

    boolean requiresLeadingNewline(Token token, ViewMode viewMode);

    boolean requiresLeadingBlank(Token token, ViewMode viewMode);

    boolean requiresTrailingBlank(Token token, ViewMode viewMode);

    /**
     * Whether a blank belongs between two adjacent tokens.
     *
     * @param first  kind of the earlier token, null at the start of the tree
     * @param second kind of the later token, null at the end of the tree
     */
    boolean requiresWhitespace(TokenKind first, TokenKind second);
}
