package com.syntaxformatter.api;

import com.syntaxformatter.syntax.Node;

/**
 * The main formatter interface that all implementations must provide.
 */
public interface TreeFormatter {
    /**
     * Returns a new tree with the same kinds and token texts as {@code tree}
     * whose trivia has been rewritten. The input tree is left untouched.
     */
    Node format(Node tree);
}
