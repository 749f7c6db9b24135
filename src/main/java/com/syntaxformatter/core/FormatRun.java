package com.syntaxformatter.core;

import com.syntaxformatter.api.FormatRules;
import com.syntaxformatter.syntax.Node;
import com.syntaxformatter.syntax.SyntaxRewriter;
import com.syntaxformatter.syntax.Token;
import com.syntaxformatter.syntax.TokenKind;
import com.syntaxformatter.syntax.Trivia;
import com.syntaxformatter.syntax.ViewMode;

import java.util.*;

/**
 * A single formatting pass over one tree. Holds the only mutable state of a
 * run, so a new instance is created for every tree.
 */
final class FormatRun extends SyntaxRewriter {
    private final Trivia indentationIncrement;
    private final FormatRules rules;
    private final IndentationStack indentationStack;

    /**
     * For every token put at the start of a line without indentation of its
     * own, the indentation level the run gave it. User-indented descendants
     * are indented relative to these anchors.
     */
    private final Map<Token, Trivia> anchorPoints = new IdentityHashMap<>();

    private int visitedTokenCount;
    private int maxIndentationDepth;
    private int userIndentedScopeCount;

    FormatRun(Trivia indentationIncrement, Trivia initialIndentation, ViewMode viewMode, FormatRules rules) {
        super(viewMode);
        this.indentationIncrement = indentationIncrement;
        this.rules = rules;
        this.indentationStack = new IndentationStack(initialIndentation);
    }

    int getVisitedTokenCount() {
        return visitedTokenCount;
    }

    int getAnchorCount() {
        return anchorPoints.size();
    }

    int getMaxIndentationDepth() {
        return maxIndentationDepth;
    }

    /** Number of indented scopes whose level was taken from the source rather than computed. */
    int getUserIndentedScopeCount() {
        return userIndentedScopeCount;
    }

    @Override
    protected void visitPre(Node node) {
        if (!rules.requiresIndent(node)) {
            return;
        }
        Token firstToken = node.firstToken(getViewMode());
        Optional<Trivia> tokenIndentation = firstToken == null
                ? Optional.empty()
                : firstToken.getLeadingTrivia().indentation(false);
        if (tokenIndentation.isPresent() && !tokenIndentation.get().isEmpty()) {
            // The block's first line is already indented; take the level from it
            indentationStack.pushUserDefined(tokenIndentation.get());
        } else {
            indentationStack.pushIncrement(indentationIncrement);
        }
        if (indentationStack.isCurrentUserDefined()) {
            userIndentedScopeCount++;
        }
        maxIndentationDepth = Math.max(maxIndentationDepth, indentationStack.depth());
    }

    @Override
    protected void visitPost(Node node) {
        if (rules.requiresIndent(node)) {
            indentationStack.pop();
        }
    }

    @Override
    protected Token visit(Token token) {
        visitedTokenCount++;
        ViewMode viewMode = getViewMode();
        Token previous = token.previousToken(viewMode);
        Token next = token.nextToken(viewMode);

        boolean previousEndsInNewline = _willEndInNewline(previous);
        boolean nextStartsWithNewline = next != null
                && (next.getLeadingTrivia().startsWithNewline() || rules.requiresLeadingNewline(next, viewMode));

        Trivia leadingTrivia = token.getLeadingTrivia();
        Trivia trailingTrivia = token.getTrailingTrivia();

        if (rules.requiresLeadingNewline(token, viewMode)) {
            if (!leadingTrivia.startsWithNewline() && !previousEndsInNewline) {
                leadingTrivia = Trivia.newline().append(leadingTrivia);
            }
        } else if (rules.requiresLeadingBlank(token, viewMode)) {
            if (!leadingTrivia.startsWithBlank() && !_willEndWithBlank(previous)) {
                leadingTrivia = leadingTrivia.append(Trivia.space());
            }
        }

        Optional<Trivia> ownIndentation = leadingTrivia.indentation(previousEndsInNewline);
        if (ownIndentation.isPresent() && ownIndentation.get().isEmpty()) {
            anchorPoints.put(token, indentationStack.current());
        }

        // Newlines win over spaces as the separator to the next token
        if (rules.requiresTrailingBlank(token, viewMode)
                && !trailingTrivia.endsWithBlank()
                && !nextStartsWithNewline) {
            trailingTrivia = trailingTrivia.append(Trivia.space());
        }

        Trivia leadingIndentation = indentationStack.current();
        Trivia trailingIndentation = indentationStack.current();

        if (leadingTrivia.containsIndentation(previousEndsInNewline)) {
            Trivia anchor = anchorPointIndentation(token);
            if (anchor != null) {
                leadingIndentation = anchor;
            }
        }
        Trivia nextLeadingWhitespace = next == null ? Trivia.EMPTY : next.getLeadingTrivia().leadingIndentationWhitespace();
        if (trailingTrivia.append(nextLeadingWhitespace).containsIndentation(previousEndsInNewline)) {
            Trivia anchor = anchorPointIndentation(token);
            if (anchor != null) {
                trailingIndentation = anchor;
            }
        }

        leadingTrivia = leadingTrivia
                .indented(leadingIndentation, false)
                .trimmingTrailingBlanksBeforeNewline(false);
        trailingTrivia = trailingTrivia
                .indented(trailingIndentation, false)
                .trimmingTrailingBlanksBeforeNewline(nextStartsWithNewline);

        return token.withTrivia(leadingTrivia, trailingTrivia);
    }

    /**
     * The anchor user indentation in {@code token} is relative to: the
     * recorded level of the first token of the innermost ancestor that has
     * one, or null when no ancestor is anchored.
     */
    private Trivia anchorPointIndentation(Token token) {
        for (Node ancestor = token.getParent(); ancestor != null; ancestor = ancestor.getParent()) {
            Token firstToken = ancestor.firstToken(getViewMode());
            if (firstToken != null) {
                Trivia anchor = anchorPoints.get(firstToken);
                if (anchor != null) {
                    return anchor;
                }
            }
        }
        return null;
    }

    private boolean _willEndWithBlank(Token previous) {
        if (previous == null) {
            return false;
        }
        return previous.getTrailingTrivia().endsWithBlank()
                || rules.requiresTrailingBlank(previous, getViewMode());
    }

    /**
     * The start of the tree counts as a line start, so no newline is ever
     * put in front of the first token.
     */
    private static boolean _willEndInNewline(Token previous) {
        if (previous == null) {
            return true;
        }
        if (previous.getTrailingTrivia().endsWithNewline()) {
            return true;
        }
        return previous.getKind() == TokenKind.STRING_SEGMENT
                && previous.getTrailingTrivia().isEmpty()
                && (previous.getText().endsWith("\n") || previous.getText().endsWith("\r"));
    }
}
