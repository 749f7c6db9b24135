package com.syntaxformatter.core;

import com.syntaxformatter.api.FormatRules;
import com.syntaxformatter.metadata.FormatMetadata;
import com.syntaxformatter.metadata.TriState;
import com.syntaxformatter.syntax.Node;
import com.syntaxformatter.syntax.SyntaxElement;
import com.syntaxformatter.syntax.SyntaxKind;
import com.syntaxformatter.syntax.Token;
import com.syntaxformatter.syntax.TokenKind;
import com.syntaxformatter.syntax.ViewMode;

import java.util.Objects;

/**
 * Format rules answered from a {@link FormatMetadata} table. Subclass and
 * override single methods to adjust individual decisions.
 */
public class DefaultFormatRules implements FormatRules {
    private final FormatMetadata metadata;

    public DefaultFormatRules() {
        this(FormatMetadata.defaults());
    }

    public DefaultFormatRules(FormatMetadata metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    public FormatMetadata getMetadata() {
        return metadata;
    }

    @Override
    public boolean requiresIndent(Node node) {
        return metadata.slot(node.getSlot()).requiresIndent();
    }

    @Override
    public boolean childrenSeparatedByNewline(Node node) {
        return metadata.childrenSeparatedByNewline(node.getKind());
    }

    /**
     * A token starts on a new line when its own slot demands it, or when it
     * begins an element of a collection whose children are newline
     * separated. Tokens inside string interpolation never do.
     */
    @Override
    public boolean requiresLeadingNewline(Token token, ViewMode viewMode) {
        if (isInsideStringInterpolation(token)) {
            return false;
        }

        SyntaxElement ancestor = token;
        while (ancestor.getParent() != null) {
            ancestor = ancestor.getParent();
            if (ancestor.firstToken(viewMode) != token) {
                break;
            }
            Node ancestorsParent = ancestor.getParent();
            if (ancestorsParent != null && childrenSeparatedByNewline(ancestorsParent)) {
                return true;
            }
        }

        return metadata.slot(token.getSlot()).requiresLeadingNewline();
    }

    @Override
    public boolean requiresLeadingBlank(Token token, ViewMode viewMode) {
        TriState override = metadata.slot(token.getSlot()).getLeadingSpace();
        if (override.isSet()) {
            return override.orElse(true);
        }
        Token previous = token.previousToken(viewMode);
        return requiresWhitespace(previous == null ? null : previous.getKind(), token.getKind());
    }

    @Override
    public boolean requiresTrailingBlank(Token token, ViewMode viewMode) {
        TriState override = metadata.slot(token.getSlot()).getTrailingSpace();
        if (override.isSet()) {
            return override.orElse(true);
        }
        Token next = token.nextToken(viewMode);
        return requiresWhitespace(token.getKind(), next == null ? null : next.getKind());
    }

    @Override
    public boolean requiresWhitespace(TokenKind first, TokenKind second) {
        return metadata.requiresWhitespace(first, second);
    }

    protected boolean isInsideStringInterpolation(Token token) {
        return token.hasAncestor(SyntaxKind.EXPRESSION_SEGMENT);
    }
}
