package com.syntaxformatter.syntax;

import java.util.*;

/**
 * Structural container of tokens and nodes. Children are ordered and each
 * one remembers the field of this node it occupies. Absent optional fields
 * are simply not present among the children.
 */
public final class Node extends SyntaxElement {
    private final SyntaxKind kind;
    private final List<SyntaxElement> children;

    private Node(Builder builder) {
        this.kind = builder.kind;
        List<SyntaxElement> attached = new ArrayList<>(builder.children.size());
        for (int i = 0; i < builder.children.size(); i++) {
            SyntaxElement child = builder.children.get(i);
            // A tree never shares elements with another tree
            if (child.isAttached()) {
                child = child.detachedCopy();
            }
            child.attach(this, builder.slotNames.get(i), i);
            attached.add(child);
        }
        this.children = Collections.unmodifiableList(attached);
    }

    public static Builder builder(SyntaxKind kind) {
        return new Builder(kind);
    }

    /**
     * Builds a collection node from its elements.
     *
     * @throws IllegalArgumentException if {@code kind} is not a collection kind
     */
    public static Node collection(SyntaxKind kind, List<? extends SyntaxElement> elements) {
        if (!kind.isCollection()) {
            throw new IllegalArgumentException(kind + " is not a collection kind");
        }
        Builder builder = builder(kind);
        for (SyntaxElement element : elements) {
            builder.element(element);
        }
        return builder.build();
    }

    public static Node collection(SyntaxKind kind, SyntaxElement... elements) {
        return collection(kind, List.of(elements));
    }

    public SyntaxKind getKind() {
        return kind;
    }

    public List<SyntaxElement> getChildren() {
        return children;
    }

    public int getChildCount() {
        return children.size();
    }

    public SyntaxElement getChild(int index) {
        return children.get(index);
    }

    /**
     * The child occupying field {@code slotName}, or null if the field is absent.
     */
    public SyntaxElement getChild(String slotName) {
        for (SyntaxElement child : children) {
            if (slotName.equals(child.getSlot().getName())) {
                return child;
            }
        }
        return null;
    }

    public Node getChildNode(String slotName) {
        SyntaxElement child = getChild(slotName);
        return child instanceof Node ? (Node) child : null;
    }

    public Token getChildToken(String slotName) {
        SyntaxElement child = getChild(slotName);
        return child instanceof Token ? (Token) child : null;
    }

    @Override
    public Token firstToken(ViewMode viewMode) {
        for (SyntaxElement child : children) {
            Token token = child.firstToken(viewMode);
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    @Override
    public Token lastToken(ViewMode viewMode) {
        for (int i = children.size() - 1; i >= 0; i--) {
            Token token = children.get(i).lastToken(viewMode);
            if (token != null) {
                return token;
            }
        }
        return null;
    }

    /**
     * All tokens visible under {@code viewMode}, in document order.
     */
    public List<Token> tokens(ViewMode viewMode) {
        List<Token> tokens = new ArrayList<>();
        _collectTokens(this, viewMode, tokens);
        return tokens;
    }

    @Override
    public Node detachedCopy() {
        Builder builder = toBuilder();
        return builder.build();
    }

    /**
     * A builder pre-filled with this node's kind and children.
     */
    public Builder toBuilder() {
        Builder builder = new Builder(kind);
        for (SyntaxElement child : children) {
            builder.child(child.getSlot().getName(), child);
        }
        return builder;
    }

    @Override
    void renderTo(StringBuilder sb) {
        for (SyntaxElement child : children) {
            child.renderTo(sb);
        }
    }

    private static void _collectTokens(Node node, ViewMode viewMode, List<Token> tokens) {
        for (SyntaxElement child : node.children) {
            if (child instanceof Token) {
                Token token = (Token) child;
                if (viewMode.includes(token)) {
                    tokens.add(token);
                }
            } else {
                _collectTokens((Node) child, viewMode, tokens);
            }
        }
    }

    public static class Builder {
        private final SyntaxKind kind;
        private final List<String> slotNames = new ArrayList<>();
        private final List<SyntaxElement> children = new ArrayList<>();

        private Builder(SyntaxKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
        }

        /**
         * Adds a child in field {@code slotName}. A null child leaves the
         * field absent.
         */
        public Builder child(String slotName, SyntaxElement child) {
            Objects.requireNonNull(slotName, "slotName");
            if (child != null) {
                slotNames.add(slotName);
                children.add(child);
            }
            return this;
        }

        public Builder element(SyntaxElement element) {
            return child(Slot.ELEMENT, element);
        }

        public Node build() {
            return new Node(this);
        }
    }
}
