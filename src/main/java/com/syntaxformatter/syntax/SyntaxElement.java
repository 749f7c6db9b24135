package com.syntaxformatter.syntax;

/**
 * Common base of tokens and nodes. An element belongs to at most one parent;
 * the link is set once while the parent is built and never changes.
 */
public abstract class SyntaxElement {
    private Node parent;
    private String slotName;
    private int indexInParent = -1;

    SyntaxElement() {
    }

    final void attach(Node parent, String slotName, int indexInParent) {
        if (this.parent != null) {
            throw new IllegalStateException("Element is already attached to a " + this.parent.getKind());
        }
        this.parent = parent;
        this.slotName = slotName;
        this.indexInParent = indexInParent;
    }

    public Node getParent() {
        return parent;
    }

    public boolean isAttached() {
        return parent != null;
    }

    /**
     * Position of this element in the grammar, or null for a root.
     */
    public Slot getSlot() {
        return parent == null ? null : Slot.of(parent.getKind(), slotName);
    }

    public int getIndexInParent() {
        return indexInParent;
    }

    public abstract Token firstToken(ViewMode viewMode);

    public abstract Token lastToken(ViewMode viewMode);

    /**
     * The token preceding this element in document order, or null at the
     * start of the tree.
     */
    public Token previousToken(ViewMode viewMode) {
        SyntaxElement current = this;
        Node ancestor = parent;
        while (ancestor != null) {
            for (int i = current.indexInParent - 1; i >= 0; i--) {
                Token token = ancestor.getChild(i).lastToken(viewMode);
                if (token != null) {
                    return token;
                }
            }
            current = ancestor;
            ancestor = ancestor.getParent();
        }
        return null;
    }

    /**
     * The token following this element in document order, or null at the
     * end of the tree.
     */
    public Token nextToken(ViewMode viewMode) {
        SyntaxElement current = this;
        Node ancestor = parent;
        while (ancestor != null) {
            for (int i = current.indexInParent + 1; i < ancestor.getChildCount(); i++) {
                Token token = ancestor.getChild(i).firstToken(viewMode);
                if (token != null) {
                    return token;
                }
            }
            current = ancestor;
            ancestor = ancestor.getParent();
        }
        return null;
    }

    /**
     * Whether any strict ancestor of this element is of the given kind.
     */
    public boolean hasAncestor(SyntaxKind kind) {
        for (Node ancestor = parent; ancestor != null; ancestor = ancestor.getParent()) {
            if (ancestor.getKind() == kind) {
                return true;
            }
        }
        return false;
    }

    /**
     * A structurally equal copy that is not attached to any parent.
     */
    public abstract SyntaxElement detachedCopy();

    abstract void renderTo(StringBuilder sb);

    /**
     * Source text of the present tokens with their trivia.
     */
    public String toSourceString() {
        StringBuilder sb = new StringBuilder();
        renderTo(sb);
        return sb.toString();
    }

    @Override
    public String toString() {
        return toSourceString();
    }
}
