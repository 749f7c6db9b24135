package com.syntaxformatter.syntax;

/**
 * Depth-first rewrite of a tree in document order. Every node is entered
 * and left exactly once and every token visible under the view mode is
 * visited exactly once. The input tree is never modified; the result is a
 * new tree of the same shape.
 */
public abstract class SyntaxRewriter {
    private final ViewMode viewMode;

    protected SyntaxRewriter(ViewMode viewMode) {
        this.viewMode = viewMode;
    }

    public ViewMode getViewMode() {
        return viewMode;
    }

    public Node rewrite(Node root) {
        return rewriteNode(root);
    }

    /**
     * Called before any child of {@code node} is visited.
     */
    protected void visitPre(Node node) {
    }

    /**
     * Called after every child of {@code node} has been visited.
     */
    protected void visitPost(Node node) {
    }

    /**
     * Returns the replacement for {@code token}. The token is still attached
     * to the original tree, so navigation sees the unmodified neighbours.
     */
    protected Token visit(Token token) {
        return token;
    }

    private Node rewriteNode(Node node) {
        visitPre(node);
        Node.Builder builder = Node.builder(node.getKind());
        for (SyntaxElement child : node.getChildren()) {
            SyntaxElement rewritten;
            if (child instanceof Token) {
                Token token = (Token) child;
                rewritten = viewMode.includes(token) ? visit(token) : token;
            } else {
                rewritten = rewriteNode((Node) child);
            }
            builder.child(child.getSlot().getName(), rewritten);
        }
        visitPost(node);
        return builder.build();
    }
}
