package com.syntaxformatter.syntax;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class NodeTest {

    private static Node reference(String name) {
        return Node.builder(SyntaxKind.DECL_REFERENCE_EXPR)
                .child("baseName", Token.identifier(name))
                .build();
    }

    /** {@code foo(<missing>)} followed by end of file. */
    private static Node callWithMissingArgument() {
        Node argument = Node.builder(SyntaxKind.MISSING_EXPR)
                .child("placeholder", Token.missing(TokenKind.IDENTIFIER))
                .build();
        Node call = Node.builder(SyntaxKind.FUNCTION_CALL_EXPR)
                .child("calledExpression", reference("foo"))
                .child("leftParen", Token.of(TokenKind.LEFT_PAREN))
                .child("arguments", Node.collection(SyntaxKind.LABELED_EXPR_LIST,
                        Node.builder(SyntaxKind.LABELED_EXPR).child("expression", argument).build()))
                .child("rightParen", Token.of(TokenKind.RIGHT_PAREN))
                .build();
        return Node.builder(SyntaxKind.SOURCE_FILE)
                .child("statements", Node.collection(SyntaxKind.CODE_BLOCK_ITEM_LIST,
                        Node.builder(SyntaxKind.CODE_BLOCK_ITEM).child("item", call).build()))
                .child("endOfFile", Token.of(TokenKind.END_OF_FILE))
                .build();
    }

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::getText).collect(Collectors.toList());
    }

    @Test
    void childrenKnowTheirSlots() {
        Node call = Node.builder(SyntaxKind.FUNCTION_CALL_EXPR)
                .child("calledExpression", reference("foo"))
                .child("leftParen", Token.of(TokenKind.LEFT_PAREN))
                .child("trailingClosure", null)
                .child("rightParen", Token.of(TokenKind.RIGHT_PAREN))
                .build();

        assertThat(call.getChildCount()).isEqualTo(3);
        assertThat(call.getChildToken("leftParen").getSlot())
                .isEqualTo(Slot.of(SyntaxKind.FUNCTION_CALL_EXPR, "leftParen"));
        assertThat(call.getChildToken("rightParen").getIndexInParent()).isEqualTo(2);
        assertThat(call.getChild("trailingClosure")).isNull();
        assertThat(call.getChildNode("leftParen")).isNull();
        assertThat(call.getSlot()).isNull();
    }

    @Test
    void collectionElementsShareTheElementSlot() {
        Node list = Node.collection(SyntaxKind.LABELED_EXPR_LIST, reference("a"), reference("b"));

        assertThat(list.getChildren())
                .extracting(SyntaxElement::getSlot)
                .containsOnly(Slot.of(SyntaxKind.LABELED_EXPR_LIST, Slot.ELEMENT));
    }

    @Test
    void onlyCollectionKindsTakeElements() {
        assertThatThrownBy(() -> Node.collection(SyntaxKind.FUNCTION_CALL_EXPR, reference("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("FUNCTION_CALL_EXPR");
    }

    @Test
    void navigatesTokensInDocumentOrder() {
        Node root = callWithMissingArgument();
        Token leftParen = root.tokens(ViewMode.SOURCE_ACCURATE).get(1);

        assertThat(leftParen.getKind()).isEqualTo(TokenKind.LEFT_PAREN);
        assertThat(leftParen.previousToken(ViewMode.SOURCE_ACCURATE).getText()).isEqualTo("foo");
        assertThat(leftParen.nextToken(ViewMode.SOURCE_ACCURATE).getKind()).isEqualTo(TokenKind.RIGHT_PAREN);
        assertThat(leftParen.nextToken(ViewMode.FIXED_UP).isMissing()).isTrue();
        assertThat(root.firstToken(ViewMode.SOURCE_ACCURATE).previousToken(ViewMode.SOURCE_ACCURATE)).isNull();
        assertThat(root.lastToken(ViewMode.SOURCE_ACCURATE).nextToken(ViewMode.SOURCE_ACCURATE)).isNull();
    }

    @Test
    void viewModeDecidesWhichTokensAreVisible() {
        Node root = callWithMissingArgument();

        assertThat(texts(root.tokens(ViewMode.SOURCE_ACCURATE))).containsExactly("foo", "(", ")", "");
        assertThat(root.tokens(ViewMode.FIXED_UP)).hasSize(5);
    }

    @Test
    void missingTokensRenderNothing() {
        assertThat(callWithMissingArgument().toSourceString()).isEqualTo("foo()");
    }

    @Test
    void firstTokenSkipsMissingTokensInSourceAccurateView() {
        Node missing = Node.builder(SyntaxKind.MISSING_EXPR)
                .child("placeholder", Token.missing(TokenKind.IDENTIFIER))
                .build();

        assertThat(missing.firstToken(ViewMode.SOURCE_ACCURATE)).isNull();
        assertThat(missing.firstToken(ViewMode.FIXED_UP).isMissing()).isTrue();
    }

    @Test
    void attachingAnAttachedElementCopiesIt() {
        Node first = Node.collection(SyntaxKind.LABELED_EXPR_LIST, reference("shared"));
        SyntaxElement shared = first.getChild(0);

        Node second = Node.collection(SyntaxKind.CODE_BLOCK_ITEM_LIST, shared);

        assertThat(second.getChild(0)).isNotSameAs(shared);
        assertThat(second.getChild(0).toSourceString()).isEqualTo("shared");
        assertThat(shared.getParent()).isSameAs(first);
        assertThat(second.getChild(0).getParent()).isSameAs(second);
    }

    @Test
    void detachedCopyIsEqualInShapeButUnattached() {
        Node root = callWithMissingArgument();
        Node statements = root.getChildNode("statements");

        Node copy = statements.detachedCopy();

        assertThat(copy.getParent()).isNull();
        assertThat(copy.getKind()).isEqualTo(SyntaxKind.CODE_BLOCK_ITEM_LIST);
        assertThat(copy.toSourceString()).isEqualTo(statements.toSourceString());
        assertThat(copy.tokens(ViewMode.FIXED_UP)).hasSize(4);
    }

    @Test
    void hasAncestorLooksAboveTheElementOnly() {
        Node root = callWithMissingArgument();
        Token foo = root.firstToken(ViewMode.SOURCE_ACCURATE);

        assertThat(foo.hasAncestor(SyntaxKind.FUNCTION_CALL_EXPR)).isTrue();
        assertThat(foo.hasAncestor(SyntaxKind.CLOSURE_EXPR)).isFalse();
        assertThat(root.hasAncestor(SyntaxKind.SOURCE_FILE)).isFalse();
    }

    @Test
    void rendersTriviaAroundTokens() {
        Token token = new Token(TokenKind.IDENTIFIER, "x", Trivia.parse("\n  "), Trivia.parse(" // c"),
                SourcePresence.PRESENT);

        assertThat(token.toSourceString()).isEqualTo("\n  x // c");
        assertThat(token.withLeadingTrivia(Trivia.EMPTY).toSourceString()).isEqualTo("x // c");
    }

    @Test
    void parsesSlotNotation() {
        assertThat(Slot.parse("CODE_BLOCK.statements"))
                .isEqualTo(Slot.of(SyntaxKind.CODE_BLOCK, "statements"));
        assertThat(Slot.of(SyntaxKind.CODE_BLOCK, "statements").toString()).isEqualTo("CODE_BLOCK.statements");
    }
}
