package com.syntaxformatter.metadata;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.syntaxformatter.syntax.Slot;
import com.syntaxformatter.syntax.SyntaxKind;
import com.syntaxformatter.syntax.TokenKind;
import org.junit.jupiter.api.Test;

class FormatMetadataTest {

    private static final Slot STATEMENTS = Slot.of(SyntaxKind.CODE_BLOCK, "statements");

    @Test
    void unknownSlotsHaveNoRequirements() {
        FormatMetadata metadata = FormatMetadata.builder().build();

        assertThat(metadata.slot(STATEMENTS)).isSameAs(SlotMetadata.NONE);
        assertThat(metadata.slot(null)).isSameAs(SlotMetadata.NONE);
        assertThat(metadata.childrenSeparatedByNewline(SyntaxKind.CODE_BLOCK_ITEM_LIST)).isFalse();
    }

    @Test
    void builderMergesFactsForTheSameSlot() {
        FormatMetadata metadata = FormatMetadata.builder()
                .requiresIndent(STATEMENTS, true)
                .trailingSpace(STATEMENTS, TriState.FALSE)
                .build();

        SlotMetadata slot = metadata.slot(STATEMENTS);
        assertThat(slot.requiresIndent()).isTrue();
        assertThat(slot.requiresLeadingNewline()).isFalse();
        assertThat(slot.getLeadingSpace()).isEqualTo(TriState.UNSET);
        assertThat(slot.getTrailingSpace()).isEqualTo(TriState.FALSE);
    }

    @Test
    void firstMatchingRuleWins() {
        FormatMetadata metadata = FormatMetadata.builder()
                .addWhitespaceRule(WhitespaceRule.never(WhitespaceRule.Side.of(TokenKind.IDENTIFIER),
                        WhitespaceRule.Side.ANY))
                .addWhitespaceRule(WhitespaceRule.always(WhitespaceRule.Side.of(TokenKind.IDENTIFIER),
                        WhitespaceRule.Side.of(TokenKind.IDENTIFIER)))
                .build();

        assertThat(metadata.requiresWhitespace(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER)).isFalse();
        assertThat(metadata.requiresWhitespace(TokenKind.COMMA, TokenKind.IDENTIFIER)).isTrue();
    }

    @Test
    void overrideTakesPrecedenceOverExistingRules() {
        FormatMetadata base = MetadataLoader.loadDefaultMetadata();

        FormatMetadata adjusted = base.toBuilder()
                .overrideWhitespace(WhitespaceRule.always(WhitespaceRule.Side.of(TokenKind.IDENTIFIER),
                        WhitespaceRule.Side.of(TokenKind.LEFT_PAREN)))
                .build();

        assertThat(base.requiresWhitespace(TokenKind.IDENTIFIER, TokenKind.LEFT_PAREN)).isFalse();
        assertThat(adjusted.requiresWhitespace(TokenKind.IDENTIFIER, TokenKind.LEFT_PAREN)).isTrue();
        assertThat(adjusted.getSlots()).isEqualTo(base.getSlots());
    }

    @Test
    void edgeSideMatchesOnlyTheStreamEdge() {
        WhitespaceRule rule = WhitespaceRule.never(WhitespaceRule.Side.EDGE, WhitespaceRule.Side.ANY);

        assertThat(rule.matches(null, TokenKind.IDENTIFIER)).isTrue();
        assertThat(rule.matches(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER)).isFalse();
        assertThat(WhitespaceRule.Side.ANY.matches(null)).isTrue();
    }

    @Test
    void parsesRuleSides() {
        assertThat(WhitespaceRule.Side.parse(" * ")).isSameAs(WhitespaceRule.Side.ANY);
        assertThat(WhitespaceRule.Side.parse("EDGE")).isSameAs(WhitespaceRule.Side.EDGE);
        assertThat(WhitespaceRule.Side.parse("COMMA")).isEqualTo(WhitespaceRule.Side.of(TokenKind.COMMA));
        assertThatThrownBy(() -> WhitespaceRule.Side.parse("NOPE")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void separatedKindsCanBeRemovedAgain() {
        FormatMetadata metadata = FormatMetadata.builder()
                .childrenSeparatedByNewline(SyntaxKind.SWITCH_CASE_LIST, true)
                .childrenSeparatedByNewline(SyntaxKind.SWITCH_CASE_LIST, false)
                .build();

        assertThat(metadata.getNewlineSeparatedKinds()).isEmpty();
    }

    @Test
    void triStateFallsBackOnlyWhenUnset() {
        assertThat(TriState.of(null)).isEqualTo(TriState.UNSET);
        assertThat(TriState.UNSET.orElse(true)).isTrue();
        assertThat(TriState.FALSE.orElse(true)).isFalse();
        assertThat(TriState.TRUE.isSet()).isTrue();
    }
}
