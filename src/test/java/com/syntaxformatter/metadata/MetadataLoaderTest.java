package com.syntaxformatter.metadata;

import static org.assertj.core.api.Assertions.assertThat;

import com.syntaxformatter.syntax.Slot;
import com.syntaxformatter.syntax.SyntaxKind;
import com.syntaxformatter.syntax.TokenKind;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MetadataLoaderTest {

    @TempDir
    Path tempDir;

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void bundledMetadataDescribesBlocks() {
        FormatMetadata metadata = MetadataLoader.loadDefaultMetadata();

        assertThat(metadata.slot(Slot.of(SyntaxKind.CODE_BLOCK, "statements")).requiresIndent()).isTrue();
        assertThat(metadata.slot(Slot.of(SyntaxKind.CODE_BLOCK, "rightBrace")).requiresLeadingNewline()).isTrue();
        assertThat(metadata.childrenSeparatedByNewline(SyntaxKind.CODE_BLOCK_ITEM_LIST)).isTrue();
        assertThat(metadata.childrenSeparatedByNewline(SyntaxKind.LABELED_EXPR_LIST)).isFalse();
        assertThat(metadata.slot(Slot.of(SyntaxKind.TRY_EXPR, "questionOrExclamationMark")).getTrailingSpace())
                .isEqualTo(TriState.TRUE);
    }

    @Test
    void bundledMetadataIsCached() {
        assertThat(MetadataLoader.loadDefaultMetadata()).isSameAs(MetadataLoader.loadDefaultMetadata());
        assertThat(FormatMetadata.defaults()).isSameAs(MetadataLoader.loadDefaultMetadata());
    }

    @Test
    void bundledWhitespaceTableKeepsCallsTight() {
        FormatMetadata metadata = MetadataLoader.loadDefaultMetadata();

        assertThat(metadata.requiresWhitespace(TokenKind.IDENTIFIER, TokenKind.LEFT_PAREN)).isFalse();
        assertThat(metadata.requiresWhitespace(TokenKind.EXCLAMATION_MARK, TokenKind.PERIOD)).isFalse();
        assertThat(metadata.requiresWhitespace(TokenKind.TRY_KEYWORD, TokenKind.POSTFIX_QUESTION_MARK)).isFalse();
        assertThat(metadata.requiresWhitespace(TokenKind.COMMA, TokenKind.IDENTIFIER)).isTrue();
        assertThat(metadata.requiresWhitespace(null, TokenKind.IDENTIFIER)).isFalse();
        assertThat(metadata.requiresWhitespace(TokenKind.IDENTIFIER, null)).isFalse();
    }

    @Test
    void skipsUnknownKindsAndSlots() throws IOException {
        FormatMetadata metadata = MetadataLoader.loadMetadata(yaml(""
                + "indentation:\n"
                + "  - CODE_BLOCK.statements\n"
                + "  - NO_SUCH_KIND.statements\n"
                + "  - malformed\n"
                + "newlineSeparatedChildren:\n"
                + "  - CODE_BLOCK_ITEM_LIST\n"
                + "  - NOT_A_LIST\n"
                + "whitespace:\n"
                + "  rules:\n"
                + "    - [IDENTIFIER, NOT_A_TOKEN, false]\n"
                + "    - [IDENTIFIER, COMMA]\n"
                + "    - [IDENTIFIER, COMMA, false]\n"));

        assertThat(metadata.getSlots()).containsOnlyKeys(Slot.of(SyntaxKind.CODE_BLOCK, "statements"));
        assertThat(metadata.getNewlineSeparatedKinds()).containsExactly(SyntaxKind.CODE_BLOCK_ITEM_LIST);
        assertThat(metadata.getWhitespaceRules()).hasSize(1);
        assertThat(metadata.requiresWhitespace(TokenKind.IDENTIFIER, TokenKind.COMMA)).isFalse();
    }

    @Test
    void readsSlotOverridesAsTriState() throws IOException {
        FormatMetadata metadata = MetadataLoader.loadMetadata(yaml(""
                + "leadingSpace:\n"
                + "  FUNCTION_PARAMETER.secondName: true\n"
                + "  MISSING_EXPR.placeholder: ~\n"
                + "trailingSpace:\n"
                + "  SWITCH_CASE_LABEL.colon: false\n"
                + "  BREAK_STMT.breakKeyword: maybe\n"));

        assertThat(metadata.slot(Slot.of(SyntaxKind.FUNCTION_PARAMETER, "secondName")).getLeadingSpace())
                .isEqualTo(TriState.TRUE);
        assertThat(metadata.slot(Slot.of(SyntaxKind.MISSING_EXPR, "placeholder")).getLeadingSpace())
                .isEqualTo(TriState.UNSET);
        assertThat(metadata.slot(Slot.of(SyntaxKind.SWITCH_CASE_LABEL, "colon")).getTrailingSpace())
                .isEqualTo(TriState.FALSE);
        assertThat(metadata.slot(Slot.of(SyntaxKind.BREAK_STMT, "breakKeyword")).getTrailingSpace())
                .isEqualTo(TriState.UNSET);
    }

    @Test
    void readsWhitespaceDefault() throws IOException {
        FormatMetadata metadata = MetadataLoader.loadMetadata(yaml("whitespace:\n  default: false\n"));

        assertThat(metadata.getDefaultWhitespace()).isFalse();
        assertThat(metadata.requiresWhitespace(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER)).isFalse();
    }

    @Test
    void emptyMappingGivesEmptyTable() throws IOException {
        FormatMetadata metadata = MetadataLoader.loadMetadata(yaml("{}\n"));

        assertThat(metadata.getSlots()).isEmpty();
        assertThat(metadata.getWhitespaceRules()).isEmpty();
        assertThat(metadata.getDefaultWhitespace()).isTrue();
    }

    @Test
    void loadsMetadataFile() throws IOException {
        Path file = tempDir.resolve("metadata.yml");
        Files.writeString(file, "indentation:\n  - MEMBER_BLOCK.members\n");

        FormatMetadata metadata = MetadataLoader.loadMetadata(file);

        assertThat(metadata.getSlots()).containsOnlyKeys(Slot.of(SyntaxKind.MEMBER_BLOCK, "members"));
    }

    @Test
    void fallsBackToBundledMetadataForMissingOrMalformedFiles() throws IOException {
        Path malformed = tempDir.resolve("broken.yml");
        Files.writeString(malformed, "indentation: [unclosed\n");

        assertThat(MetadataLoader.loadMetadata(tempDir.resolve("absent.yml")))
                .isSameAs(MetadataLoader.loadDefaultMetadata());
        assertThat(MetadataLoader.loadMetadata(malformed)).isSameAs(MetadataLoader.loadDefaultMetadata());
        assertThat(MetadataLoader.loadMetadata((Path) null)).isSameAs(MetadataLoader.loadDefaultMetadata());
    }
}
