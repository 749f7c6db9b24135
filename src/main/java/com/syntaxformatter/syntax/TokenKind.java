package com.syntaxformatter.syntax;

import java.util.*;

/**
 * Token kinds of the shipped grammar. Kinds with fixed text render the same
 * way every time; the others take their text from the token.
 */
public enum TokenKind {
    // Punctuation
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    LEFT_SQUARE("["),
    RIGHT_SQUARE("]"),
    LEFT_ANGLE("<"),
    RIGHT_ANGLE(">"),
    PERIOD("."),
    COMMA(","),
    COLON(":"),
    SEMICOLON(";"),
    EQUAL("="),
    ARROW("->"),
    AT_SIGN("@"),
    POUND("#"),
    BACKSLASH("\\"),
    BACKTICK("`"),
    ELLIPSIS("..."),
    EXCLAMATION_MARK("!"),
    POSTFIX_QUESTION_MARK("?"),
    INFIX_QUESTION_MARK("?"),
    PREFIX_AMPERSAND("&"),
    WILDCARD("_"),

    // Operators
    PREFIX_OPERATOR(null),
    POSTFIX_OPERATOR(null),
    BINARY_OPERATOR(null),

    // Names and literals
    IDENTIFIER(null),
    DOLLAR_IDENTIFIER(null),
    INTEGER_LITERAL(null),
    FLOAT_LITERAL(null),
    STRING_QUOTE("\""),
    MULTILINE_STRING_QUOTE("\"\"\""),
    SINGLE_QUOTE("'"),
    STRING_SEGMENT(null),
    RAW_STRING_POUND_DELIMITER(null),

    // Pound keywords
    POUND_IF_KEYWORD("#if", true),
    POUND_ELSEIF_KEYWORD("#elseif", true),
    POUND_ELSE_KEYWORD("#else", true),
    POUND_ENDIF_KEYWORD("#endif", true),
    POUND_AVAILABLE_KEYWORD("#available", true),
    POUND_SOURCE_LOCATION_KEYWORD("#sourceLocation", true),

    // Keywords
    ANY_KEYWORD("Any", true),
    AS_KEYWORD("as", true),
    ASSOCIATEDTYPE_KEYWORD("associatedtype", true),
    ASYNC_KEYWORD("async", true),
    AWAIT_KEYWORD("await", true),
    BREAK_KEYWORD("break", true),
    CASE_KEYWORD("case", true),
    CATCH_KEYWORD("catch", true),
    CLASS_KEYWORD("class", true),
    CONTINUE_KEYWORD("continue", true),
    DEFAULT_KEYWORD("default", true),
    DEFER_KEYWORD("defer", true),
    DO_KEYWORD("do", true),
    ELSE_KEYWORD("else", true),
    ENUM_KEYWORD("enum", true),
    EXTENSION_KEYWORD("extension", true),
    FALLTHROUGH_KEYWORD("fallthrough", true),
    FALSE_KEYWORD("false", true),
    FILEPRIVATE_KEYWORD("fileprivate", true),
    FOR_KEYWORD("for", true),
    FUNC_KEYWORD("func", true),
    GET_KEYWORD("get", true),
    GUARD_KEYWORD("guard", true),
    IF_KEYWORD("if", true),
    IMPORT_KEYWORD("import", true),
    IN_KEYWORD("in", true),
    INIT_KEYWORD("init", true),
    INOUT_KEYWORD("inout", true),
    INTERNAL_KEYWORD("internal", true),
    IS_KEYWORD("is", true),
    LET_KEYWORD("let", true),
    NIL_KEYWORD("nil", true),
    OPERATOR_KEYWORD("operator", true),
    PRECEDENCEGROUP_KEYWORD("precedencegroup", true),
    PRIVATE_KEYWORD("private", true),
    PROTOCOL_KEYWORD("protocol", true),
    PUBLIC_KEYWORD("public", true),
    REPEAT_KEYWORD("repeat", true),
    RETHROWS_KEYWORD("rethrows", true),
    RETURN_KEYWORD("return", true),
    SELF_KEYWORD("self", true),
    SELF_TYPE_KEYWORD("Self", true),
    SET_KEYWORD("set", true),
    STATIC_KEYWORD("static", true),
    STRUCT_KEYWORD("struct", true),
    SUBSCRIPT_KEYWORD("subscript", true),
    SUPER_KEYWORD("super", true),
    SWITCH_KEYWORD("switch", true),
    THROW_KEYWORD("throw", true),
    THROWS_KEYWORD("throws", true),
    TRUE_KEYWORD("true", true),
    TRY_KEYWORD("try", true),
    TYPEALIAS_KEYWORD("typealias", true),
    VAR_KEYWORD("var", true),
    WHERE_KEYWORD("where", true),
    WHILE_KEYWORD("while", true),

    END_OF_FILE("");

    private static final Map<String, TokenKind> KEYWORDS_BY_TEXT;

    static {
        Map<String, TokenKind> keywords = new HashMap<>();
        for (TokenKind kind : values()) {
            if (kind.keyword) {
                keywords.put(kind.fixedText, kind);
            }
        }
        KEYWORDS_BY_TEXT = Collections.unmodifiableMap(keywords);
    }

    private final String fixedText;
    private final boolean keyword;

    TokenKind(String fixedText) {
        this(fixedText, false);
    }

    TokenKind(String fixedText, boolean keyword) {
        this.fixedText = fixedText;
        this.keyword = keyword;
    }

    /**
     * The text every token of this kind has, or null if it varies.
     */
    public String getFixedText() {
        return fixedText;
    }

    public boolean hasFixedText() {
        return fixedText != null;
    }

    public boolean isKeyword() {
        return keyword;
    }

    /**
     * Looks up the keyword or pound keyword spelled {@code text}.
     */
    public static Optional<TokenKind> keyword(String text) {
        return Optional.ofNullable(KEYWORDS_BY_TEXT.get(text));
    }
}
