package com.syntaxformatter.syntax;

/**
 * Node kinds of the shipped grammar. Collection kinds hold a homogeneous
 * run of elements instead of named fields.
 */
public enum SyntaxKind {
    SOURCE_FILE,
    CODE_BLOCK_ITEM_LIST(true),
    CODE_BLOCK_ITEM,
    CODE_BLOCK,

    // Declarations
    ATTRIBUTE_LIST(true),
    ATTRIBUTE,
    DECL_MODIFIER_LIST(true),
    DECL_MODIFIER,
    IMPORT_DECL,
    FUNCTION_DECL,
    INITIALIZER_DECL,
    FUNCTION_SIGNATURE,
    FUNCTION_EFFECT_SPECIFIERS,
    FUNCTION_PARAMETER_CLAUSE,
    FUNCTION_PARAMETER_LIST(true),
    FUNCTION_PARAMETER,
    RETURN_CLAUSE,
    GENERIC_PARAMETER_CLAUSE,
    GENERIC_PARAMETER_LIST(true),
    GENERIC_PARAMETER,
    STRUCT_DECL,
    CLASS_DECL,
    ENUM_DECL,
    PROTOCOL_DECL,
    EXTENSION_DECL,
    INHERITANCE_CLAUSE,
    INHERITED_TYPE_LIST(true),
    INHERITED_TYPE,
    MEMBER_BLOCK,
    MEMBER_BLOCK_ITEM_LIST(true),
    MEMBER_BLOCK_ITEM,
    VARIABLE_DECL,
    PATTERN_BINDING_LIST(true),
    PATTERN_BINDING,
    TYPE_ANNOTATION,
    INITIALIZER_CLAUSE,
    ACCESSOR_BLOCK,
    ACCESSOR_DECL_LIST(true),
    ACCESSOR_DECL,
    ENUM_CASE_DECL,
    ENUM_CASE_ELEMENT_LIST(true),
    ENUM_CASE_ELEMENT,
    ENUM_CASE_PARAMETER_CLAUSE,
    ENUM_CASE_PARAMETER_LIST(true),
    ENUM_CASE_PARAMETER,
    IF_CONFIG_DECL,
    IF_CONFIG_CLAUSE_LIST(true),
    IF_CONFIG_CLAUSE,
    AVAILABILITY_ARGUMENT,
    DECL_NAME_ARGUMENT,
    DYNAMIC_REPLACEMENT_ARGUMENTS,

    // Patterns
    IDENTIFIER_PATTERN,
    WILDCARD_PATTERN,
    EXPRESSION_PATTERN,

    // Statements
    RETURN_STMT,
    BREAK_STMT,
    CONTINUE_STMT,
    THROW_STMT,
    GUARD_STMT,
    CONDITION_ELEMENT_LIST(true),
    CONDITION_ELEMENT,
    OPTIONAL_BINDING_CONDITION,

    // Expressions
    IF_EXPR,
    SWITCH_EXPR,
    SWITCH_CASE_LIST(true),
    SWITCH_CASE,
    SWITCH_CASE_LABEL,
    SWITCH_CASE_ITEM_LIST(true),
    SWITCH_CASE_ITEM,
    SWITCH_DEFAULT_LABEL,
    DECL_REFERENCE_EXPR,
    INTEGER_LITERAL_EXPR,
    FLOAT_LITERAL_EXPR,
    BOOLEAN_LITERAL_EXPR,
    NIL_LITERAL_EXPR,
    STRING_LITERAL_EXPR,
    STRING_LITERAL_SEGMENT_LIST(true),
    STRING_SEGMENT,
    EXPRESSION_SEGMENT,
    SEQUENCE_EXPR,
    EXPR_LIST(true),
    BINARY_OPERATOR_EXPR,
    PREFIX_OPERATOR_EXPR,
    FUNCTION_CALL_EXPR,
    LABELED_EXPR_LIST(true),
    LABELED_EXPR,
    MEMBER_ACCESS_EXPR,
    SUBSCRIPT_CALL_EXPR,
    FORCE_UNWRAP_EXPR,
    OPTIONAL_CHAINING_EXPR,
    TRY_EXPR,
    AWAIT_EXPR,
    AS_EXPR,
    IS_EXPR,
    TUPLE_EXPR,
    ARRAY_EXPR,
    ARRAY_ELEMENT_LIST(true),
    ARRAY_ELEMENT,
    DICTIONARY_EXPR,
    DICTIONARY_ELEMENT_LIST(true),
    DICTIONARY_ELEMENT,
    CLOSURE_EXPR,
    CLOSURE_SIGNATURE,
    CLOSURE_PARAMETER_CLAUSE,
    CLOSURE_PARAMETER_LIST(true),
    CLOSURE_PARAMETER,
    CLOSURE_SHORTHAND_PARAMETER_LIST(true),
    CLOSURE_SHORTHAND_PARAMETER,
    MISSING_EXPR,
    MISSING_PATTERN,
    MISSING_STMT,
    MISSING_TYPE,
    MISSING_DECL,

    // Types
    IDENTIFIER_TYPE,
    MEMBER_TYPE,
    GENERIC_ARGUMENT_CLAUSE,
    GENERIC_ARGUMENT_LIST(true),
    GENERIC_ARGUMENT,
    OPTIONAL_TYPE,
    ARRAY_TYPE,
    DICTIONARY_TYPE,
    TUPLE_TYPE,
    TUPLE_TYPE_ELEMENT_LIST(true),
    TUPLE_TYPE_ELEMENT,
    FUNCTION_TYPE;

    private final boolean collection;

    SyntaxKind() {
        this(false);
    }

    SyntaxKind(boolean collection) {
        this.collection = collection;
    }

    public boolean isCollection() {
        return collection;
    }
}
