package com.ciro.jlive.ast;

public enum ErrorKind {
    // Léxicos
    UNTERMINATED_TAG,
    UNTERMINATED_COMMENT,
    UNTERMINATED_EXPRESSION,
    INVALID_CHARACTER_IN_NAME,
    INVALID_ATTRIBUTE_VALUE,

    // Estructurales
    MISMATCHED_CLOSING_TAG,
    UNEXPECTED_CLOSING_TAG,
    UNCLOSED_TAG,
    UNCLOSED_BLOCK,
    MISPLACED_BLOCK,
    INVALID_TAG,
    SLOT_OUTSIDE_COMPONENT,
    RESERVED_SLOT_NAME,
    DUPLICATE_LET,
    INVALID_LET,
    LET_WITHOUT_CONTENT,
    INVALID_LOOP,
    DUPLICATE_ATTRIBUTE,
    UNSUPPORTED_ATTRIBUTE,

    // Expresiones y resolución
    INVALID_EXPRESSION,
    UNDEFINED_VARIABLE,
    UNDEFINED_COMPONENT,

    // Metadatos declarativos promovidos a error (failOnWarnings)
    DECLARATION
}
