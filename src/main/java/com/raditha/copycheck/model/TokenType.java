package com.raditha.copycheck.model;

/**
 * Lexical category of a token produced while fingerprinting a window.
 */
public enum TokenType {
    /** Identifier-shaped word: keyword, placeholder or raw identifier */
    WORD,

    /** Numeric literal, including suffixes and hex forms */
    NUMBER,

    /** Double-quoted string literal */
    STRING,

    /** Single-quoted character literal */
    CHAR,

    /** Operator such as {@code +}, {@code ==} or {@code <<=} */
    OPERATOR,

    /** Brackets, separators and anything else */
    PUNCTUATION,

    /** Boundary between two lines of the window */
    NEWLINE
}
