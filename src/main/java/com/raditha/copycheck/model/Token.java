package com.raditha.copycheck.model;

/**
 * A lexical token from a window of normalized lines.
 *
 * @param type category of the token
 * @param text exact source text of the token
 */
public record Token(TokenType type, String text) {

    public boolean is(TokenType expectedType, String expectedText) {
        return type == expectedType && text.equals(expectedText);
    }

    public boolean isOpenParen() {
        return is(TokenType.PUNCTUATION, "(");
    }

    public boolean isCloseParen() {
        return is(TokenType.PUNCTUATION, ")");
    }
}
