package com.raditha.copycheck.fingerprint;

import com.raditha.copycheck.model.Token;
import com.raditha.copycheck.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits window text into tokens for fingerprinting.
 * Whitespace is dropped; line breaks are kept as {@link TokenType#NEWLINE}.
 * Operators are read with maximal munch so that {@code <=} is never seen as
 * {@code <} followed by {@code =}.
 */
public class StructuralLexer {

    private static final Set<String> THREE_CHAR_OPERATORS = Set.of("<<=", ">>=");

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
            "==", "!=", "<=", ">=", "<<", ">>", "->", "::", "&&", "||", "++", "--",
            "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=");

    private static final String OPERATOR_CHARS = "+-*/%=<>!&|^~?:";

    public List<Token> tokenize(String text) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n') {
                tokens.add(new Token(TokenType.NEWLINE, "\n"));
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if (isIdentifierStart(c)) {
                int end = scanWord(text, i);
                tokens.add(new Token(TokenType.WORD, text.substring(i, end)));
                i = end;
            } else if (c >= '0' && c <= '9') {
                int end = scanNumber(text, i);
                tokens.add(new Token(TokenType.NUMBER, text.substring(i, end)));
                i = end;
            } else if (c == '"' || c == '\'') {
                int end = scanQuoted(text, i, c);
                tokens.add(new Token(c == '"' ? TokenType.STRING : TokenType.CHAR, text.substring(i, end)));
                i = end;
            } else {
                String operator = matchOperator(text, i);
                if (operator != null) {
                    tokens.add(new Token(TokenType.OPERATOR, operator));
                    i += operator.length();
                } else {
                    tokens.add(new Token(TokenType.PUNCTUATION, String.valueOf(c)));
                    i++;
                }
            }
        }
        return tokens;
    }

    private static int scanWord(String text, int start) {
        int end = start;
        while (end < text.length() && isWordChar(text.charAt(end))) {
            end++;
        }
        return end;
    }

    /**
     * Digits plus letters, underscores and dots, which covers {@code 0x1F},
     * {@code 10UL} and {@code 3.14f}.
     */
    private static int scanNumber(String text, int start) {
        int end = start;
        while (end < text.length() && (isWordChar(text.charAt(end)) || text.charAt(end) == '.')) {
            end++;
        }
        return end;
    }

    /**
     * Scan to the closing quote, honouring backslash escapes.
     * An unterminated literal ends at the line break.
     */
    private static int scanQuoted(String text, int start, char quote) {
        int end = start + 1;
        while (end < text.length()) {
            char c = text.charAt(end);
            if (c == '\\' && end + 1 < text.length()) {
                end += 2;
            } else if (c == quote) {
                return end + 1;
            } else if (c == '\n') {
                return end;
            } else {
                end++;
            }
        }
        return end;
    }

    private static String matchOperator(String text, int start) {
        if (start + 3 <= text.length() && THREE_CHAR_OPERATORS.contains(text.substring(start, start + 3))) {
            return text.substring(start, start + 3);
        }
        if (start + 2 <= text.length() && TWO_CHAR_OPERATORS.contains(text.substring(start, start + 2))) {
            return text.substring(start, start + 2);
        }
        char c = text.charAt(start);
        if (OPERATOR_CHARS.indexOf(c) >= 0) {
            return String.valueOf(c);
        }
        return null;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isWordChar(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
