package com.raditha.copycheck.fingerprint;

import com.raditha.copycheck.model.Token;
import com.raditha.copycheck.model.TokenType;
import com.raditha.copycheck.normalization.ReservedWords;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces a window of normalized lines to a structure-only string.
 * <p>
 * A single left-to-right pass over the tokens replaces:
 * <ul>
 * <li>{@code if}/{@code for}/{@code while}/{@code switch} headers with
 * {@code IF_STMT}, {@code FOR_STMT}, {@code WHILE_STMT}, {@code SWITCH_STMT}</li>
 * <li>{@code name(...)} with {@code FUNC_CALL}, arguments discarded</li>
 * <li>assignment operators with {@code ASSIGN}</li>
 * <li>{@code + - * / %} with {@code OP}</li>
 * <li>{@code < > <= >= == !=} with {@code CMP}</li>
 * <li>identifiers with {@code ID} and literals with {@code LIT}</li>
 * </ul>
 * Reserved words, other operators and punctuation are kept verbatim and line
 * breaks are preserved, including those inside a skipped header or argument
 * list, so control-flow shape and operator mix survive while names and
 * values do not.
 */
public class StructuralFingerprinter {

    public static final String IF_STMT = "IF_STMT";
    public static final String FOR_STMT = "FOR_STMT";
    public static final String WHILE_STMT = "WHILE_STMT";
    public static final String SWITCH_STMT = "SWITCH_STMT";
    public static final String FUNC_CALL = "FUNC_CALL";
    public static final String ASSIGN = "ASSIGN";
    public static final String OP = "OP";
    public static final String CMP = "CMP";
    public static final String ID = "ID";
    public static final String LIT = "LIT";

    private static final Map<String, String> CONTROL_HEADERS = Map.of(
            "if", IF_STMT,
            "for", FOR_STMT,
            "while", WHILE_STMT,
            "switch", SWITCH_STMT);

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=");

    private static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/", "%", "++", "--");

    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "<=", ">=", "==", "!=");

    private final StructuralLexer lexer;

    public StructuralFingerprinter() {
        this(new StructuralLexer());
    }

    public StructuralFingerprinter(StructuralLexer lexer) {
        this.lexer = lexer;
    }

    /**
     * Fingerprint the text of a window. Pure function of its input.
     */
    public String fingerprint(String windowText) {
        List<Token> tokens = lexer.tokenize(windowText);
        StringBuilder out = new StringBuilder(windowText.length());

        int i = 0;
        while (i < tokens.size()) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case WORD -> i = emitWord(tokens, i, out);
                case NUMBER, STRING, CHAR -> {
                    append(out, LIT);
                    i++;
                }
                case OPERATOR -> {
                    append(out, classifyOperator(token.text()));
                    i++;
                }
                default -> {
                    append(out, token.text());
                    i++;
                }
            }
        }
        return out.toString();
    }

    /**
     * Emit the class token for a word and return the index of the next
     * unconsumed token.
     */
    private int emitWord(List<Token> tokens, int index, StringBuilder out) {
        String word = tokens.get(index).text();
        int paren = nextSignificant(tokens, index + 1);
        boolean opensParen = paren < tokens.size() && tokens.get(paren).isOpenParen();

        String header = CONTROL_HEADERS.get(word);
        if (header != null && opensParen) {
            append(out, header);
            return skipParenthesised(tokens, index, paren, out);
        }
        if (ReservedWords.isReserved(word)) {
            append(out, word);
            return index + 1;
        }
        if (opensParen) {
            append(out, FUNC_CALL);
            return skipParenthesised(tokens, index, paren, out);
        }
        append(out, ID);
        return index + 1;
    }

    private static String classifyOperator(String operator) {
        if (ASSIGNMENT_OPERATORS.contains(operator)) {
            return ASSIGN;
        }
        if (ARITHMETIC_OPERATORS.contains(operator)) {
            return OP;
        }
        if (COMPARISON_OPERATORS.contains(operator)) {
            return CMP;
        }
        return operator;
    }

    /**
     * Index of the first token at or after {@code from} that is not a line
     * break.
     */
    private static int nextSignificant(List<Token> tokens, int from) {
        int i = from;
        while (i < tokens.size() && tokens.get(i).type() == TokenType.NEWLINE) {
            i++;
        }
        return i;
    }

    /**
     * Skip from the word at {@code word} through its balanced parentheses,
     * keeping any line breaks crossed so the window's line count is
     * unchanged.
     */
    private static int skipParenthesised(List<Token> tokens, int word, int open, StringBuilder out) {
        int end = skipBalanced(tokens, open);
        for (int i = word + 1; i < end; i++) {
            if (tokens.get(i).type() == TokenType.NEWLINE) {
                append(out, "\n");
            }
        }
        return end;
    }

    /**
     * Index just past the parenthesis matching the one at {@code open}, or the
     * end of the window when it is never closed.
     */
    private static int skipBalanced(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.isOpenParen()) {
                depth++;
            } else if (token.isCloseParen()) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return tokens.size();
    }

    private static void append(StringBuilder out, String token) {
        boolean lineStart = out.length() == 0 || out.charAt(out.length() - 1) == '\n';
        if (!lineStart && !"\n".equals(token)) {
            out.append(' ');
        }
        out.append(token);
    }
}
