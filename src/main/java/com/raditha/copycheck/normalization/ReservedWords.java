package com.raditha.copycheck.normalization;

import java.util.Set;

/**
 * Keywords, common built-in types and preprocessor words that survive
 * identifier canonicalization unchanged.
 */
public final class ReservedWords {

    private static final Set<String> WORDS = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do",
            "double", "else", "enum", "extern", "float", "for", "goto", "if",
            "int", "long", "register", "return", "short", "signed", "sizeof", "static",
            "struct", "switch", "typedef", "union", "unsigned", "void", "volatile", "while",
            "class", "namespace", "try", "catch", "new", "delete", "this", "template",
            "nullptr", "true", "false", "bool", "private", "protected", "public", "virtual",
            "friend", "operator", "using", "throw",
            // preprocessor
            "include", "define", "ifdef", "ifndef", "endif", "pragma",
            // standard library names
            "std", "string", "vector", "map", "set", "list", "queue", "stack",
            "pair", "cout", "cin", "cerr", "endl");

    private ReservedWords() {
    }

    public static boolean isReserved(String word) {
        return WORDS.contains(word);
    }
}
