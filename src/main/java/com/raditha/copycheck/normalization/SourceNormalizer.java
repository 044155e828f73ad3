package com.raditha.copycheck.normalization;

import com.raditha.copycheck.model.Document;
import com.raditha.copycheck.model.NormalizedDocument;
import com.raditha.copycheck.model.NormalizedLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cleans raw source lines so that only structure remains.
 * <p>
 * For each line: comments are stripped (line comments and block comments,
 * including block comments spanning several lines), whitespace runs are
 * collapsed to one space, blank lines are dropped, and every identifier that
 * is not a {@link ReservedWords reserved word} is replaced by its
 * {@link IdentifierTable} placeholder.
 * <p>
 * The instance itself is stateless; all per-document state lives in a
 * {@link NormalizationPass} created by {@link #normalize(Document)}.
 */
public class SourceNormalizer {

    private static final Logger logger = LoggerFactory.getLogger(SourceNormalizer.class);

    static final String LINE_COMMENT = "//";
    static final String BLOCK_COMMENT_START = "/*";
    static final String BLOCK_COMMENT_END = "*/";

    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Normalize a whole document.
     */
    public NormalizedDocument normalize(Document document) {
        NormalizationPass pass = new NormalizationPass();
        List<NormalizedLine> normalized = new ArrayList<>();

        List<String> rawLines = document.lines();
        for (int i = 0; i < rawLines.size(); i++) {
            String cleaned = pass.process(rawLines.get(i));
            if (cleaned != null) {
                normalized.add(new NormalizedLine(cleaned, i + 1));
            }
        }

        logger.debug("Normalized {} raw lines into {} lines with {} distinct identifiers",
                rawLines.size(), normalized.size(), pass.identifiers.size());
        return new NormalizedDocument(normalized);
    }

    /**
     * Convenience overload for raw text.
     */
    public NormalizedDocument normalize(String text) {
        return normalize(Document.of(text));
    }

    /**
     * State carried from one line to the next within a single document.
     */
    private static final class NormalizationPass {
        private final IdentifierTable identifiers = new IdentifierTable();
        private boolean insideBlockComment;

        /**
         * Clean one raw line.
         *
         * @return the normalized text, or null when nothing is left
         */
        String process(String rawLine) {
            String line = rawLine.trim();
            if (line.isEmpty()) {
                return null;
            }

            if (insideBlockComment) {
                int end = line.indexOf(BLOCK_COMMENT_END);
                if (end == -1) {
                    return null;
                }
                line = line.substring(end + BLOCK_COMMENT_END.length());
                insideBlockComment = false;
            }

            int lineComment = line.indexOf(LINE_COMMENT);
            if (lineComment != -1) {
                line = line.substring(0, lineComment);
            }

            line = stripBlockComments(line);

            line = WHITESPACE_RUN.matcher(line).replaceAll(" ").trim();
            if (line.isEmpty()) {
                return null;
            }
            return canonicalizeIdentifiers(line);
        }

        private String stripBlockComments(String line) {
            int start = line.indexOf(BLOCK_COMMENT_START);
            while (start != -1) {
                int end = line.indexOf(BLOCK_COMMENT_END, start + BLOCK_COMMENT_START.length());
                if (end == -1) {
                    insideBlockComment = true;
                    return line.substring(0, start);
                }
                line = line.substring(0, start) + line.substring(end + BLOCK_COMMENT_END.length());
                start = line.indexOf(BLOCK_COMMENT_START);
            }
            return line;
        }

        /**
         * Replace each maximal identifier-shaped word, left to right.
         * Word runs that start with a digit (numbers, suffixed literals) are
         * left alone.
         */
        private String canonicalizeIdentifiers(String line) {
            StringBuilder out = new StringBuilder(line.length() + 16);
            int i = 0;
            while (i < line.length()) {
                char c = line.charAt(i);
                if (!isWordChar(c)) {
                    out.append(c);
                    i++;
                    continue;
                }
                int end = i;
                while (end < line.length() && isWordChar(line.charAt(end))) {
                    end++;
                }
                String word = line.substring(i, end);
                if (isIdentifierStart(c) && !ReservedWords.isReserved(word)) {
                    out.append(identifiers.placeholderFor(word));
                } else {
                    out.append(word);
                }
                i = end;
            }
            return out.toString();
        }
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isWordChar(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
