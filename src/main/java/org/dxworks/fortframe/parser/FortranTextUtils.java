package org.dxworks.fortframe.parser;

import java.util.ArrayList;
import java.util.List;

public final class FortranTextUtils {

    private FortranTextUtils() {
        // utility class
    }

    public static int findMatchingParen(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length()) {
            return -1;
        }
        int depth = 0;
        for (int i = openIdx; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Splits on {@code separator} wherever it is not nested in round or square brackets.
     * Empty trailing parts are dropped, inner parts are kept untrimmed.
     */
    public static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        if (text == null) {
            return parts;
        }
        int depth = 0;
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(' || c == '[') {
                depth++;
                current.append(c);
            } else if (c == ')' || c == ']') {
                depth--;
                current.append(c);
            } else if (c == separator && depth == 0) {
                parts.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    /**
     * Returns the pieces of {@code line} found at parenthesis depth {@code level}.
     * Anything nested deeper collapses to {@code ()}, so {@code a = f(g(x)) + h(y)}
     * yields {@code ["a = f() + h()"]} at level 0 and {@code ["g()", "y"]} at level 1.
     */
    public static List<String> stripParen(String line, int level) {
        List<String> result = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(') {
                if (depth == level) {
                    current.append('(');
                }
                depth++;
                if (depth == level && level > 0) {
                    current.setLength(0);
                }
            } else if (c == ')') {
                if (depth == level && level > 0) {
                    addPiece(result, current);
                }
                depth--;
                if (depth == level) {
                    current.append(')');
                }
            } else if (depth == level) {
                current.append(c);
            }
        }
        if (level == 0) {
            addPiece(result, current);
        }
        return result;
    }

    private static void addPiece(List<String> result, StringBuilder current) {
        String piece = current.toString();
        if (!piece.isBlank()) {
            result.add(piece);
        }
        current.setLength(0);
    }

    /**
     * Reads a leading run of bracketed text and non-word characters, stopping at the
     * first letter, underscore, colon, comma or blank found outside any bracket.
     * {@code "(kind=8), intent(in) :: x"} gives {@code "(kind=8)"}, {@code "*8 :: x"} gives {@code "*8"}.
     */
    public static String getParens(String line) {
        if (line == null || line.isEmpty()) {
            return line;
        }
        StringBuilder parens = new StringBuilder();
        int level = 0;
        int bracketLevel = 0;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '(') {
                level++;
            } else if (c == ')') {
                level--;
            } else if (c == '[') {
                bracketLevel++;
            } else if (c == ']') {
                bracketLevel--;
            } else if ((Character.isLetter(c) || c == '_' || c == ':' || c == ',' || c == ' ')
                    && level == 0 && bracketLevel == 0) {
                return parens.toString();
            }
            parens.append(c);
        }
        if (level == 0 && bracketLevel == 0) {
            return parens.toString();
        }
        throw new IllegalArgumentException("Couldn't parse parentheses: " + line);
    }

    /** Removes one enclosing pair of parentheses when the whole text is wrapped in it. */
    public static String stripOuterParens(String text) {
        String trimmed = text.strip();
        if (trimmed.startsWith("(") && trimmed.endsWith(")")
                && findMatchingParen(trimmed, 0) == trimmed.length() - 1) {
            return trimmed.substring(1, trimmed.length() - 1).strip();
        }
        return trimmed;
    }
}
