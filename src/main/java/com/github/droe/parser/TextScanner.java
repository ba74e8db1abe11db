package com.github.droe.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Quote- and bracket-aware searching over single lines of source text. A position is
 * <em>top level</em> when it lies outside every quoted string and every pair of parentheses
 * or square brackets.
 */
public final class TextScanner {

    private TextScanner() {
    }

    public static boolean isEscaped(String text, int index) {
        int backslashes = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    /**
     * For every index of {@code text}, whether it is outside quotes. Quote characters
     * themselves count as inside.
     */
    static boolean[] outsideQuotes(String text) {
        var outside = new boolean[text.length()];
        char stringChar = 0;
        for (int i = 0; i < text.length(); i++) {
            char cur = text.charAt(i);
            if (stringChar != 0) {
                if (cur == stringChar && !isEscaped(text, i)) {
                    stringChar = 0;
                }
            } else if (cur == '"' || cur == '\'') {
                stringChar = cur;
            } else {
                outside[i] = true;
            }
        }
        return outside;
    }

    static boolean[] topLevel(String text) {
        var outside = outsideQuotes(text);
        var top = new boolean[text.length()];
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            if (!outside[i]) {
                continue;
            }
            char cur = text.charAt(i);
            if (cur == '(' || cur == '[') {
                depth++;
            } else if (cur == ')' || cur == ']') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                top[i] = true;
            }
        }
        return top;
    }

    /** First top-level occurrence of {@code needle} at or after {@code from}, or -1. */
    public static int indexOf(String text, String needle, int from) {
        var top = topLevel(text);
        for (int i = Math.max(0, from); i <= text.length() - needle.length(); i++) {
            if (top[i] && text.startsWith(needle, i)) {
                return i;
            }
        }
        return -1;
    }

    public static int indexOf(String text, String needle) {
        return indexOf(text, needle, 0);
    }

    /** Last top-level occurrence of {@code needle}, or -1. */
    public static int lastIndexOf(String text, String needle) {
        var top = topLevel(text);
        for (int i = text.length() - needle.length(); i >= 0; i--) {
            if (top[i] && text.startsWith(needle, i)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Splits on top-level occurrences of {@code separator}; parts are trimmed and empty
     * parts are dropped.
     */
    public static List<String> split(String text, char separator) {
        var top = topLevel(text);
        List<String> parts = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            if (top[i] && text.charAt(i) == separator) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts.stream().map(String::trim).filter(p -> !p.isEmpty()).toList();
    }

    /**
     * Index of the bracket closing the one at {@code open}, skipping quoted text, or -1.
     */
    public static int matchingClose(String text, int open) {
        char opening = text.charAt(open);
        char closing = opening == '(' ? ')' : opening == '[' ? ']' : '}';
        var outside = outsideQuotes(text);
        int depth = 0;
        for (int i = open; i < text.length(); i++) {
            if (!outside[i]) {
                continue;
            }
            char cur = text.charAt(i);
            if (cur == opening) {
                depth++;
            } else if (cur == closing) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** Whether {@code text} is exactly one quoted string. */
    public static boolean isQuoted(String text) {
        if (text.length() < 2) {
            return false;
        }
        char quote = text.charAt(0);
        if (quote != '"' && quote != '\'') {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (text.charAt(i) == quote && !isEscaped(text, i)) {
                return i == text.length() - 1;
            }
        }
        return false;
    }

    public static String unquote(String text) {
        return isQuoted(text) ? text.substring(1, text.length() - 1) : text;
    }

    /**
     * Splits on spaces, keeping quoted substrings (quotes included) as single tokens.
     */
    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        var current = new StringBuilder();
        char stringChar = 0;
        for (int i = 0; i < text.length(); i++) {
            char cur = text.charAt(i);
            if (stringChar == 0 && (cur == '"' || cur == '\'')) {
                stringChar = cur;
                current.append(cur);
            } else if (stringChar != 0 && cur == stringChar && !isEscaped(text, i)) {
                stringChar = 0;
                current.append(cur);
            } else if (stringChar == 0 && Character.isWhitespace(cur)) {
                if (!current.isEmpty()) {
                    tokens.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(cur);
            }
        }
        if (!current.isEmpty()) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /** Leading whitespace width, tabs counting as four columns. */
    public static int indentation(String line) {
        int width = 0;
        for (int i = 0; i < line.length(); i++) {
            char cur = line.charAt(i);
            if (cur == ' ') {
                width++;
            } else if (cur == '\t') {
                width += 4;
            } else {
                break;
            }
        }
        return width;
    }
}
