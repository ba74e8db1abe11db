package com.github.droe.parser;

import java.util.List;

import lombok.RequiredArgsConstructor;

/**
 * Walks comment-stripped source lines. Line numbers are 1-based.
 */
@RequiredArgsConstructor
class LineCursor {
    private final List<String> lines;
    private int index;

    boolean hasNext() {
        return index < lines.size();
    }

    /** Advances past blank lines; false at end of input. */
    boolean skipBlank() {
        while (hasNext() && lines.get(index).isBlank()) {
            index++;
        }
        return hasNext();
    }

    String peek() {
        return lines.get(index);
    }

    String next() {
        return lines.get(index++);
    }

    /** Line number of the line {@link #peek()} would return. */
    int lineNumber() {
        return index + 1;
    }

    int indentation() {
        return TextScanner.indentation(peek());
    }
}
