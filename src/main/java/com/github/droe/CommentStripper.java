package com.github.droe;

import java.util.ArrayList;
import java.util.List;

import com.github.droe.parser.TextScanner;

import lombok.RequiredArgsConstructor;

/**
 * Removes {@code //} and {@code /* ... *}{@code /} comments from source text. Comment markers
 * inside single or double quoted strings are kept. An unterminated block comment consumes
 * the rest of the input. Trailing whitespace is trimmed from every line and the line count
 * never changes, so line numbers stay valid after stripping.
 */
@RequiredArgsConstructor
public class CommentStripper {

    private final boolean hashComments;

    public CommentStripper() {
        this(true);
    }

    public String strip(String source) {
        return String.join("\n", stripLines(source));
    }

    public List<String> stripLines(String source) {
        List<String> result = new ArrayList<>();
        boolean inBlockComment = false;

        for (var line : source.split("\r?\n", -1)) {
            if (!inBlockComment && hashComments && line.stripLeading().startsWith("#")) {
                result.add("");
                continue;
            }

            var processed = new StringBuilder();
            char stringChar = 0;
            int index = 0;

            while (index < line.length()) {
                char cur = line.charAt(index);

                if (inBlockComment) {
                    if (line.startsWith("*/", index)) {
                        inBlockComment = false;
                        index += 2;
                    } else {
                        index++;
                    }
                    continue;
                }

                if (stringChar != 0) {
                    if (cur == stringChar && !TextScanner.isEscaped(line, index)) {
                        stringChar = 0;
                    }
                    processed.append(cur);
                    index++;
                    continue;
                }

                if (cur == '"' || cur == '\'') {
                    stringChar = cur;
                    processed.append(cur);
                    index++;
                } else if (line.startsWith("/*", index)) {
                    inBlockComment = true;
                    index += 2;
                } else if (line.startsWith("//", index)) {
                    break;
                } else {
                    processed.append(cur);
                    index++;
                }
            }

            result.add(processed.toString().stripTrailing());
        }
        return result;
    }
}
