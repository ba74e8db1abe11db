package com.github.droe.parser;

import com.github.droe.DroeException;

/**
 * Malformed statement, expression or block, an unterminated block, or a missing mandatory
 * type annotation.
 */
public class ParseException extends DroeException {

    private static final long serialVersionUID = 1L;

    public ParseException(String message) {
        super(message);
    }

    public ParseException(int lineNumber, String message) {
        super(lineNumber, message);
    }
}
