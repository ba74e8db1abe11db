package com.github.droe.typer;

import com.github.droe.DroeException;

public class TypeCheckException extends DroeException {

    private static final long serialVersionUID = 1L;

    public TypeCheckException(String message) {
        super(message);
    }

    public TypeCheckException(int lineNumber, String message) {
        super(lineNumber, message);
    }
}
