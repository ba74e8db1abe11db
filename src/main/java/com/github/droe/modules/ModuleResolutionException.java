package com.github.droe.modules;

import com.github.droe.DroeException;

/**
 * Missing include file, circular include, or an included file that does not parse.
 */
public class ModuleResolutionException extends DroeException {

    private static final long serialVersionUID = 1L;

    public ModuleResolutionException(String message) {
        super(message);
    }

    public ModuleResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public ModuleResolutionException(int lineNumber, String message) {
        super(lineNumber, message);
    }
}
