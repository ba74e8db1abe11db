package com.github.droe;

/**
 * Base class of every error the front end raises. Carries the 1-based source line the
 * error refers to, or {@code -1} when no line is known.
 */
public class DroeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int lineNumber;
    private final String detail;

    public DroeException(String message) {
        this(-1, message, null);
    }

    public DroeException(String message, Throwable cause) {
        this(-1, message, cause);
    }

    public DroeException(int lineNumber, String message) {
        this(lineNumber, message, null);
    }

    public DroeException(int lineNumber, String message, Throwable cause) {
        super(lineNumber > 0 ? message + " at line " + lineNumber : message, cause);
        this.lineNumber = lineNumber;
        this.detail = message;
    }

    /**
     * @return the offending line or {@code -1} if unavailable
     */
    public int getLineNumber() {
        return lineNumber;
    }

    /**
     * @return the message without the line suffix
     */
    public String getDetail() {
        return detail;
    }
}
