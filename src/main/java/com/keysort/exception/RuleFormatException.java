package com.keysort.exception;

/**
 * Exception thrown when a single rule object cannot be parsed.
 * The rule is passed through unchanged by the caller.
 */
public class RuleFormatException extends KeySortException {

    public RuleFormatException(String message) {
        super(message);
    }

    public RuleFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
