package com.keysort.exception;

/**
 * Base exception for the keybinding sorter.
 */
public class KeySortException extends RuntimeException {

    public KeySortException(String message) {
        super(message);
    }

    public KeySortException(String message, Throwable cause) {
        super(message, cause);
    }
}
