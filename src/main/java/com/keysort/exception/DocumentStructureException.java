package com.keysort.exception;

/**
 * Exception thrown when the input has no top-level array.
 * There is no recovery: the whole run is aborted.
 */
public class DocumentStructureException extends KeySortException {

    public DocumentStructureException(String message) {
        super(message);
    }
}
