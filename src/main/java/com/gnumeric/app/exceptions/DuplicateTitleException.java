package com.gnumeric.app.exceptions;

/**
 * A workbook cannot contain multiple sheets with the same title.
 */
public class DuplicateTitleException extends RuntimeException {
    public DuplicateTitleException(String message) {
        super(message);
    }
}
