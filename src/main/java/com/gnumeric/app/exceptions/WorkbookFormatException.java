package com.gnumeric.app.exceptions;

/**
 * Thrown when a document can't be read as a Gnumeric workbook.
 */
public class WorkbookFormatException extends RuntimeException {
    public WorkbookFormatException(String message) {
        super(message);
    }

    public WorkbookFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
