package com.gnumeric.app.exceptions;

/**
 * Thrown when a workbook has no sheet with the requested title or index.
 */
public class SheetNotFoundException extends RuntimeException {
    public SheetNotFoundException(String message) {
        super(message);
    }
}
