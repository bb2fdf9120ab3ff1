package com.gnumeric.app.exceptions;

/**
 * Thrown when a row, column or cell operation is attempted on an object (chart) sheet.
 */
public class UnsupportedSheetOperationException extends RuntimeException {
    public UnsupportedSheetOperationException(String message) {
        super(message);
    }
}
