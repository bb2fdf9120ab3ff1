package com.gnumeric.app.exceptions;

/**
 * Thrown when a value, value type name or directive supplied by a caller
 * can't be interpreted (e.g., "valueType": "money" or a JSON object as a cell value).
 */
public class InvalidTypeException extends RuntimeException {
    public InvalidTypeException(String message) {
        super(message);
    }
}
