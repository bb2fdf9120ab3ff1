package com.gnumeric.app.exceptions;

/**
 * Thrown when a cell has no ValueType tag and nothing marks it as an expression
 * (no ExprID, text not starting with '='), so its type can't be determined.
 * The message carries the offending cell's XML.
 */
public class UnrecognizedCellTypeException extends RuntimeException {
    public UnrecognizedCellTypeException(String message) {
        super(message);
    }
}
