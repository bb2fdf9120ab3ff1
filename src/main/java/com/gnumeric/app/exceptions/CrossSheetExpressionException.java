package com.gnumeric.app.exceptions;

/**
 * Thrown when an expression owned by one sheet is assigned into a cell of another.
 * Expression ids are sheet-scoped, so copying across sheets is not supported.
 */
public class CrossSheetExpressionException extends RuntimeException {
    public CrossSheetExpressionException(String message) {
        super(message);
    }
}
