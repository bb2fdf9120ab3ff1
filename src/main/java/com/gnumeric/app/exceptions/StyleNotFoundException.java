package com.gnumeric.app.exceptions;

/**
 * Thrown when no style region covers a cell, or the covering style carries no number format.
 */
public class StyleNotFoundException extends RuntimeException {
    public StyleNotFoundException(String message) {
        super(message);
    }
}
