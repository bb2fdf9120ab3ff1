package com.gnumeric.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gnumeric.app.exceptions.InvalidTypeException;

/**
 * REGULAR worksheets hold a cell grid; OBJECT sheets hold an embedded chart and have no grid.
 */
public enum SheetType {
    REGULAR,
    OBJECT;

    /**
     * Allows case-insensitive JSON input, e.g. "object" -> OBJECT.
     */
    @JsonCreator
    public static SheetType fromValue(String value) {
        try {
            return SheetType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidTypeException("Unknown sheet type: " + value);
        }
    }
}
