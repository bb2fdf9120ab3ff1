package com.gnumeric.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gnumeric.app.exceptions.InvalidTypeException;

import java.util.Comparator;

/**
 * Ordering of {@link Sheet#getCellCollection(boolean, CellOrder)}.
 * NONE keeps storage order.
 */
public enum CellOrder {
    NONE(null),
    ROW_MAJOR(Comparator.comparingInt(Cell::getRow).thenComparingInt(Cell::getColumn)),
    COLUMN_MAJOR(Comparator.comparingInt(Cell::getColumn).thenComparingInt(Cell::getRow));

    private final Comparator<Cell> comparator;

    CellOrder(Comparator<Cell> comparator) {
        this.comparator = comparator;
    }

    Comparator<Cell> getComparator() {
        return comparator;
    }

    @JsonCreator
    public static CellOrder fromValue(String value) {
        switch (value.trim().toLowerCase()) {
            case "none":
                return NONE;
            case "row":
            case "row_major":
                return ROW_MAJOR;
            case "column":
            case "column_major":
                return COLUMN_MAJOR;
            default:
                throw new InvalidTypeException("Unknown cell order: " + value);
        }
    }
}
