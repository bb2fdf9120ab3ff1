package com.gnumeric.app.exceptions;

/**
 * Thrown when a cell is addressed outside the sheet's allowed rows/columns,
 * or when an existing cell is required at a position that has none.
 * Carries the requested position and the allowed maxima.
 */
public class CellIndexOutOfRangeException extends RuntimeException {
    private final int row;
    private final int column;
    private final int maxAllowedRow;
    private final int maxAllowedColumn;

    public CellIndexOutOfRangeException(String message, int row, int column, int maxAllowedRow, int maxAllowedColumn) {
        super(message);
        this.row = row;
        this.column = column;
        this.maxAllowedRow = maxAllowedRow;
        this.maxAllowedColumn = maxAllowedColumn;
    }

    public int getRow() {
        return row;
    }

    public int getColumn() {
        return column;
    }

    public int getMaxAllowedRow() {
        return maxAllowedRow;
    }

    public int getMaxAllowedColumn() {
        return maxAllowedColumn;
    }
}
