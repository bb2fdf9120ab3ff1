package com.gnumeric.app.models;

import java.util.Objects;

/**
 * Minimal bounding rectangle of a sheet's data. All four values are -1 when the sheet holds no data.
 */
public class Dimension {
    private final int minRow;
    private final int minColumn;
    private final int maxRow;
    private final int maxColumn;

    public Dimension(int minRow, int minColumn, int maxRow, int maxColumn) {
        this.minRow = minRow;
        this.minColumn = minColumn;
        this.maxRow = maxRow;
        this.maxColumn = maxColumn;
    }

    public int getMinRow() {
        return minRow;
    }

    public int getMinColumn() {
        return minColumn;
    }

    public int getMaxRow() {
        return maxRow;
    }

    public int getMaxColumn() {
        return maxColumn;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Dimension)) {
            return false;
        }
        Dimension other = (Dimension) o;
        return minRow == other.minRow && minColumn == other.minColumn
                && maxRow == other.maxRow && maxColumn == other.maxColumn;
    }

    @Override
    public int hashCode() {
        return Objects.hash(minRow, minColumn, maxRow, maxColumn);
    }

    @Override
    public String toString() {
        return "(" + minRow + ", " + minColumn + ", " + maxRow + ", " + maxColumn + ")";
    }
}
