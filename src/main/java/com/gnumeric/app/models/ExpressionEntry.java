package com.gnumeric.app.models;

import java.util.Objects;

/**
 * Where a shared expression's literal text lives, and that text.
 */
public class ExpressionEntry {
    private final Coordinate coordinate;
    private final String text;

    public ExpressionEntry(Coordinate coordinate, String text) {
        this.coordinate = coordinate;
        this.text = text;
    }

    public Coordinate getCoordinate() {
        return coordinate;
    }

    public String getText() {
        return text;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ExpressionEntry)) {
            return false;
        }
        ExpressionEntry other = (ExpressionEntry) o;
        return coordinate.equals(other.coordinate) && Objects.equals(text, other.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(coordinate, text);
    }

    @Override
    public String toString() {
        return "(" + coordinate + ", " + text + ")";
    }
}
