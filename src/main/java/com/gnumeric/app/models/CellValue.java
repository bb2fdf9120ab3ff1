package com.gnumeric.app.models;

import com.gnumeric.app.exceptions.InvalidTypeException;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A value going into or coming out of a cell, tagged with its kind:
 * boolean, integer, float, string, shared expression or empty.
 */
public final class CellValue {

    public enum Kind {
        BOOLEAN,
        INTEGER,
        FLOAT,
        STRING,
        EXPRESSION,
        EMPTY
    }

    private static final CellValue EMPTY = new CellValue(Kind.EMPTY, null);

    private final Kind kind;
    private final Object value;

    private CellValue(Kind kind, Object value) {
        this.kind = kind;
        this.value = value;
    }

    public static CellValue of(boolean value) {
        return new CellValue(Kind.BOOLEAN, value);
    }

    public static CellValue of(long value) {
        return new CellValue(Kind.INTEGER, value);
    }

    public static CellValue of(double value) {
        return new CellValue(Kind.FLOAT, value);
    }

    /**
     * A string value; null is treated as empty.
     */
    public static CellValue of(String value) {
        return value == null ? EMPTY : new CellValue(Kind.STRING, value);
    }

    public static CellValue of(Expression expression) {
        return new CellValue(Kind.EXPRESSION, Objects.requireNonNull(expression, "expression"));
    }

    public static CellValue empty() {
        return EMPTY;
    }

    /**
     * Wraps a loosely typed value (as produced by JSON binding).
     */
    public static CellValue fromObject(Object value) {
        if (value == null) {
            return EMPTY;
        }
        if (value instanceof CellValue) {
            return (CellValue) value;
        }
        if (value instanceof Boolean) {
            return of((boolean) (Boolean) value);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return of(((Number) value).longValue());
        }
        if (value instanceof BigInteger) {
            try {
                return of(((BigInteger) value).longValueExact());
            } catch (ArithmeticException e) {
                throw new InvalidTypeException("Integer out of range: " + value);
            }
        }
        if (value instanceof Number) {
            return of(((Number) value).doubleValue());
        }
        if (value instanceof String) {
            return of((String) value);
        }
        if (value instanceof Expression) {
            return of((Expression) value);
        }
        throw new InvalidTypeException("Unsupported cell value: " + value.getClass().getName());
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isEmpty() {
        return kind == Kind.EMPTY;
    }

    public boolean asBoolean() {
        return (Boolean) require(Kind.BOOLEAN);
    }

    public long asLong() {
        return (Long) require(Kind.INTEGER);
    }

    public double asDouble() {
        return (Double) require(Kind.FLOAT);
    }

    public String asString() {
        return (String) require(Kind.STRING);
    }

    public Expression asExpression() {
        return (Expression) require(Kind.EXPRESSION);
    }

    /**
     * The plain Java value: Boolean, Long, Double, String, the formula text for expressions, or null.
     */
    public Object getRawValue() {
        return kind == Kind.EXPRESSION ? ((Expression) value).getValue() : value;
    }

    /**
     * Text written into the cell for this value; null for empty.
     */
    public String toText() {
        switch (kind) {
            case BOOLEAN:
                return ((Boolean) value) ? "TRUE" : "FALSE";
            case EXPRESSION:
                return ((Expression) value).getValue();
            case EMPTY:
                return null;
            default:
                return value.toString();
        }
    }

    private Object require(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellValue)) {
            return false;
        }
        CellValue other = (CellValue) o;
        return kind == other.kind && Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value);
    }

    @Override
    public String toString() {
        return kind + "(" + value + ")";
    }
}
