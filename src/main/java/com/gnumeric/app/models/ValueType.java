package com.gnumeric.app.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.gnumeric.app.exceptions.InvalidTypeException;

import java.util.EnumSet;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Storage kinds a cell can hold, with the integer tag Gnumeric writes
 * into the ValueType attribute. Tags must not change.
 */
public enum ValueType {
    EXPR(-10),
    EMPTY(10),
    BOOLEAN(20),
    INTEGER(30),
    FLOAT(40),
    ERROR(50),
    STRING(60),
    CELLRANGE(70),
    ARRAY(80);

    // Prior types that a plain string overwrites with STRING
    private static final Set<ValueType> SCALARS = EnumSet.of(EMPTY, BOOLEAN, INTEGER, FLOAT, ERROR);

    private final int tag;

    ValueType(int tag) {
        this.tag = tag;
    }

    public int getTag() {
        return tag;
    }

    /**
     * Looks up the type for a persisted tag; null if the tag is unknown.
     */
    public static ValueType fromTag(int tag) {
        for (ValueType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return null;
    }

    /**
     * Allows case-insensitive input, e.g. "integer" -> INTEGER.
     */
    @JsonCreator
    public static ValueType fromValue(String value) {
        try {
            return ValueType.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidTypeException("Unknown value type: " + value);
        }
    }

    /**
     * Picks the type to store a value as when no type was requested.
     * The prior type is only consulted for plain strings.
     */
    public static ValueType infer(CellValue value, Supplier<ValueType> priorType) {
        switch (value.getKind()) {
            case BOOLEAN:
                return BOOLEAN;
            case INTEGER:
                return INTEGER;
            case FLOAT:
                return FLOAT;
            case EMPTY:
                return EMPTY;
            case EXPRESSION:
                return EXPR;
            default:
                String text = value.asString();
                if (text.isEmpty()) {
                    return EMPTY;
                }
                if (text.startsWith("=")) {
                    return EXPR;
                }
                ValueType prior = priorType.get();
                return SCALARS.contains(prior) ? STRING : prior;
        }
    }
}
