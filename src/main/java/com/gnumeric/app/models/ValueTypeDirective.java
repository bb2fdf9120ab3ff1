package com.gnumeric.app.models;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * How {@link Cell#setValue(CellValue, ValueTypeDirective)} decides the stored type:
 * infer it from the value, keep the cell's current type, or use an explicit type.
 */
public final class ValueTypeDirective {

    public enum Mode {
        INFER,
        KEEP,
        EXPLICIT
    }

    public static final ValueTypeDirective INFER = new ValueTypeDirective(Mode.INFER, null);
    public static final ValueTypeDirective KEEP = new ValueTypeDirective(Mode.KEEP, null);

    private final Mode mode;
    private final ValueType valueType;

    private ValueTypeDirective(Mode mode, ValueType valueType) {
        this.mode = mode;
        this.valueType = valueType;
    }

    public static ValueTypeDirective explicit(ValueType valueType) {
        return new ValueTypeDirective(Mode.EXPLICIT, Objects.requireNonNull(valueType, "valueType"));
    }

    /**
     * Parses "infer", "keep" or a value type name; null or blank means infer.
     */
    public static ValueTypeDirective parse(String directive) {
        if (directive == null || directive.isBlank() || "infer".equalsIgnoreCase(directive.trim())) {
            return INFER;
        }
        if ("keep".equalsIgnoreCase(directive.trim())) {
            return KEEP;
        }
        return explicit(ValueType.fromValue(directive));
    }

    public Mode getMode() {
        return mode;
    }

    public ValueType getValueType() {
        return valueType;
    }

    /**
     * Resolves the type to store. The current type is only read when needed.
     */
    public ValueType resolve(CellValue value, Supplier<ValueType> currentType) {
        switch (mode) {
            case EXPLICIT:
                return valueType;
            case KEEP:
                return currentType.get();
            default:
                return ValueType.infer(value, currentType);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ValueTypeDirective)) {
            return false;
        }
        ValueTypeDirective other = (ValueTypeDirective) o;
        return mode == other.mode && valueType == other.valueType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, valueType);
    }

    @Override
    public String toString() {
        return mode == Mode.EXPLICIT ? valueType.name() : mode.name().toLowerCase();
    }
}
