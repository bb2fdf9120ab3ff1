package com.gnumeric.app.models;

/**
 * Read-only snapshot of a cell, as returned by the REST endpoints.
 * 'value' is the converted value (Boolean, Long, Double, String or null);
 * for expressions it is the formula text.
 */
public class CellView {
    private final int row;
    private final int column;
    private final ValueType valueType;
    private final String text;
    private final Object value;
    private final String expressionId;

    public CellView(int row, int column, ValueType valueType, String text, Object value, String expressionId) {
        this.row = row;
        this.column = column;
        this.valueType = valueType;
        this.text = text;
        this.value = value;
        this.expressionId = expressionId;
    }

    public static CellView of(Cell cell) {
        CellValue value = cell.getValue();
        return new CellView(cell.getRow(), cell.getColumn(), cell.getValueType(), cell.getText(),
                value.getRawValue(), cell.getExpressionId() == null ? null : cell.getExpressionId().toString());
    }

    public int getRow() {
        return row;
    }
    public int getColumn() {
        return column;
    }
    public ValueType getValueType() {
        return valueType;
    }
    public String getText() {
        return text;
    }
    public Object getValue() {
        return value;
    }
    public String getExpressionId() {
        return expressionId;
    }
}
