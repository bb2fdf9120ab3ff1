package com.gnumeric.app.models;

/**
 * Body of a cell update:
 * - value: a JSON boolean, number, string or null
 * - valueType: "infer" (default), "keep", or a value type name such as "STRING"
 */
public class CellValueRequest {
    private Object value;
    private String valueType;

    public CellValueRequest() {
    }

    public CellValueRequest(Object value, String valueType) {
        this.value = value;
        this.valueType = valueType;
    }

    public Object getValue() {
        return value;
    }
    public String getValueType() {
        return valueType;
    }
    public void setValue(Object value) {
        this.value = value;
    }
    public void setValueType(String valueType) {
        this.valueType = valueType;
    }
}
