package com.gnumeric.app.models;

/**
 * Body of a sheet creation request: the sheet's 'title', its 'type'
 * (REGULAR or OBJECT, default REGULAR) and optional 'rows'/'columns' capacity.
 */
public class SheetRequest {
    private String title;
    private SheetType type = SheetType.REGULAR;
    private Integer rows;
    private Integer columns;

    // Default constructor needed for JSON (de)serialization
    public SheetRequest() {
    }

    public SheetRequest(String title, SheetType type) {
        this.title = title;
        this.type = type;
    }

    public String getTitle() {
        return title;
    }
    public SheetType getType() {
        return type;
    }
    public Integer getRows() {
        return rows;
    }
    public Integer getColumns() {
        return columns;
    }
    public void setTitle(String title) {
        this.title = title;
    }
    public void setType(SheetType type) {
        this.type = type;
    }
    public void setRows(Integer rows) {
        this.rows = rows;
    }
    public void setColumns(Integer columns) {
        this.columns = columns;
    }
}
