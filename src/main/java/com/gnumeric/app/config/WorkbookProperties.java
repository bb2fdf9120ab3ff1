package com.gnumeric.app.config;

import com.gnumeric.app.models.Workbook;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from "gnumeric.*" in application.properties.
 */
@ConfigurationProperties(prefix = "gnumeric")
public class WorkbookProperties {

    // Size given to sheets created without an explicit size
    private int defaultRows = Workbook.DEFAULT_ROWS;
    private int defaultColumns = Workbook.DEFAULT_COLUMNS;

    // Whether downloaded workbooks are gzip-compressed, as Gnumeric writes them
    private boolean compressOnSave = true;

    public int getDefaultRows() {
        return defaultRows;
    }

    public void setDefaultRows(int defaultRows) {
        this.defaultRows = defaultRows;
    }

    public int getDefaultColumns() {
        return defaultColumns;
    }

    public void setDefaultColumns(int defaultColumns) {
        this.defaultColumns = defaultColumns;
    }

    public boolean isCompressOnSave() {
        return compressOnSave;
    }

    public void setCompressOnSave(boolean compressOnSave) {
        this.compressOnSave = compressOnSave;
    }
}
