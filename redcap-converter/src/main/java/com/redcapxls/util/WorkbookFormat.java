package com.redcapxls.util;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Spreadsheet format of the generated workbooks.
 */
public enum WorkbookFormat {
    @JsonProperty("xls")
    XLS(".xls"),

    @JsonProperty("xlsx")
    XLSX(".xlsx");

    private final String extension;

    WorkbookFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }
}
