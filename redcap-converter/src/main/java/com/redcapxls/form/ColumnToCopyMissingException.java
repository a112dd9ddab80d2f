package com.redcapxls.form;

/**
 * A column requested for verbatim copy is not in the REDCap file.
 */
public class ColumnToCopyMissingException extends ConversionException {

    private final String column;

    public ColumnToCopyMissingException(String column) {
        super("Column to copy \"" + column + "\" does not exist in REDCap file!");
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
