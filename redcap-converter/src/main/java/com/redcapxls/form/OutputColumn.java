package com.redcapxls.form;

/**
 * One survey sheet column: either a converted column or an input column
 * copied verbatim.
 */
public class OutputColumn {

    private final XlsColumn field;
    private final String sourceHeader;

    private OutputColumn(XlsColumn field, String sourceHeader) {
        this.field = field;
        this.sourceHeader = sourceHeader;
    }

    public static OutputColumn converted(XlsColumn field) {
        return new OutputColumn(field, null);
    }

    public static OutputColumn passThrough(String sourceHeader) {
        return new OutputColumn(null, sourceHeader);
    }

    public boolean isPassThrough() {
        return field == null;
    }

    public XlsColumn getField() {
        return field;
    }

    public String getSourceHeader() {
        return sourceHeader;
    }

    public String getName() {
        return field != null ? field.getHeader() : sourceHeader;
    }

    @Override
    public String toString() {
        return getName();
    }
}
