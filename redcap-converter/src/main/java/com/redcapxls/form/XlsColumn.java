package com.redcapxls.form;

/**
 * Survey sheet columns produced by the converter. Pass-through columns
 * copied from the input are not listed here.
 */
public enum XlsColumn {
    NAME("name"),
    TYPE("type"),
    LABEL("label"),
    CONSTRAINT("constraint"),
    RELEVANT("relevant"),
    REQUIRED("required"),
    HINT("hint"),
    CALCULATION("calculation"),
    DEFAULT("default"),
    READ_ONLY("read_only");

    private final String header;

    XlsColumn(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
