package com.redcapxls.form;

/**
 * The rows of one output form together with the shared input headers.
 */
public class FormUnit {

    private final String name;
    private final RedcapTable table;

    public FormUnit(String name, RedcapTable table) {
        this.name = name;
        this.table = table;
    }

    public String getName() {
        return name;
    }

    public RedcapTable getTable() {
        return table;
    }
}
