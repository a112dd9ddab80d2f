package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds REDCap tables for tests with all thirteen standard columns.
 */
class DictionaryBuilder {

    static final List<String> HEADERS = List.of(
            RedcapColumn.FIELD_NAME.getHeader(),
            RedcapColumn.FORM_NAME.getHeader(),
            RedcapColumn.SECTION_HEADER.getHeader(),
            RedcapColumn.FIELD_TYPE.getHeader(),
            RedcapColumn.FIELD_LABEL.getHeader(),
            RedcapColumn.CHOICES.getHeader(),
            RedcapColumn.FIELD_NOTE.getHeader(),
            RedcapColumn.VALIDATION_TYPE.getHeader(),
            RedcapColumn.VALIDATION_MIN.getHeader(),
            RedcapColumn.VALIDATION_MAX.getHeader(),
            RedcapColumn.REQUIRED.getHeader(),
            RedcapColumn.BRANCHING_LOGIC.getHeader(),
            RedcapColumn.FIELD_ANNOTATION.getHeader());

    private final List<List<String>> rows = new ArrayList<>();

    /**
     * Add a row with name, form, section, type, label and choices; the other cells stay empty.
     */
    DictionaryBuilder field(String name, String form, String section, String type, String label, String choices) {
        return row(name, form, section, type, label, choices, "", "", "", "", "", "", "");
    }

    DictionaryBuilder row(String... cells) {
        rows.add(new ArrayList<>(Arrays.asList(cells)));
        return this;
    }

    /**
     * Set a cell of the last added row.
     */
    DictionaryBuilder with(RedcapColumn column, String value) {
        rows.get(rows.size() - 1).set(HEADERS.indexOf(column.getHeader()), value);
        return this;
    }

    RedcapTable build() {
        return new RedcapTable(HEADERS, rows);
    }
}
