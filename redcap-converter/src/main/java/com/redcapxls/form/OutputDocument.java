package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A converted form, ready to be written as a survey sheet and a choices sheet.
 */
public class OutputDocument {

    private final String name;
    private final OutputHeaderSet headers;
    private final List<OutputRow> rows;
    private final List<ChoiceEntry> choices;

    public OutputDocument(String name, OutputHeaderSet headers, List<OutputRow> rows, List<ChoiceEntry> choices) {
        this.name = name;
        this.headers = headers;
        this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
        this.choices = Collections.unmodifiableList(new ArrayList<>(choices));
    }

    public String getName() {
        return name;
    }

    public OutputHeaderSet getHeaders() {
        return headers;
    }

    public List<OutputRow> getRows() {
        return rows;
    }

    public List<ChoiceEntry> getChoices() {
        return choices;
    }
}
