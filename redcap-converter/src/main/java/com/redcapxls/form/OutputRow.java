package com.redcapxls.form;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One survey sheet row, cells positioned by the OutputHeaderSet.
 */
public class OutputRow {

    private final List<String> cells;

    public OutputRow(String[] cells) {
        this.cells = Collections.unmodifiableList(Arrays.asList(cells.clone()));
    }

    public List<String> getCells() {
        return cells;
    }

    public String get(int index) {
        return cells.get(index);
    }

    public String get(OutputHeaderSet headers, XlsColumn field) {
        int index = headers.indexOf(field);
        return index >= 0 ? cells.get(index) : "";
    }

    public int size() {
        return cells.size();
    }

    @Override
    public String toString() {
        return cells.toString();
    }
}
