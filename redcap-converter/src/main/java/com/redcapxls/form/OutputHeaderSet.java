package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered columns of a survey sheet.
 */
public class OutputHeaderSet {

    private final List<OutputColumn> columns;

    public OutputHeaderSet(List<OutputColumn> columns) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    }

    public List<OutputColumn> getColumns() {
        return columns;
    }

    public List<String> getNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (OutputColumn column : columns) {
            names.add(column.getName());
        }
        return names;
    }

    public int size() {
        return columns.size();
    }

    /**
     * Position of a converted column, or -1 when it was not requested.
     */
    public int indexOf(XlsColumn field) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).getField() == field) {
                return i;
            }
        }
        return -1;
    }

    public boolean contains(XlsColumn field) {
        return indexOf(field) >= 0;
    }
}
