package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory REDCap data dictionary: the header row plus the data rows,
 * cells aligned to headers by position.
 */
public class RedcapTable {

    private final List<String> headers;
    private final List<List<String>> rows;
    private final Map<String, Integer> headerIndex = new HashMap<>();

    public RedcapTable(List<String> headers, List<List<String>> rows) {
        this.headers = Collections.unmodifiableList(new ArrayList<>(headers));

        List<List<String>> copied = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copied);

        for (int i = 0; i < headers.size(); i++) {
            headerIndex.putIfAbsent(headers.get(i), i);
        }
    }

    /**
     * A table with the same headers and a different set of rows.
     */
    public RedcapTable withRows(List<List<String>> subset) {
        return new RedcapTable(headers, subset);
    }

    public List<String> getHeaders() {
        return headers;
    }

    public List<List<String>> getRows() {
        return rows;
    }

    public boolean hasColumn(String header) {
        return headerIndex.containsKey(header);
    }

    public boolean hasColumn(RedcapColumn column) {
        return hasColumn(column.getHeader());
    }

    /**
     * Cell of the given row under the given header. Missing headers and
     * short rows read as the empty string.
     */
    public String value(List<String> row, String header) {
        Integer index = headerIndex.get(header);
        if (index == null || index >= row.size()) {
            return "";
        }
        String value = row.get(index);
        return value == null ? "" : value;
    }

    public String value(List<String> row, RedcapColumn column) {
        return value(row, column.getHeader());
    }
}
