package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Works out the survey sheet columns from the REDCap header row.
 */
public class HeaderResolver {

    private static final Map<String, XlsColumn> HEADER_LOOKUP;

    static {
        Map<String, XlsColumn> lookup = new LinkedHashMap<>();
        lookup.put(RedcapColumn.FIELD_NAME.getHeader(), XlsColumn.NAME);
        lookup.put(RedcapColumn.FIELD_TYPE.getHeader(), XlsColumn.TYPE);
        lookup.put(RedcapColumn.FIELD_LABEL.getHeader(), XlsColumn.LABEL);
        lookup.put(RedcapColumn.VALIDATION_MIN.getHeader(), XlsColumn.CONSTRAINT);
        lookup.put(RedcapColumn.BRANCHING_LOGIC.getHeader(), XlsColumn.RELEVANT);
        lookup.put(RedcapColumn.REQUIRED.getHeader(), XlsColumn.REQUIRED);
        lookup.put(RedcapColumn.FIELD_NOTE.getHeader(), XlsColumn.HINT);
        HEADER_LOOKUP = Collections.unmodifiableMap(lookup);
    }

    private static final List<XlsColumn> COMPUTED_COLUMNS =
            List.of(XlsColumn.CALCULATION, XlsColumn.DEFAULT, XlsColumn.READ_ONLY);

    /**
     * The converted column for a REDCap header, or null when the header is not carried over.
     */
    public static XlsColumn convert(String header) {
        return HEADER_LOOKUP.get(header);
    }

    /**
     * Recognized headers in input order, then calculation, default and
     * read_only, then the pass-through columns in the order requested.
     */
    public static OutputHeaderSet resolve(List<String> redcapHeaders, List<String> columnsToCopy) {
        List<OutputColumn> columns = new ArrayList<>();

        for (String header : redcapHeaders) {
            XlsColumn field = convert(header);
            if (field != null) {
                columns.add(OutputColumn.converted(field));
            }
        }
        for (XlsColumn field : COMPUTED_COLUMNS) {
            columns.add(OutputColumn.converted(field));
        }
        for (String column : columnsToCopy) {
            columns.add(OutputColumn.passThrough(column));
        }
        return new OutputHeaderSet(columns);
    }
}
