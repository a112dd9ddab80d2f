package com.redcapxls.form;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.redcapxls.expr.FieldReferenceExtractor;
import com.redcapxls.util.LoggingUtil;

/**
 * Splits a data dictionary into one unit per REDCap form.
 *
 * A form's branching logic and calculations may only refer to fields that
 * appear earlier in the same form, otherwise the forms could not work on
 * their own and the split is refused.
 */
public class FormSplitter {

    private static final String CALC_TYPE = "calc";

    public List<FormUnit> split(RedcapTable table) throws ConversionException {
        if (!table.hasColumn(RedcapColumn.FORM_NAME)) {
            throw new ConversionException("Column \"" + RedcapColumn.FORM_NAME.getHeader()
                    + "\" is required to separate forms");
        }

        List<FormUnit> forms = new ArrayList<>();
        Map<String, Integer> usedNames = new HashMap<>();
        String currentName = null;
        List<List<String>> currentRows = new ArrayList<>();
        Set<String> seenFields = new HashSet<>();

        List<List<String>> rows = table.getRows();
        for (int i = 0; i < rows.size(); i++) {
            List<String> row = rows.get(i);
            String fieldName = table.value(row, RedcapColumn.FIELD_NAME);
            if (fieldName.isEmpty()) {
                continue;
            }

            String formName = table.value(row, RedcapColumn.FORM_NAME);
            if (currentName == null) {
                currentName = formName;
            } else if (!formName.isEmpty() && !formName.equals(currentName)) {
                forms.add(createUnit(table, currentName, currentRows, usedNames, forms.size()));
                currentName = formName;
                currentRows = new ArrayList<>();
                seenFields.clear();
            }

            for (String reference : referencedFields(table, row)) {
                if (!seenFields.contains(reference)) {
                    throw new CrossFormReferenceException(i, reference, row);
                }
            }

            seenFields.add(fieldName);
            currentRows.add(row);
        }

        if (currentName != null) {
            forms.add(createUnit(table, currentName, currentRows, usedNames, forms.size()));
        }

        LoggingUtil.info("Detected " + forms.size() + " form(s)");
        return forms;
    }

    private List<String> referencedFields(RedcapTable table, List<String> row) {
        List<String> references = FieldReferenceExtractor.extract(table.value(row, RedcapColumn.BRANCHING_LOGIC));
        if (CALC_TYPE.equals(table.value(row, RedcapColumn.FIELD_TYPE))) {
            references.addAll(FieldReferenceExtractor.extract(table.value(row, RedcapColumn.CHOICES)));
        }
        return references;
    }

    private FormUnit createUnit(RedcapTable table, String formName, List<List<String>> rows,
                                Map<String, Integer> usedNames, int ordinal) {
        String name = formName;
        if (name.isBlank()) {
            name = "form_" + (ordinal + 1);
            LoggingUtil.warn("Form without a name, writing it as '" + name + "'");
        }

        // A form that reappears later in the file gets its own output name
        int occurrence = usedNames.merge(name, 1, Integer::sum);
        if (occurrence > 1) {
            name = name + "_" + occurrence;
        }

        LoggingUtil.debug("Form '" + name + "' has " + rows.size() + " field(s)");
        return new FormUnit(name, table.withRows(rows));
    }
}
