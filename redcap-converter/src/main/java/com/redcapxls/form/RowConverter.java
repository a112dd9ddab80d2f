package com.redcapxls.form;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

import com.redcapxls.expr.AnnotationExtractor;
import com.redcapxls.expr.CalculationTranslator;
import com.redcapxls.expr.RelevantTranslator;
import com.redcapxls.form.field.ChoiceOption;
import com.redcapxls.form.field.ChoicesConverter;
import com.redcapxls.form.field.ConstraintConverter;
import com.redcapxls.form.field.LabelConverter;
import com.redcapxls.form.field.RequiredConverter;
import com.redcapxls.form.field.TypeConverter;
import com.redcapxls.form.field.TypeResolution;
import com.redcapxls.util.LoggingUtil;

/**
 * Converts a single REDCap row into a survey row.
 *
 * The choice list of a select field is resolved through the form's
 * ChoiceListRegistry before the type is written, so every row is converted
 * exactly once with its final list name.
 */
public class RowConverter {

    private final RedcapTable table;
    private final OutputHeaderSet headers;
    private final RelevantTranslator relevantTranslator;
    private final CalculationTranslator calculationTranslator;

    public RowConverter(RedcapTable table, OutputHeaderSet headers,
                        RelevantTranslator relevantTranslator, CalculationTranslator calculationTranslator) {
        this.table = table;
        this.headers = headers;
        this.relevantTranslator = relevantTranslator;
        this.calculationTranslator = calculationTranslator;
    }

    /**
     * Rows without a field name are spacers and produce nothing.
     */
    public boolean isEmpty(List<String> row) {
        return table.value(row, RedcapColumn.FIELD_NAME).isEmpty();
    }

    public RowResult convert(List<String> row, ChoiceListRegistry registry) throws MalformedChoiceException {
        if (isEmpty(row)) {
            return RowResult.empty();
        }

        String name = table.value(row, RedcapColumn.FIELD_NAME);
        String type = table.value(row, RedcapColumn.FIELD_TYPE);
        String validation = table.value(row, RedcapColumn.VALIDATION_TYPE);
        String choicesOrCalculation = table.value(row, RedcapColumn.CHOICES);

        List<ChoiceOption> options = TypeConverter.isCalculation(type)
                ? Collections.emptyList()
                : ChoicesConverter.parse(choicesOrCalculation);

        String listName = null;
        boolean newList = false;
        if (TypeConverter.requiresChoiceList(type)) {
            ChoiceListRegistry.Assignment assignment = registry.assign(ChoicesConverter.names(options));
            listName = assignment.getListName();
            newList = assignment.isNew();
        }

        TypeResolution resolution = TypeConverter.convert(type, validation, listName);
        LoggingUtil.debug("Field '" + name + "' (" + type + ") -> " + resolution.getXlsType());

        String[] cells = new String[headers.size()];
        Arrays.fill(cells, "");

        set(cells, XlsColumn.NAME, () -> name);
        set(cells, XlsColumn.TYPE, resolution::getXlsType);
        set(cells, XlsColumn.LABEL, () -> LabelConverter.convert(table.value(row, RedcapColumn.FIELD_LABEL), name));
        set(cells, XlsColumn.CONSTRAINT, () -> ConstraintConverter.convert(
                table.value(row, RedcapColumn.VALIDATION_MIN),
                table.value(row, RedcapColumn.VALIDATION_MAX)));
        set(cells, XlsColumn.RELEVANT, () -> relevantTranslator.translate(table.value(row, RedcapColumn.BRANCHING_LOGIC)));
        set(cells, XlsColumn.REQUIRED, () -> RequiredConverter.convert(table.value(row, RedcapColumn.REQUIRED)));
        set(cells, XlsColumn.HINT, () -> table.value(row, RedcapColumn.FIELD_NOTE));
        set(cells, XlsColumn.CALCULATION, () -> resolution.isCalculation()
                ? calculationTranslator.translate(choicesOrCalculation)
                : "");
        set(cells, XlsColumn.DEFAULT, () -> AnnotationExtractor.extractDefault(table.value(row, RedcapColumn.FIELD_ANNOTATION)));
        set(cells, XlsColumn.READ_ONLY, () -> AnnotationExtractor.extractReadOnly(table.value(row, RedcapColumn.FIELD_ANNOTATION)));

        List<OutputColumn> columns = headers.getColumns();
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).isPassThrough()) {
                cells[i] = table.value(row, columns.get(i).getSourceHeader());
            }
        }

        List<ChoiceEntry> introduced = newList
                ? ChoicesConverter.toEntries(listName, options)
                : Collections.emptyList();
        return new RowResult(new OutputRow(cells), introduced, resolution.getListIncrement());
    }

    // Converters only run for columns present in the header set
    private void set(String[] cells, XlsColumn field, Supplier<String> converter) {
        int index = headers.indexOf(field);
        if (index >= 0) {
            cells[index] = converter.get();
        }
    }
}
