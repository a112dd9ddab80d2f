package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import com.redcapxls.expr.CalculationTranslator;
import com.redcapxls.expr.LogicKeywordMode;
import com.redcapxls.expr.RelevantTranslator;
import com.redcapxls.form.field.TypeConverter;
import com.redcapxls.util.LoggingUtil;

/**
 * Turns a REDCap data dictionary into XLSForm documents: one per form in
 * {@link ConversionMode#ZIP_XLS} mode, a single one otherwise.
 */
public class FormAssembler {

    private static final String GROUP_PREFIX = "group_";
    private static final String BEGIN_GROUP = "begin group";
    private static final String END_GROUP = "end group";

    private final ConversionMode mode;
    private final List<String> columnsToCopy;
    private final LogicKeywordMode keywordMode;

    public FormAssembler(ConversionMode mode, List<String> columnsToCopy) {
        this(mode, columnsToCopy, LogicKeywordMode.PRESERVE);
    }

    public FormAssembler(ConversionMode mode, List<String> columnsToCopy, LogicKeywordMode keywordMode) {
        this.mode = mode;
        this.columnsToCopy = new ArrayList<>(columnsToCopy);
        this.keywordMode = keywordMode;
    }

    /**
     * The yes/no list every document starts its choices with.
     */
    public static List<ChoiceEntry> builtInChoices() {
        List<ChoiceEntry> choices = new ArrayList<>();
        choices.add(new ChoiceEntry(TypeConverter.YES_NO_LIST, "yes", "Yes"));
        choices.add(new ChoiceEntry(TypeConverter.YES_NO_LIST, "no", "No"));
        return choices;
    }

    /**
     * Convert the whole table.
     *
     * @param table the REDCap data dictionary
     * @param documentName name of the document in single-workbook mode
     */
    public List<OutputDocument> assemble(RedcapTable table, String documentName) throws ConversionException {
        checkColumnsToCopyExist(table);
        if (!table.hasColumn(RedcapColumn.FIELD_NAME)) {
            throw new ConversionException("Column \"" + RedcapColumn.FIELD_NAME.getHeader()
                    + "\" is missing, is this a REDCap data dictionary?");
        }

        List<FormUnit> forms;
        if (mode == ConversionMode.ZIP_XLS) {
            forms = new FormSplitter().split(table);
        } else {
            forms = List.of(new FormUnit(documentName, table));
        }

        if (forms.isEmpty()) {
            throw new ConversionException("REDCap file contains no fields");
        }

        List<OutputDocument> documents = new ArrayList<>();
        for (FormUnit form : forms) {
            documents.add(convert(form));
        }
        return documents;
    }

    /**
     * Convert the rows of one form, sharing choice lists between its fields
     * and wrapping sections in groups.
     */
    public OutputDocument convert(FormUnit form) throws ConversionException {
        RedcapTable table = form.getTable();
        OutputHeaderSet headers = HeaderResolver.resolve(table.getHeaders(), columnsToCopy);
        RowConverter rowConverter = new RowConverter(table, headers,
                new RelevantTranslator(keywordMode), new CalculationTranslator());
        ChoiceListRegistry registry = new ChoiceListRegistry();

        List<OutputRow> rows = new ArrayList<>();
        List<ChoiceEntry> choices = builtInChoices();
        int groups = 0;
        int choiceFields = 0;

        for (List<String> row : table.getRows()) {
            if (rowConverter.isEmpty(row)) {
                continue;
            }

            String section = table.value(row, RedcapColumn.SECTION_HEADER);
            if (!section.isBlank()) {
                if (groups > 0) {
                    rows.add(endGroup(headers));
                }
                groups++;
                rows.add(beginGroup(headers, groups, section));
            }

            RowResult result = rowConverter.convert(row, registry);
            rows.add(result.getRow());
            choices.addAll(result.getIntroducedChoices());
            choiceFields += result.getListIncrement();
        }

        if (groups > 0) {
            rows.add(endGroup(headers));
        }

        LoggingUtil.info("Converted form '" + form.getName() + "': " + rows.size() + " row(s), "
                + choiceFields + " choice field(s) on " + registry.size() + " choice list(s)");
        return new OutputDocument(form.getName(), headers, rows, choices);
    }

    private void checkColumnsToCopyExist(RedcapTable table) throws ColumnToCopyMissingException {
        for (String column : columnsToCopy) {
            if (!table.hasColumn(column)) {
                throw new ColumnToCopyMissingException(column);
            }
        }
    }

    private OutputRow beginGroup(OutputHeaderSet headers, int ordinal, String label) {
        String[] cells = blankRow(headers);
        setIfPresent(cells, headers, XlsColumn.NAME, GROUP_PREFIX + ordinal);
        setIfPresent(cells, headers, XlsColumn.LABEL, label);
        setIfPresent(cells, headers, XlsColumn.TYPE, BEGIN_GROUP);
        return new OutputRow(cells);
    }

    private OutputRow endGroup(OutputHeaderSet headers) {
        String[] cells = blankRow(headers);
        setIfPresent(cells, headers, XlsColumn.TYPE, END_GROUP);
        return new OutputRow(cells);
    }

    private static String[] blankRow(OutputHeaderSet headers) {
        String[] cells = new String[headers.size()];
        Arrays.fill(cells, "");
        return cells;
    }

    private static void setIfPresent(String[] cells, OutputHeaderSet headers, XlsColumn field, String value) {
        int index = headers.indexOf(field);
        if (index >= 0) {
            cells[index] = value;
        }
    }
}
