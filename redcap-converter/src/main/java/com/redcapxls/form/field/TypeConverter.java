package com.redcapxls.form.field;

import java.util.Map;

/**
 * Maps a REDCap field type, and for text fields its validation type, onto an
 * XLSForm question type.
 */
public class TypeConverter {

    public static final String CALCULATE = "calculate";
    public static final String YES_NO_LIST = "yes_no";

    private static final String YES_NO = "yesno";
    private static final String FALLBACK = "text";

    private static final Map<String, String> TYPE_LOOKUP = Map.of(
            "descriptive", "note",
            "notes", "text",
            "calc", CALCULATE);

    private static final Map<String, String> CHOICE_TYPE_LOOKUP = Map.of(
            "radio", "select_one",
            "checkbox", "select_multiple",
            "dropdown", "select_one");

    private static final Map<String, String> VALIDATION_LOOKUP = Map.of(
            "date_dmy", "date",
            "time", "time",
            "number", "decimal",
            "integer", "integer");

    /**
     * True when the field needs a choice list of its own, i.e. its type will be
     * {@code select_one list_N} or {@code select_multiple list_N}.
     */
    public static boolean requiresChoiceList(String type) {
        return CHOICE_TYPE_LOOKUP.containsKey(type);
    }

    public static boolean isCalculation(String type) {
        return CALCULATE.equals(TYPE_LOOKUP.get(type));
    }

    /**
     * Convert a field type. {@code listName} is the list already assigned to
     * the field and is only read for choice-bearing types.
     */
    public static TypeResolution convert(String type, String validation, String listName) {
        if (YES_NO.equals(type)) {
            return new TypeResolution("select_one " + YES_NO_LIST, 0);
        }

        String direct = TYPE_LOOKUP.get(type);
        if (direct != null) {
            return new TypeResolution(direct, 0);
        }

        String choiceType = CHOICE_TYPE_LOOKUP.get(type);
        if (choiceType != null) {
            if (listName == null || listName.isEmpty()) {
                throw new IllegalArgumentException("Field type '" + type + "' needs a choice list name");
            }
            return new TypeResolution(choiceType + " " + listName, 1);
        }

        String validated = VALIDATION_LOOKUP.get(validation);
        if (validated != null) {
            return new TypeResolution(validated, 0);
        }

        return new TypeResolution(FALLBACK, 0);
    }
}
