package com.redcapxls.form.field;

/**
 * Builds an XLSForm constraint from REDCap's validation min and max.
 */
public class ConstraintConverter {

    private static final String LOWER_BOUND = "(. >= %s)";
    private static final String UPPER_BOUND = "(. <= %s)";

    public static String convert(String min, String max) {
        StringBuilder constraint = new StringBuilder();

        if (min != null && !min.isBlank()) {
            constraint.append(String.format(LOWER_BOUND, min.trim()));
        }
        if (max != null && !max.isBlank()) {
            if (constraint.length() > 0) {
                constraint.append(" and ");
            }
            constraint.append(String.format(UPPER_BOUND, max.trim()));
        }
        return constraint.toString();
    }
}
