package com.redcapxls.expr;

import java.util.regex.Pattern;

/**
 * Rewrites a REDCap calculated-field expression into an XLSForm calculation.
 * Operators are left alone, only field references change.
 */
public class CalculationTranslator {

    private static final Pattern SCALAR_REFERENCE = Pattern.compile("\\[(\\w+)\\]");
    private static final Pattern ARRAY_REFERENCE = Pattern.compile("\\[(\\w+)\\((\\w+)\\)\\]");

    public String translate(String expression) {
        if (expression == null || expression.isEmpty()) {
            return "";
        }

        String converted = SCALAR_REFERENCE.matcher(expression).replaceAll("\\${$1}");
        return ARRAY_REFERENCE.matcher(converted).replaceAll("selected(\\${$1},'$2')");
    }
}
