package com.redcapxls.expr;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lists the field names an expression refers to, both plain {@code [field]}
 * references and checkbox {@code [field(option)]} references.
 */
public class FieldReferenceExtractor {

    private static final Pattern SCALAR_REFERENCE = Pattern.compile("\\[(\\w+)\\]");
    private static final Pattern ARRAY_REFERENCE = Pattern.compile("\\[(\\w+)\\(\\w+\\)\\]");

    /**
     * Scalar references come first, then checkbox references, each in order of appearance.
     * Duplicates are kept.
     */
    public static List<String> extract(String expression) {
        List<String> references = new ArrayList<>();
        if (expression == null || expression.isEmpty()) {
            return references;
        }

        collect(SCALAR_REFERENCE.matcher(expression), references);
        collect(ARRAY_REFERENCE.matcher(expression), references);
        return references;
    }

    private static void collect(Matcher matcher, List<String> references) {
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
    }
}
