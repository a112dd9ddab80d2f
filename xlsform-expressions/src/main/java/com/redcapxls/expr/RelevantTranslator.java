package com.redcapxls.expr;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites REDCap branching logic into an XLSForm relevant expression.
 *
 * Scalar references such as {@code [age] > '18'} become {@code ${age} > 18} and
 * checkbox membership tests such as {@code [race(3)] = '0'} become
 * {@code not(selected('race','3'))}.
 */
public class RelevantTranslator {

    // Quoted text, or a bare token such as 18.5 or -1
    private static final String LITERAL = "(?:'([^']*)'|\"([^\"]*)\"|([^\\s()\\[\\]'\"]+))";

    private static final Pattern SCALAR_REFERENCE =
            Pattern.compile("\\[(\\w+)\\](?:\\s*([!<>=]{1,2})\\s*" + LITERAL + "?)?");

    private static final Pattern ARRAY_REFERENCE =
            Pattern.compile("\\[(\\w+)\\((\\w+)\\)\\](?:\\s*(!=|<>|==|=)\\s*" + LITERAL + "?)?");

    private static final Pattern NOT_EQUAL = Pattern.compile("<>");

    // Quoted spans are matched first so that keywords inside them are left alone
    private static final Pattern LOGIC_KEYWORD = Pattern.compile("(?i)'[^']*'|\"[^\"]*\"|\\b(or|and)\\b");

    private static final Pattern NUMBER = Pattern.compile("-?(\\d+(\\.\\d*)?|\\.\\d+)");

    private final LogicKeywordMode keywordMode;

    public RelevantTranslator() {
        this(LogicKeywordMode.PRESERVE);
    }

    public RelevantTranslator(LogicKeywordMode keywordMode) {
        this.keywordMode = keywordMode;
    }

    /**
     * Translate a branching logic expression. A null or blank expression
     * translates to the empty string.
     */
    public String translate(String expression) {
        if (expression == null || expression.isBlank()) {
            return "";
        }

        String converted = rewriteScalarReferences(expression);
        converted = rewriteArrayReferences(converted);
        converted = NOT_EQUAL.matcher(converted).replaceAll("!=");
        return normalizeKeywords(converted);
    }

    private String rewriteScalarReferences(String expression) {
        Matcher matcher = SCALAR_REFERENCE.matcher(expression);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            StringBuilder rewritten = new StringBuilder("${").append(matcher.group(1)).append('}');
            String operator = matcher.group(2);
            if (operator != null) {
                rewritten.append(' ').append(operator);
                String literal = formatLiteral(matcher.group(3), matcher.group(4), matcher.group(5));
                if (!literal.isEmpty()) {
                    rewritten.append(' ').append(literal);
                }
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(rewritten.toString()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Numbers drop their quotes. Anything else keeps the quote it was written
     * with so that text and empty-string comparisons stay valid.
     */
    private static String formatLiteral(String singleQuoted, String doubleQuoted, String bare) {
        if (singleQuoted != null) {
            return NUMBER.matcher(singleQuoted).matches() ? singleQuoted : "'" + singleQuoted + "'";
        }
        if (doubleQuoted != null) {
            return NUMBER.matcher(doubleQuoted).matches() ? doubleQuoted : '"' + doubleQuoted + '"';
        }
        return bare == null ? "" : bare;
    }

    private String rewriteArrayReferences(String expression) {
        Matcher matcher = ARRAY_REFERENCE.matcher(expression);
        StringBuilder result = new StringBuilder();

        while (matcher.find()) {
            String selected = "selected('" + matcher.group(1) + "','" + matcher.group(2) + "')";
            if (isNotSelected(matcher.group(3), firstNonNull(matcher.group(4), matcher.group(5), matcher.group(6)))) {
                selected = "not(" + selected + ")";
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(selected));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    // Only the last character of the value decides the sense, e.g. '01' reads as 1
    static boolean isNotSelected(String operator, String value) {
        if (operator == null || value == null || value.isEmpty()) {
            return false;
        }

        char last = value.charAt(value.length() - 1);
        if (operator.equals("=") || operator.equals("==")) {
            return last == '0';
        }
        return last == '1';
    }

    private String normalizeKeywords(String expression) {
        if (keywordMode != LogicKeywordMode.LOWER_CASE) {
            return expression;
        }

        Matcher matcher = LOGIC_KEYWORD.matcher(expression);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            String keyword = matcher.group(1);
            String replacement = keyword == null ? matcher.group() : keyword.toLowerCase();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
