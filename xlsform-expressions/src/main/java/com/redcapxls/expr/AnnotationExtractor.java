package com.redcapxls.expr;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads action tags out of a REDCap field annotation.
 */
public class AnnotationExtractor {

    private static final Pattern DEFAULT_TAG =
            Pattern.compile("(?i)@default\\s*=\\s*(?:'([^']*)'|\"([^\"]*)\"|([^\\s'\"]*))");

    private static final Pattern HIDDEN_TAG = Pattern.compile("(?i)@hidden");

    /**
     * Value of the {@code @DEFAULT} tag, or the empty string when there is none.
     * Quoted values lose their quotes, bare values end at the first whitespace.
     */
    public static String extractDefault(String annotation) {
        if (annotation == null) {
            return "";
        }

        Matcher matcher = DEFAULT_TAG.matcher(annotation);
        if (!matcher.find()) {
            return "";
        }
        for (int group = 1; group <= 3; group++) {
            if (matcher.group(group) != null) {
                return matcher.group(group);
            }
        }
        return "";
    }

    /**
     * {@code "yes"} when the annotation hides the field, otherwise the empty string.
     */
    public static String extractReadOnly(String annotation) {
        if (annotation != null && HIDDEN_TAG.matcher(annotation).find()) {
            return "yes";
        }
        return "";
    }
}
