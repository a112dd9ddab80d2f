package com.redcapxls.expr;

/**
 * Defines how RelevantTranslator treats the boolean keywords
 * {@code or} and {@code and} in branching logic.
 */
public enum LogicKeywordMode {
    /**
     * Leave the keywords exactly as the form designer wrote them.
     */
    PRESERVE,

    /**
     * Lower-case standalone {@code OR}/{@code AND} keywords.
     */
    LOWER_CASE
}
