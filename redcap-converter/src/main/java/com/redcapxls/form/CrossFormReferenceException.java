package com.redcapxls.form;

import java.util.ArrayList;
import java.util.List;

/**
 * Branching logic or a calculation refers to a field outside its own form,
 * so the input cannot be split into independent forms.
 */
public class CrossFormReferenceException extends ConversionException {

    private final int line;
    private final String reference;
    private final List<String> row;

    public CrossFormReferenceException(int line, String reference, List<String> row) {
        super("Cannot divide into multiple forms, condition/calculation refers to other forms in line "
                + line + " (field '" + reference + "'):\n'" + String.join(", ", row) + "'");
        this.line = line;
        this.reference = reference;
        this.row = new ArrayList<>(row);
    }

    public int getLine() {
        return line;
    }

    public String getReference() {
        return reference;
    }

    public List<String> getRow() {
        return row;
    }
}
