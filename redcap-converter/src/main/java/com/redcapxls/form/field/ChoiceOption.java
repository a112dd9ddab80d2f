package com.redcapxls.form.field;

/**
 * One parsed choice definition: its code and its label.
 */
public class ChoiceOption {

    private final String name;
    private final String label;

    public ChoiceOption(String name, String label) {
        this.name = name;
        this.label = label;
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }
}
