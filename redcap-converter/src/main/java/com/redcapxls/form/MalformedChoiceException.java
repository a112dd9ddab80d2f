package com.redcapxls.form;

/**
 * A choice definition has neither a comma nor a colon separating code and label.
 */
public class MalformedChoiceException extends ConversionException {

    private final String choice;

    public MalformedChoiceException(String choice) {
        super("Cannot read choice in this format: " + choice);
        this.choice = choice;
    }

    public String getChoice() {
        return choice;
    }
}
