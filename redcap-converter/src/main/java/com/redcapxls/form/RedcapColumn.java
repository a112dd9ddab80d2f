package com.redcapxls.form;

/**
 * Columns of a REDCap data dictionary export the converter understands.
 */
public enum RedcapColumn {
    FIELD_NAME("Variable / Field Name"),
    FORM_NAME("Form Name"),
    SECTION_HEADER("Section Header"),
    FIELD_TYPE("Field Type"),
    FIELD_LABEL("Field Label"),
    CHOICES("Choices, Calculations, OR Slider Labels"),
    FIELD_NOTE("Field Note"),
    VALIDATION_TYPE("Text Validation Type OR Show Slider Number"),
    VALIDATION_MIN("Text Validation Min"),
    VALIDATION_MAX("Text Validation Max"),
    REQUIRED("Required Field?"),
    BRANCHING_LOGIC("Branching Logic (Show field only if...)"),
    FIELD_ANNOTATION("Field Annotation");

    private final String header;

    RedcapColumn(String header) {
        this.header = header;
    }

    public String getHeader() {
        return header;
    }
}
