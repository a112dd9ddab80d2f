package com.redcapxls.form;

/**
 * How the input is packaged into output files.
 */
public enum ConversionMode {
    /**
     * One workbook per REDCap form, bundled into a zip archive.
     */
    ZIP_XLS("zip_xls"),

    /**
     * A single workbook holding every field.
     */
    SINGLE_XLS("single_xls");

    private final String cliName;

    ConversionMode(String cliName) {
        this.cliName = cliName;
    }

    public static ConversionMode fromName(String name) {
        for (ConversionMode mode : values()) {
            if (mode.cliName.equalsIgnoreCase(name) || mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown conversion mode: " + name
                + " (expected zip_xls or single_xls)");
    }

    @Override
    public String toString() {
        return cliName;
    }
}
