package com.redcapxls.form.field;

/**
 * REDCap marks required fields with {@code y}.
 */
public class RequiredConverter {

    public static String convert(String required) {
        if (required != null && required.trim().equalsIgnoreCase("y")) {
            return "yes";
        }
        return "no";
    }
}
