package com.redcapxls.form.field;

/**
 * XLSForm type chosen for a field, and how many choice lists it consumed.
 */
public class TypeResolution {

    private final String xlsType;
    private final int listIncrement;

    public TypeResolution(String xlsType, int listIncrement) {
        this.xlsType = xlsType;
        this.listIncrement = listIncrement;
    }

    public String getXlsType() {
        return xlsType;
    }

    public int getListIncrement() {
        return listIncrement;
    }

    public boolean isCalculation() {
        return TypeConverter.CALCULATE.equals(xlsType);
    }
}
