package com.redcapxls.form.field;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TypeConverterTest {

    @Test
    public void testYesNoUsesBuiltInList() {
        TypeResolution resolution = TypeConverter.convert("yesno", "", null);

        assertEquals("select_one yes_no", resolution.getXlsType());
        assertEquals(0, resolution.getListIncrement());
        assertFalse(TypeConverter.requiresChoiceList("yesno"));
    }

    @Test
    public void testDirectTypes() {
        assertEquals("note", TypeConverter.convert("descriptive", "", null).getXlsType());
        assertEquals("text", TypeConverter.convert("notes", "", null).getXlsType());

        TypeResolution calc = TypeConverter.convert("calc", "", null);
        assertEquals("calculate", calc.getXlsType());
        assertTrue(calc.isCalculation());
        assertTrue(TypeConverter.isCalculation("calc"));
        assertFalse(TypeConverter.isCalculation("text"));
    }

    @Test
    public void testChoiceTypesTakeTheAssignedList() {
        TypeResolution radio = TypeConverter.convert("radio", "", "list_0");
        assertEquals("select_one list_0", radio.getXlsType());
        assertEquals(1, radio.getListIncrement());

        assertEquals("select_multiple list_3", TypeConverter.convert("checkbox", "", "list_3").getXlsType());
        assertEquals("select_one list_1", TypeConverter.convert("dropdown", "", "list_1").getXlsType());

        assertTrue(TypeConverter.requiresChoiceList("radio"));
        assertTrue(TypeConverter.requiresChoiceList("checkbox"));
        assertTrue(TypeConverter.requiresChoiceList("dropdown"));
        assertFalse(TypeConverter.requiresChoiceList("text"));
    }

    @Test
    public void testChoiceTypeWithoutListIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TypeConverter.convert("radio", "", null));
    }

    @Test
    public void testValidationTypes() {
        assertEquals("date", TypeConverter.convert("text", "date_dmy", null).getXlsType());
        assertEquals("time", TypeConverter.convert("text", "time", null).getXlsType());
        assertEquals("decimal", TypeConverter.convert("text", "number", null).getXlsType());
        assertEquals("integer", TypeConverter.convert("text", "integer", null).getXlsType());
    }

    @Test
    public void testUnknownTypeFallsBackToText() {
        assertEquals("text", TypeConverter.convert("text", "", null).getXlsType());
        assertEquals("text", TypeConverter.convert("slider", "email", null).getXlsType());
        assertEquals("text", TypeConverter.convert("", "", null).getXlsType());
    }

    @Test
    public void testPredicatesAgreeWithConversion() {
        for (String type : new String[] {"yesno", "calc", "descriptive", "notes", "radio", "checkbox", "dropdown", "text", "slider"}) {
            TypeResolution resolution = TypeConverter.convert(type, "", "list_0");

            assertEquals(resolution.getListIncrement() == 1, TypeConverter.requiresChoiceList(type), type);
            assertEquals(resolution.isCalculation(), TypeConverter.isCalculation(type), type);
        }
    }

    @Test
    public void testTypeWinsOverValidation() {
        assertEquals("calculate", TypeConverter.convert("calc", "integer", null).getXlsType());
    }
}
