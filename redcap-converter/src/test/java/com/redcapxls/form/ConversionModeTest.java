package com.redcapxls.form;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionModeTest {

    @Test
    public void testFromNameAcceptsCommandLineAndEnumNames() {
        assertEquals(ConversionMode.ZIP_XLS, ConversionMode.fromName("zip_xls"));
        assertEquals(ConversionMode.SINGLE_XLS, ConversionMode.fromName("SINGLE_XLS"));
        assertEquals("single_xls", ConversionMode.SINGLE_XLS.toString());
    }

    @Test
    public void testUnknownNameIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ConversionMode.fromName("csv"));
    }
}
