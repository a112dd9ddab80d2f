package com.redcapxls.form.field;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class RequiredConverterTest {

    @Test
    public void testRequiredFlag() {
        assertEquals("yes", RequiredConverter.convert("y"));
        assertEquals("yes", RequiredConverter.convert(" Y "));
    }

    @Test
    public void testAnythingElseIsOptional() {
        assertEquals("no", RequiredConverter.convert(""));
        assertEquals("no", RequiredConverter.convert("n"));
        assertEquals("no", RequiredConverter.convert("yes"));
        assertEquals("no", RequiredConverter.convert(null));
    }
}
