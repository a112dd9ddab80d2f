package com.redcapxls.form.field;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.redcapxls.form.ChoiceEntry;
import com.redcapxls.form.MalformedChoiceException;

import static org.junit.jupiter.api.Assertions.*;

public class ChoicesConverterTest {

    @Test
    public void testCommaSeparatedChoices() throws Exception {
        List<ChoiceOption> options = ChoicesConverter.parse("1, Male | 2, Female");

        assertEquals(2, options.size());
        assertEquals("1", options.get(0).getName());
        assertEquals("Male", options.get(0).getLabel());
        assertEquals("2", options.get(1).getName());
        assertEquals("Female", options.get(1).getLabel());
    }

    @Test
    public void testColonIsUsedWhenThereIsNoComma() throws Exception {
        List<ChoiceOption> options = ChoicesConverter.parse("1: Yes | 0, No");

        assertEquals("1", options.get(0).getName());
        assertEquals("Yes", options.get(0).getLabel());
        assertEquals("0", options.get(1).getName());
        assertEquals("No", options.get(1).getLabel());
    }

    @Test
    public void testOnlyFirstCommaSplits() throws Exception {
        List<ChoiceOption> options = ChoicesConverter.parse("3, Other, please specify");

        assertEquals("3", options.get(0).getName());
        assertEquals("Other, please specify", options.get(0).getLabel());
    }

    @Test
    public void testBlankCellHasNoChoices() throws Exception {
        assertTrue(ChoicesConverter.parse("").isEmpty());
        assertTrue(ChoicesConverter.parse("  ").isEmpty());
        assertTrue(ChoicesConverter.parse(null).isEmpty());
    }

    @Test
    public void testDefinitionWithoutDelimiterIsMalformed() {
        MalformedChoiceException e = assertThrows(MalformedChoiceException.class,
                () -> ChoicesConverter.parse("1, Yes | maybe"));

        assertEquals(" maybe", e.getChoice());
        assertTrue(e.getMessage().startsWith("Cannot read choice in this format: "));
    }

    @Test
    public void testTrailingSeparatorIsMalformed() {
        assertThrows(MalformedChoiceException.class, () -> ChoicesConverter.parse("1, Yes |"));
    }

    @Test
    public void testEntriesCarryTheListName() throws Exception {
        List<ChoiceOption> options = ChoicesConverter.parse("1, Male | 2, Female");

        assertEquals(List.of("1", "2"), ChoicesConverter.names(options));
        assertEquals(List.of(new ChoiceEntry("list_4", "1", "Male"), new ChoiceEntry("list_4", "2", "Female")),
                ChoicesConverter.toEntries("list_4", options));
    }
}
