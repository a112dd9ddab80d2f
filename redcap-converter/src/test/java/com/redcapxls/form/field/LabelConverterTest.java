package com.redcapxls.form.field;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LabelConverterTest {

    @Test
    public void testPlainLabelIsUnchanged() {
        assertEquals("Age in years", LabelConverter.convert("Age in years", "age"));
    }

    @Test
    public void testBlankLabelFallsBackToFieldName() {
        assertEquals("age", LabelConverter.convert("", "age"));
        assertEquals("age", LabelConverter.convert("   ", "age"));
        assertEquals("age", LabelConverter.convert(null, "age"));
        assertEquals("age", LabelConverter.convert("<br>", "age"));
    }

    @Test
    public void testEmphasis() {
        assertEquals("**Age** in years", LabelConverter.convert("<b>Age</b> in years", "age"));
        assertEquals("**Age**", LabelConverter.convert("<strong>Age</strong>", "age"));
        assertEquals("_optional_", LabelConverter.convert("<i>optional</i>", "x"));
    }

    @Test
    public void testLineAndParagraphBreaks() {
        assertEquals("Line one\nLine two", LabelConverter.convert("Line one<br>Line two", "x"));
        assertEquals("First\n\nSecond", LabelConverter.convert("<p>First</p><p>Second</p>", "x"));
    }

    @Test
    public void testLinks() {
        assertEquals("See [the site](https://redcap.org)",
                LabelConverter.convert("See <a href=\"https://redcap.org\">the site</a>", "x"));
    }

    @Test
    public void testListItems() {
        assertEquals("* One\n* Two", LabelConverter.convert("<ul><li>One</li><li>Two</li></ul>", "x"));
    }

    @Test
    public void testEntitiesAndUnknownTags() {
        assertEquals("Tom & Jerry", LabelConverter.convert("Tom &amp; Jerry", "x"));
        assertEquals("red text", LabelConverter.convert("<span style=\"color:red\">red</span> text", "x"));
        assertEquals("a b", LabelConverter.convert("a&nbsp;b", "x"));
    }

    @Test
    public void testSourceWhitespaceCollapses() {
        assertEquals("many spaces here", LabelConverter.toText("  many   spaces\n here "));
    }

    @Test
    public void testComparisonSignsInTextAreKept() {
        assertEquals("Score < 5 or > 10", LabelConverter.convert("Score < 5 or > 10", "x"));
        assertEquals("**Age** >= 18", LabelConverter.convert("<b>Age</b> >= 18", "x"));
    }

    @Test
    public void testAttributeValueContainingAngleBracket() {
        assertEquals("x", LabelConverter.convert("<span title=\"a>b\">x</span>", "f"));
    }

    @Test
    public void testLinkWithoutHrefKeepsText() {
        assertEquals("anchor text", LabelConverter.convert("<a name=\"top\">anchor</a> text", "x"));
    }
}
