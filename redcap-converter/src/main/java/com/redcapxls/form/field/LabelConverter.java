package com.redcapxls.form.field;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import org.owasp.html.HtmlSanitizer;

/**
 * Turns a REDCap field label, which may carry HTML, into plain readable text.
 * Links and emphasis survive as markdown-style punctuation.
 *
 * The label is tokenized by the OWASP sanitizer, so a stray {@code <} or
 * {@code >} in the text is kept as text and entities arrive decoded.
 */
public class LabelConverter {

    private static final Set<String> BOLD = Set.of("b", "strong");
    private static final Set<String> ITALIC = Set.of("i", "em");
    private static final Set<String> BLOCK = Set.of(
            "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "ul", "ol", "table", "tr", "blockquote", "center");

    private static final Pattern SOURCE_WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LINE_PADDING = Pattern.compile("[ \\t]*\\n[ \\t]*");
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern REPEATED_SPACES = Pattern.compile(" {2,}");

    /**
     * Rendered label, or the field name when there is no label.
     */
    public static String convert(String label, String fieldName) {
        if (label == null || label.isBlank()) {
            return fieldName;
        }

        String text = toText(label);
        return text.isEmpty() ? fieldName : text;
    }

    static String toText(String html) {
        TextRenderer renderer = new TextRenderer();
        HtmlSanitizer.sanitize(html, renderer);

        String text = renderer.getText().replace('\u00A0', ' ');
        text = REPEATED_SPACES.matcher(text).replaceAll(" ");
        text = LINE_PADDING.matcher(text).replaceAll("\n");
        text = EXTRA_BLANK_LINES.matcher(text).replaceAll("\n\n");
        return text.strip();
    }

    /**
     * Receives the tag and text events of a label and writes the text form.
     */
    private static class TextRenderer implements HtmlSanitizer.Policy {

        private final StringBuilder out = new StringBuilder();
        private final Deque<Link> openLinks = new ArrayDeque<>();

        String getText() {
            return out.toString();
        }

        @Override
        public void openDocument() {
        }

        @Override
        public void closeDocument() {
        }

        @Override
        public void openTag(String elementName, List<String> attrs) {
            if (BOLD.contains(elementName)) {
                out.append("**");
            } else if (ITALIC.contains(elementName)) {
                out.append('_');
            } else if ("br".equals(elementName)) {
                out.append('\n');
            } else if ("li".equals(elementName)) {
                out.append("\n* ");
            } else if (BLOCK.contains(elementName)) {
                out.append("\n\n");
            } else if ("a".equals(elementName)) {
                openLinks.push(new Link(out.length(), attribute(attrs, "href")));
            }
        }

        @Override
        public void closeTag(String elementName) {
            if (BOLD.contains(elementName)) {
                out.append("**");
            } else if (ITALIC.contains(elementName)) {
                out.append('_');
            } else if (BLOCK.contains(elementName)) {
                out.append("\n\n");
            } else if ("a".equals(elementName) && !openLinks.isEmpty()) {
                Link link = openLinks.pop();
                if (link.href != null) {
                    String linkText = out.substring(link.start).trim();
                    out.setLength(link.start);
                    out.append('[').append(linkText).append("](").append(link.href).append(')');
                }
            }
        }

        @Override
        public void text(String text) {
            out.append(SOURCE_WHITESPACE.matcher(text).replaceAll(" "));
        }

        // Attributes come as alternating name, value pairs
        private static String attribute(List<String> attrs, String name) {
            for (int i = 0; i + 1 < attrs.size(); i += 2) {
                if (name.equalsIgnoreCase(attrs.get(i))) {
                    return attrs.get(i + 1);
                }
            }
            return null;
        }
    }

    private static class Link {
        private final int start;
        private final String href;

        Link(int start, String href) {
            this.start = start;
            this.href = href;
        }
    }
}
