package com.redcapxls.form.field;

import java.util.ArrayList;
import java.util.List;

import com.redcapxls.form.ChoiceEntry;
import com.redcapxls.form.MalformedChoiceException;

/**
 * Parses REDCap's {@code code, label | code, label} choice definitions.
 */
public class ChoicesConverter {

    /**
     * Split a choices cell into options. Each definition is split on its first
     * comma, or on its first colon when it has no comma.
     *
     * @throws MalformedChoiceException if a definition has neither delimiter
     */
    public static List<ChoiceOption> parse(String choices) throws MalformedChoiceException {
        List<ChoiceOption> options = new ArrayList<>();
        if (choices == null || choices.isBlank()) {
            return options;
        }

        for (String definition : choices.split("\\|", -1)) {
            options.add(parseDefinition(definition));
        }
        return options;
    }

    private static ChoiceOption parseDefinition(String definition) throws MalformedChoiceException {
        int split = definition.indexOf(',');
        if (split < 0) {
            split = definition.indexOf(':');
        }
        if (split < 0) {
            throw new MalformedChoiceException(definition);
        }

        String name = definition.substring(0, split).trim();
        String label = definition.substring(split + 1).trim();
        return new ChoiceOption(name, label);
    }

    public static List<String> names(List<ChoiceOption> options) {
        List<String> names = new ArrayList<>(options.size());
        for (ChoiceOption option : options) {
            names.add(option.getName());
        }
        return names;
    }

    public static List<ChoiceEntry> toEntries(String listName, List<ChoiceOption> options) {
        List<ChoiceEntry> entries = new ArrayList<>(options.size());
        for (ChoiceOption option : options) {
            entries.add(new ChoiceEntry(listName, option.getName(), option.getLabel()));
        }
        return entries;
    }
}
