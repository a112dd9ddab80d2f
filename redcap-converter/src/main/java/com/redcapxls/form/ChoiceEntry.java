package com.redcapxls.form;

import java.util.Objects;

/**
 * A row of the choices sheet.
 */
public class ChoiceEntry {

    private final String listName;
    private final String name;
    private final String label;

    public ChoiceEntry(String listName, String name, String label) {
        this.listName = listName;
        this.name = name;
        this.label = label;
    }

    public String getListName() {
        return listName;
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChoiceEntry)) return false;
        ChoiceEntry that = (ChoiceEntry) o;
        return Objects.equals(listName, that.listName)
                && Objects.equals(name, that.name)
                && Objects.equals(label, that.label);
    }

    @Override
    public int hashCode() {
        return Objects.hash(listName, name, label);
    }

    @Override
    public String toString() {
        return listName + "/" + name + "/" + label;
    }
}
