package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hands out choice list names for one form. Fields offering the same option
 * names, in any order, share a single {@code list_<N>}.
 */
public class ChoiceListRegistry {

    private static final String LIST_PREFIX = "list_";

    private final Map<List<String>, Integer> assigned = new HashMap<>();
    private int nextIndex = 0;

    /**
     * Look up the list for a set of option names, assigning the next free
     * index when the set has not been seen before.
     */
    public Assignment assign(List<String> optionNames) {
        List<String> key = new ArrayList<>(optionNames);
        Collections.sort(key);

        Integer existing = assigned.get(key);
        if (existing != null) {
            return new Assignment(existing, false);
        }

        int index = nextIndex++;
        assigned.put(Collections.unmodifiableList(key), index);
        return new Assignment(index, true);
    }

    public int size() {
        return assigned.size();
    }

    public static String listName(int index) {
        return LIST_PREFIX + index;
    }

    /**
     * Result of a lookup: the list index and whether this lookup created it.
     */
    public static class Assignment {
        private final int index;
        private final boolean created;

        Assignment(int index, boolean created) {
            this.index = index;
            this.created = created;
        }

        public int getIndex() {
            return index;
        }

        public boolean isNew() {
            return created;
        }

        public String getListName() {
            return listName(index);
        }
    }
}
