package com.redcapxls.form;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What converting one REDCap row produced: the survey row, the choice
 * entries it introduced and the number of choice lists it consumed.
 */
public class RowResult {

    private static final RowResult EMPTY = new RowResult(null, Collections.emptyList(), 0);

    private final OutputRow row;
    private final List<ChoiceEntry> introducedChoices;
    private final int listIncrement;

    public RowResult(OutputRow row, List<ChoiceEntry> introducedChoices, int listIncrement) {
        this.row = row;
        this.introducedChoices = Collections.unmodifiableList(new ArrayList<>(introducedChoices));
        this.listIncrement = listIncrement;
    }

    public static RowResult empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return row == null;
    }

    public OutputRow getRow() {
        return row;
    }

    public List<ChoiceEntry> getIntroducedChoices() {
        return introducedChoices;
    }

    public int getListIncrement() {
        return listIncrement;
    }
}
