package org.calista.r3.reason;

import java.util.Objects;

/**
 * A structural pattern recognised in a query, with its fixed weight.
 */
public final class PatternMatch {

    public static final String IMPLICATION = "implication";
    public static final String QUANTIFIED = "quantified";
    public static final String ACTION = "action";

    public static final double IMPLICATION_WEIGHT = 0.8;
    public static final double QUANTIFIED_WEIGHT = 0.7;
    public static final double ACTION_WEIGHT = 0.6;

    public final String type;
    public final double certainty;
    public final String description;

    public PatternMatch(String type, double certainty, String description) {
        this.type = Objects.requireNonNull(type, "type");
        this.certainty = certainty;
        this.description = description == null ? "" : description;
    }

    @Override
    public String toString() {
        return type + "(" + certainty + ")";
    }
}
