package org.calista.r3.axiom;

import java.util.List;
import java.util.Objects;

/**
 * Foundational statement with a base certainty and the transformations a proof step may apply to it.
 */
public final class Axiom {

    public final String id;
    public final String statement;
    public final double certainty;
    /** ontological | logical | physical | systemic */
    public final String category;
    public final String description;
    public final List<String> allowedTransformations;

    public Axiom(String id,
                 String statement,
                 double certainty,
                 String category,
                 String description,
                 List<String> allowedTransformations) {
        this.id = Objects.requireNonNull(id, "id");
        this.statement = Objects.requireNonNull(statement, "statement");
        if (!(certainty >= 0.0 && certainty <= 1.0)) {
            throw new IllegalArgumentException("Axiom certainty must be in [0,1]: " + id + "=" + certainty);
        }
        this.certainty = certainty;
        this.category = Objects.requireNonNull(category, "category");
        this.description = description == null ? "" : description;
        this.allowedTransformations = List.copyOf(Objects.requireNonNull(allowedTransformations, "allowedTransformations"));
    }

    public boolean allows(String transformation) {
        return transformation != null && allowedTransformations.contains(transformation);
    }

    @Override
    public String toString() {
        return id + "(" + statement + ", c=" + certainty + ")";
    }
}
