package org.calista.r3.reason;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Structural components extracted from a query. Immutable.
 */
public final class Components {

    public final List<String> entities;
    public final List<Relation> relations;
    public final List<String> quantifiers;
    public final List<String> modalities;
    public final List<String> actions;
    /** Connective words in query order (if, then, and, not, ...). */
    public final List<String> connectives;

    public Components(List<String> entities,
                      List<Relation> relations,
                      List<String> quantifiers,
                      List<String> modalities,
                      List<String> actions,
                      List<String> connectives) {
        this.entities = entities == null ? List.of() : List.copyOf(entities);
        this.relations = relations == null ? List.of() : List.copyOf(relations);
        this.quantifiers = quantifiers == null ? List.of() : List.copyOf(quantifiers);
        this.modalities = modalities == null ? List.of() : List.copyOf(modalities);
        this.actions = actions == null ? List.of() : List.copyOf(actions);
        this.connectives = connectives == null ? List.of() : List.copyOf(connectives);
    }

    public static Components none() {
        return new Components(List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public boolean isEmpty() {
        return entities.isEmpty() && relations.isEmpty() && quantifiers.isEmpty()
                && modalities.isEmpty() && actions.isEmpty() && connectives.isEmpty();
    }

    /**
     * Flat rendering scanned for contradiction markers: {@code "name: a b ; "} per category.
     */
    public String flatten() {
        StringBuilder b = new StringBuilder(128);
        appendCategory(b, "entities", entities);
        b.append("relations:");
        for (Relation r : relations) b.append(' ').append(r.relation);
        b.append(" ; ");
        appendCategory(b, "quantifiers", quantifiers);
        appendCategory(b, "modalities", modalities);
        appendCategory(b, "actions", actions);
        appendCategory(b, "connectives", connectives);
        return b.toString();
    }

    private static void appendCategory(StringBuilder b, String name, List<String> tokens) {
        b.append(name).append(':');
        for (String t : tokens) b.append(' ').append(t);
        b.append(" ; ");
    }

    @Override
    public String toString() {
        return "Components{entities=" + entities
                + ", relations=" + relations
                + ", quantifiers=" + quantifiers
                + ", modalities=" + modalities
                + ", actions=" + actions
                + ", connectives=" + connectives
                + '}';
    }
}
