package org.calista.r3.reason;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Objects;
import java.util.Set;

/**
 * A relation token with its neighbouring words: {@code subject relation object}.
 */
public final class Relation {

    /** Known relation words. */
    public static final Set<String> VOCABULARY = Set.of("is", "has", "can", "does", "will", "should", "must");

    public final String subject;
    public final String relation;
    public final String object;

    public Relation(String subject, String relation, String object) {
        this.subject = subject == null ? "" : subject;
        this.relation = Objects.requireNonNull(relation, "relation");
        this.object = object == null ? "" : object;
    }

    /**
     * Checked against the relation vocabulary only. Subject and object are context and may be empty,
     * as in a question that opens with the relation word ("Is AI conscious?").
     */
    @JsonIgnore
    public boolean isWellFormed() {
        return VOCABULARY.contains(relation);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Relation)) return false;
        Relation r = (Relation) o;
        return subject.equals(r.subject) && relation.equals(r.relation) && object.equals(r.object);
    }

    @Override
    public int hashCode() {
        return Objects.hash(subject, relation, object);
    }

    @Override
    public String toString() {
        return (subject + " " + relation + " " + object).trim();
    }
}
