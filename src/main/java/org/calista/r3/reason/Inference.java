package org.calista.r3.reason;

import java.util.List;
import java.util.Objects;

/**
 * Direct inference produced by base reasoning.
 *
 * <ul>
 *   <li>{@link #ENTITY_KNOWN}: {@code subject} is a graph concept, {@code targets} are its related concepts</li>
 *   <li>{@link #RELATION_VALID}: {@code subject} is the relation subject, {@code targets} = [relation, object]</li>
 * </ul>
 */
public final class Inference {

    public static final String ENTITY_KNOWN = "entity_known";
    public static final String RELATION_VALID = "relation_valid";

    public final String type;
    public final String subject;
    public final List<String> targets;

    public Inference(String type, String subject, List<String> targets) {
        this.type = Objects.requireNonNull(type, "type");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static Inference entityKnown(String entity, List<String> related) {
        return new Inference(ENTITY_KNOWN, entity, related);
    }

    public static Inference relationValid(Relation r) {
        return new Inference(RELATION_VALID, r.subject, List.of(r.relation, r.object));
    }

    @Override
    public String toString() {
        return type + "(" + subject + " -> " + targets + ")";
    }
}
