package org.calista.r3.reason;

import org.calista.r3.util.Hashing;

import java.util.Objects;

/**
 * One refinement entry: a hypothesis for an unknown, a resolution for a contradiction, or a one-hop
 * implication from a known concept. {@link #digest} identifies the content.
 */
public final class Refinement {

    public enum Kind { HYPOTHESIS, RESOLUTION, IMPLICATION }

    public final Kind kind;
    public final String subject;
    public final String content;
    public final String digest;

    public Refinement(Kind kind, String subject, String content) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.subject = Objects.requireNonNull(subject, "subject");
        this.content = Objects.requireNonNull(content, "content");
        this.digest = Hashing.sha256Hex(kind.name() + "|" + this.subject + "|" + this.content);
    }

    public static Refinement hypothesis(String unknown) {
        return new Refinement(Kind.HYPOTHESIS, unknown,
                "'" + unknown + "' is treated as an undefined concept pending definition");
    }

    public static Refinement resolution(String contradiction) {
        return new Refinement(Kind.RESOLUTION, contradiction,
                "Resolve by restricting the scope of: " + contradiction);
    }

    public static Refinement implication(String from, String to) {
        return new Refinement(Kind.IMPLICATION, from, from + " relates to " + to);
    }

    @Override
    public String toString() {
        return kind + ": " + content;
    }
}
