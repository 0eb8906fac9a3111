package org.calista.r3.reflect;

import java.util.List;

/**
 * The four reflection levels, in the order a cycle runs them.
 */
public enum ReflectionLevel {

    REFLEXIVE(1, "What am I doing?"),
    RECURSIVE(2, "How am I thinking about what I'm doing?"),
    REGENERATIVE(3, "How can I improve how I think?"),
    TRANSCENDENT(4, "What new forms of thinking can emerge?");

    /** Execution order of a cycle. */
    public static final List<ReflectionLevel> PIPELINE = List.of(REFLEXIVE, RECURSIVE, REGENERATIVE, TRANSCENDENT);

    public final int number;
    public final String question;

    ReflectionLevel(int number, String question) {
        this.number = number;
        this.question = question;
    }
}
