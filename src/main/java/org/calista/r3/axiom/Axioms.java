package org.calista.r3.axiom;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The fixed axiom table. Loaded once per class loader and never modified.
 */
public final class Axioms {

    public static final String EXISTENCE = "A1";
    public static final String IDENTITY = "A2";
    public static final String NON_CONTRADICTION = "A3";
    public static final String EXCLUDED_MIDDLE = "A4";
    public static final String CONSERVATION = "A5";
    public static final String EMERGENCE = "A6";

    private static final Map<String, Axiom> TABLE = load();

    private Axioms() {}

    private static Map<String, Axiom> load() {
        LinkedHashMap<String, Axiom> m = new LinkedHashMap<>(8);
        put(m, new Axiom(EXISTENCE, "Conscious experience exists", 1.0, "ontological",
                "First-person experience is fundamental",
                List.of("existential", "instantiation")));
        put(m, new Axiom(IDENTITY, "A = A (Identity)", 1.0, "logical",
                "Law of identity",
                List.of("identity", "reflexive", "symmetric", "transitive")));
        put(m, new Axiom(NON_CONTRADICTION, "Not (A and not-A)", 1.0, "logical",
                "Law of non-contradiction",
                List.of("negation", "contradiction_elimination")));
        put(m, new Axiom(EXCLUDED_MIDDLE, "Either A or not-A", 1.0, "logical",
                "Law of excluded middle",
                List.of("disjunction", "choice", "partition")));
        put(m, new Axiom(CONSERVATION, "Information is conserved", 0.99, "physical",
                "Conservation of information",
                List.of("conservation", "invariance", "symmetry")));
        put(m, new Axiom(EMERGENCE, "Emergence exists", 0.95, "systemic",
                "Complex systems exhibit novel properties",
                List.of("composition", "hierarchy", "emergence_detection", "emergence_potential")));
        return java.util.Collections.unmodifiableMap(m);
    }

    private static void put(Map<String, Axiom> m, Axiom a) {
        m.put(a.id, a);
    }

    public static Optional<Axiom> get(String id) {
        return Optional.ofNullable(id == null ? null : TABLE.get(id));
    }

    public static Collection<Axiom> all() {
        return TABLE.values();
    }

    public static int size() {
        return TABLE.size();
    }

    /** Unknown axiom ids allow nothing. */
    public static boolean isAllowed(String axiomId, String transformation) {
        Axiom a = (axiomId == null) ? null : TABLE.get(axiomId);
        return a != null && a.allows(transformation);
    }
}
