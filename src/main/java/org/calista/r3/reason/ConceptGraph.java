package org.calista.r3.reason;

import java.util.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * ConceptGraph — adjacency of concept name to related concept names.
 *
 * <p>Known entities are graph keys. Reads are ordered (insertion order of relations) so one-hop
 * traversal is deterministic. Every mutation bumps {@link #version()}; reasoning drops its memoized
 * results when the version it last saw changes.</p>
 */
public final class ConceptGraph {

    /** Logical operators the graph starts with. */
    public static final List<String> LOGICAL_OPERATORS = List.of(
            "AND", "OR", "NOT", "IMPLIES", "IFF", "FORALL", "EXISTS", "EQUALS", "NOT_EQUALS"
    );

    private final Map<String, LinkedHashSet<String>> adjacency = new LinkedHashMap<>();
    private final ReentrantReadWriteLock rw = new ReentrantReadWriteLock();
    private final AtomicLong version = new AtomicLong();

    /** Graph preloaded with {@link #LOGICAL_OPERATORS}, each related to {@code operator_<NAME>}. */
    public static ConceptGraph withLogicalOperators() {
        ConceptGraph g = new ConceptGraph();
        for (String op : LOGICAL_OPERATORS) g.relate(op, "operator_" + op);
        return g;
    }

    // =========================
    // Mutations
    // =========================

    /** @return true if the concept was not known before */
    public boolean addConcept(String name) {
        String n = requireName(name, "name");
        rw.writeLock().lock();
        try {
            if (adjacency.containsKey(n)) return false;
            adjacency.put(n, new LinkedHashSet<>());
            version.incrementAndGet();
            return true;
        } finally {
            rw.writeLock().unlock();
        }
    }

    /**
     * Adds a directed relation {@code from -> to}. {@code from} becomes a known concept; {@code to}
     * does not unless it is added separately.
     *
     * @return true if the graph changed
     */
    public boolean relate(String from, String to) {
        String f = requireName(from, "from");
        String t = requireName(to, "to");
        rw.writeLock().lock();
        try {
            LinkedHashSet<String> rel = adjacency.get(f);
            boolean changed = false;
            if (rel == null) {
                rel = new LinkedHashSet<>();
                adjacency.put(f, rel);
                changed = true;
            }
            changed |= rel.add(t);
            if (changed) version.incrementAndGet();
            return changed;
        } finally {
            rw.writeLock().unlock();
        }
    }

    // =========================
    // Reads
    // =========================

    public boolean contains(String name) {
        if (name == null) return false;
        rw.readLock().lock();
        try {
            return adjacency.containsKey(name);
        } finally {
            rw.readLock().unlock();
        }
    }

    /** Related concepts in insertion order; empty for unknown names. */
    public List<String> related(String name) {
        if (name == null) return List.of();
        rw.readLock().lock();
        try {
            LinkedHashSet<String> rel = adjacency.get(name);
            return rel == null ? List.of() : List.copyOf(rel);
        } finally {
            rw.readLock().unlock();
        }
    }

    public List<String> conceptsSorted() {
        rw.readLock().lock();
        try {
            ArrayList<String> out = new ArrayList<>(adjacency.keySet());
            Collections.sort(out);
            return Collections.unmodifiableList(out);
        } finally {
            rw.readLock().unlock();
        }
    }

    public int size() {
        rw.readLock().lock();
        try {
            return adjacency.size();
        } finally {
            rw.readLock().unlock();
        }
    }

    public long version() {
        return version.get();
    }

    private static String requireName(String s, String what) {
        Objects.requireNonNull(s, what);
        String t = s.trim();
        if (t.isEmpty()) throw new IllegalArgumentException(what + " must not be blank");
        return t;
    }
}
