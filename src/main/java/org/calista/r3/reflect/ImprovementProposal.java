package org.calista.r3.reflect;

import java.util.*;

/**
 * A proposed improvement. Pure data: the handler is looked up by {@link #kind} in
 * {@link ImprovementHandlers}, never carried by the proposal.
 */
public final class ImprovementProposal {

    public final ImprovementKind kind;
    public final double impact;
    public final Map<String, Object> parameters;

    public ImprovementProposal(ImprovementKind kind, Map<String, Object> parameters) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.impact = kind.impact;
        this.parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    public static ImprovementProposal increaseDepth(int from, int to) {
        LinkedHashMap<String, Object> p = new LinkedHashMap<>();
        p.put("from", from);
        p.put("to", to);
        return new ImprovementProposal(ImprovementKind.INCREASE_REASONING_DEPTH, p);
    }

    public static ImprovementProposal improveCertainty(double current, double target) {
        LinkedHashMap<String, Object> p = new LinkedHashMap<>();
        p.put("current", current);
        p.put("target", target);
        return new ImprovementProposal(ImprovementKind.IMPROVE_CERTAINTY, p);
    }

    public static ImprovementProposal optimizePatterns(List<String> patterns) {
        LinkedHashMap<String, Object> p = new LinkedHashMap<>();
        p.put("patterns", patterns == null ? List.of() : List.copyOf(patterns));
        return new ImprovementProposal(ImprovementKind.OPTIMIZE_PATTERNS, p);
    }

    public int intParam(String name) {
        Object v = parameters.get(name);
        if (v instanceof Number n) return n.intValue();
        throw new IllegalStateException(kind.id + ": missing int parameter '" + name + "'");
    }

    public double doubleParam(String name) {
        Object v = parameters.get(name);
        if (v instanceof Number n) return n.doubleValue();
        throw new IllegalStateException(kind.id + ": missing number parameter '" + name + "'");
    }

    public List<String> listParam(String name) {
        Object v = parameters.get(name);
        if (!(v instanceof List<?> l)) return List.of();
        ArrayList<String> out = new ArrayList<>(l.size());
        for (Object o : l) out.add(String.valueOf(o));
        return out;
    }

    @Override
    public String toString() {
        return kind.id + parameters;
    }
}
