package org.calista.r3.reason;

import org.calista.r3.util.Hashing;

import java.util.Map;
import java.util.Objects;

/**
 * Memoization key: (whitespace-normalized query, canonical JSON of the context, clamped depth).
 *
 * <p>The key holds the full content, not a digest, so two distinct triples never collide.</p>
 */
public final class ReasoningCacheKey {

    public final String query;
    public final String context;
    public final int depth;

    private ReasoningCacheKey(String query, String context, int depth) {
        this.query = query;
        this.context = context;
        this.depth = depth;
    }

    public static ReasoningCacheKey of(String query, Map<String, ?> context, int depth) {
        String q = (query == null ? "" : query.trim().replaceAll("\\s+", " "));
        String c = Hashing.canonicalJson(context == null ? Map.of() : context);
        return new ReasoningCacheKey(q, c, depth);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReasoningCacheKey)) return false;
        ReasoningCacheKey k = (ReasoningCacheKey) o;
        return depth == k.depth && query.equals(k.query) && context.equals(k.context);
    }

    @Override
    public int hashCode() {
        return Objects.hash(query, context, depth);
    }

    @Override
    public String toString() {
        return "ReasoningCacheKey{depth=" + depth + ", query='" + query + "', context=" + context + '}';
    }
}
