package org.calista.r3.reason;

/**
 * ComponentExtractor — turns a query into {@link Components}.
 *
 * <p>The default implementation is a lexical heuristic. A linguistic implementation can replace it
 * without touching the certainty and emergence math in {@link ReasoningEngine}.</p>
 *
 * <p>Implementations must be deterministic and side-effect free: results are memoized.</p>
 */
public interface ComponentExtractor {

    Components extract(String query);
}
