package org.calista.r3.text;

import java.util.List;
import java.util.Locale;

/**
 * Lexical contradiction markers.
 *
 * <p>Two phrase lists exist: one for whole statements (grounding) and one for the flattened
 * component rendering used by reasoning. Both scans are case-insensitive substring matches.</p>
 */
public final class ContradictionMarkers {

    /** Phrases scanned in raw statements before grounding. */
    public static final List<String> STATEMENT_PHRASES = List.of(
            "and not", "but not", "however not", "although not",
            "false true", "true false", "yes no", "no yes"
    );

    /** Single words that mark a statement as self-contradicting on their own. */
    public static final List<String> STATEMENT_WORDS = List.of("contradiction", "paradox");

    /** Phrases scanned in the flattened component rendering. Trailing blanks are significant. */
    public static final List<String> COMPONENT_PHRASES = List.of(
            "not and ", "and not ", "but not ", "however not",
            "false true", "true false", "yes no", "no yes"
    );

    private ContradictionMarkers() {}

    public static boolean inStatement(String statement) {
        if (statement == null || statement.isEmpty()) return false;
        String s = statement.toLowerCase(Locale.ROOT);
        for (String p : STATEMENT_PHRASES) {
            if (s.contains(p)) return true;
        }
        for (String w : STATEMENT_WORDS) {
            if (s.contains(w)) return true;
        }
        return false;
    }

    public static boolean inComponents(String flattened) {
        if (flattened == null || flattened.isEmpty()) return false;
        String s = flattened.toLowerCase(Locale.ROOT);
        for (String p : COMPONENT_PHRASES) {
            if (s.contains(p)) return true;
        }
        return false;
    }
}
