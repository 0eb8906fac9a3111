package org.calista.r3.text;

import java.util.ArrayList;
import java.util.List;

/**
 * Whitespace tokenizer that keeps the original casing and strips surrounding punctuation.
 *
 * <p>Casing is preserved because entity detection depends on it. Inner punctuation survives
 * ("I'm", "non-trivial"), surrounding punctuation does not ("mortal," becomes "mortal").</p>
 */
public final class WhitespaceTokenizer implements Tokenizer {

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();

        String[] parts = text.trim().split("\\s+");
        ArrayList<String> out = new ArrayList<>(parts.length);
        for (String p : parts) {
            String t = strip(p);
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    /** Number of whitespace separated words, punctuation included. */
    public static int wordCount(String text) {
        if (text == null || text.isBlank()) return 0;
        return text.trim().split("\\s+").length;
    }

    private static String strip(String raw) {
        int from = 0;
        int to = raw.length();
        while (from < to && !Character.isLetterOrDigit(raw.charAt(from))) from++;
        while (to > from && !Character.isLetterOrDigit(raw.charAt(to - 1))) to--;
        return raw.substring(from, to);
    }
}
