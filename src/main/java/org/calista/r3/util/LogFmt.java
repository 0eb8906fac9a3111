package org.calista.r3.util;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * LogFmt — compact box renderer for multi-line log and console summaries.
 */
public final class LogFmt {

    private LogFmt() {}

    public static String box(String title, Consumer<BoxBuilder> fill) {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(fill, "fill");

        BoxBuilder b = new BoxBuilder();
        fill.accept(b);
        return renderBox(title, b.lines);
    }

    /** Fixed 3-decimal rendering for scores in boxes. */
    public static String f3(double v) {
        return String.format(java.util.Locale.ROOT, "%.3f", v);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static final class BoxBuilder {
        private final List<String> lines = new ArrayList<>(16);

        public BoxBuilder kv(String key, Object value) {
            lines.add((key == null ? "" : key) + ": " + value);
            return this;
        }

        public BoxBuilder line(String text) {
            lines.add(text == null ? "" : text);
            return this;
        }

        public BoxBuilder sep() {
            lines.add(null);
            return this;
        }
    }

    // ---------------------------------------------------------------------
    // Rendering
    // ---------------------------------------------------------------------

    private static String renderBox(String title, List<String> lines) {
        int contentWidth = title.length();
        for (String l : lines) {
            if (l != null) contentWidth = Math.max(contentWidth, l.length());
        }
        int w = Math.max(24, contentWidth + 2);

        StringBuilder out = new StringBuilder((lines.size() + 5) * (w + 4));
        out.append('┌').append("─".repeat(w)).append("┐\n");
        out.append("│ ").append(padRight(title, w - 1)).append("│\n");
        out.append('├').append("─".repeat(w)).append("┤\n");

        for (String l : lines) {
            if (l == null) {
                out.append('│').append("─".repeat(w)).append("│\n");
                continue;
            }
            out.append("│ ").append(padRight(l, w - 1)).append("│\n");
        }

        out.append('└').append("─".repeat(w)).append('┘');
        return out.toString();
    }

    private static String padRight(String s, int width) {
        if (s.length() >= width) return s;
        return s + " ".repeat(width - s.length());
    }
}
