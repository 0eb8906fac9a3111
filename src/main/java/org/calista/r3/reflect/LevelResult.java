package org.calista.r3.reflect;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one reflection level: insight strings, a certainty and level-specific details.
 */
public final class LevelResult {

    public final ReflectionLevel level;
    public final List<String> insights;
    public final double certainty;
    public final Map<String, Object> details;

    public LevelResult(ReflectionLevel level, List<String> insights, double certainty, Map<String, Object> details) {
        this.level = Objects.requireNonNull(level, "level");
        this.insights = insights == null ? List.of() : List.copyOf(insights);
        this.certainty = Math.max(0.0, Math.min(1.0, certainty));
        this.details = details == null
                ? Map.of()
                : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    @Override
    public String toString() {
        return level + "{insights=" + insights.size() + ", certainty=" + certainty + '}';
    }
}
