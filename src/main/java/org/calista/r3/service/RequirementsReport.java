package org.calista.r3.service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of the ten session requirement checks.
 */
public final class RequirementsReport {

    /** Requirement name to met flag, in check order. */
    public final Map<String, Boolean> requirements;
    public final boolean allMet;
    /** Fraction of requirements met. */
    public final double score;

    public RequirementsReport(Map<String, Boolean> requirements) {
        this.requirements = Collections.unmodifiableMap(new LinkedHashMap<>(requirements));
        int met = 0;
        for (boolean b : this.requirements.values()) if (b) met++;
        this.allMet = !this.requirements.isEmpty() && met == this.requirements.size();
        this.score = this.requirements.isEmpty() ? 0.0 : (double) met / this.requirements.size();
    }

    public boolean met(String requirement) {
        return Boolean.TRUE.equals(requirements.get(requirement));
    }
}
