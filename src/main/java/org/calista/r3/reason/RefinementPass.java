package org.calista.r3.reason;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

/**
 * One pass of recursive refinement, linked to the next pass.
 *
 * <p>A pass with {@link #maxDepthReached} set is the sentinel appended when the depth budget ran
 * out while unknowns remained. It carries no refinements.</p>
 */
public final class RefinementPass {

    public static final String STATUS_REFINED = "refined";
    public static final String STATUS_MAX_DEPTH = "max_depth_reached";

    /** Remaining depth budget when this pass ran. */
    public final int depth;
    public final String status;
    public final boolean maxDepthReached;
    public final List<Refinement> refinements;
    /** Unknowns discovered by this pass and handed to {@link #next}. */
    public final List<String> discoveredUnknowns;
    public final RefinementPass next;

    public RefinementPass(int depth, List<Refinement> refinements, List<String> discoveredUnknowns, RefinementPass next) {
        this.depth = depth;
        this.status = STATUS_REFINED;
        this.maxDepthReached = false;
        this.refinements = refinements == null ? List.of() : List.copyOf(refinements);
        this.discoveredUnknowns = discoveredUnknowns == null ? List.of() : List.copyOf(discoveredUnknowns);
        this.next = next;
    }

    private RefinementPass(int depth) {
        this.depth = depth;
        this.status = STATUS_MAX_DEPTH;
        this.maxDepthReached = true;
        this.refinements = List.of();
        this.discoveredUnknowns = List.of();
        this.next = null;
    }

    public static RefinementPass maxDepth(int depth) {
        return new RefinementPass(depth);
    }

    /** Refinements of this pass and all following passes, in order. */
    public List<Refinement> allRefinements() {
        ArrayList<Refinement> out = new ArrayList<>();
        for (RefinementPass p = this; p != null; p = p.next) out.addAll(p.refinements);
        return out;
    }

    /** Number of passes in the chain, the sentinel included. */
    public int chainLength() {
        int n = 0;
        for (RefinementPass p = this; p != null; p = p.next) n++;
        return n;
    }

    @JsonIgnore
    public boolean isBudgetExhausted() {
        for (RefinementPass p = this; p != null; p = p.next) {
            if (p.maxDepthReached) return true;
        }
        return false;
    }
}
