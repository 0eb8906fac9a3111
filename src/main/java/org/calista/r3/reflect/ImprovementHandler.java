package org.calista.r3.reflect;

/**
 * Applies one kind of improvement to the reflection baselines.
 *
 * <p>Called with the engine state lock held. Throws to signal failure; the caller logs the failure
 * and keeps going.</p>
 */
@FunctionalInterface
public interface ImprovementHandler {

    /** @return a short description of what changed */
    String apply(ImprovementProposal proposal, ReflectionBaselines baselines);
}
