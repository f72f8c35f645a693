package org.spindlecheck.runtime.model.variants;

import org.spindlecheck.runtime.model.PhysicsParameters;

/**
 * Hyperstabilised attachments: the detach probability is scaled down by
 * {@code hyperstabilizationFactor} for this kinetochore only.
 */
public final class HyperstableVariant implements IKinetochoreVariant {

    @Override
    public String name() {
        return "hyperstable";
    }

    @Override
    public PhysicsParameters derivePhysics(PhysicsParameters shared) {
        return shared.withDetachProbability(shared.getDetachProbability() * shared.getHyperstabilizationFactor());
    }
}
