package org.spindlecheck.runtime.model.variants;

import org.spindlecheck.runtime.model.PhysicsParameters;

/**
 * Merotelic drift: the misattach probability on attachment is scaled up by
 * {@code merotelicDriftMultiplier} for this kinetochore only.
 */
public final class ElevatedMisattachmentRiskVariant implements IKinetochoreVariant {

    @Override
    public String name() {
        return "elevatedMisattachmentRisk";
    }

    @Override
    public PhysicsParameters derivePhysics(PhysicsParameters shared) {
        return shared.withMisattachProbability(shared.getMisattachProbability() * shared.getMerotelicDriftMultiplier());
    }
}
