package org.spindlecheck.runtime.model.variants;

import org.spindlecheck.runtime.model.Kinetochore;
import org.spindlecheck.runtime.model.KinetochoreState;
import org.spindlecheck.runtime.model.PhysicsParameters;
import org.spindlecheck.runtime.spi.IRandomProvider;

/**
 * Weak CTCF boundaries: a tensioned attachment randomly flickers back to relaxed after
 * the base update, with probability {@code ctcfInstability}.
 */
public final class UnstableBoundaryVariant implements IKinetochoreVariant {

    @Override
    public String name() {
        return "unstableBoundary";
    }

    @Override
    public void afterUpdate(Kinetochore kinetochore, PhysicsParameters physics, IRandomProvider random) {
        if (kinetochore.getState() == KinetochoreState.ATTACHED_TENSIONED
                && random.nextDouble() < physics.getCtcfInstability()) {
            kinetochore.relaxTension();
        }
    }
}
