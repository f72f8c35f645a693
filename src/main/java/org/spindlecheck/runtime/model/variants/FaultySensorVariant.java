package org.spindlecheck.runtime.model.variants;

import org.spindlecheck.runtime.model.Kinetochore;

/**
 * A MAD2-deficient sensor: never inhibits and always claims to be ready, whatever its real
 * attachment. This can push the controller into a premature commit.
 */
public final class FaultySensorVariant implements IKinetochoreVariant {

    @Override
    public String name() {
        return "faultySensor";
    }

    @Override
    public double emitSignal(Kinetochore kinetochore, double baseSignal) {
        return 0.0;
    }

    @Override
    public boolean isReady(Kinetochore kinetochore, boolean baseReady) {
        return true;
    }
}
