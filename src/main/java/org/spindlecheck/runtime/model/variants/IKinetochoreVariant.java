package org.spindlecheck.runtime.model.variants;

import org.spindlecheck.runtime.model.Kinetochore;
import org.spindlecheck.runtime.model.PhysicsParameters;
import org.spindlecheck.runtime.spi.IRandomProvider;

/**
 * A behavioural overlay on the base kinetochore transition table.
 * <p>
 * Every hook defaults to the identity, so a variant only overrides the slice it changes.
 * Implementations must be stateless: one instance is shared by all kinetochores of its type.
 * </p>
 */
public interface IKinetochoreVariant {

    /**
     * The variant used for kinetochores without an assignment.
     */
    IKinetochoreVariant NONE = () -> "none";

    /**
     * @return a short, stable name used in logs and reports
     */
    String name();

    /**
     * Derives the parameters used for a single update call. Must return a new instance
     * (or the argument itself) and never mutate the argument.
     *
     * @param shared the parameters shared by all kinetochores
     * @return the parameters for this call
     */
    default PhysicsParameters derivePhysics(PhysicsParameters shared) {
        return shared;
    }

    /**
     * Called after the base transition of an update has been applied.
     *
     * @param kinetochore the kinetochore that was just updated
     * @param physics the parameters used for this call
     * @param random the kinetochore's random stream
     */
    default void afterUpdate(Kinetochore kinetochore, PhysicsParameters physics, IRandomProvider random) {
    }

    /**
     * @param kinetochore the emitting kinetochore
     * @param baseSignal the signal of the base table
     * @return the signal actually emitted
     */
    default double emitSignal(Kinetochore kinetochore, double baseSignal) {
        return baseSignal;
    }

    /**
     * @param kinetochore the queried kinetochore
     * @param baseReady the readiness of the base table
     * @return the readiness actually reported
     */
    default boolean isReady(Kinetochore kinetochore, boolean baseReady) {
        return baseReady;
    }
}
