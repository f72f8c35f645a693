package org.spindlecheck.runtime.model;

import org.spindlecheck.runtime.model.variants.IKinetochoreVariant;
import org.spindlecheck.runtime.spi.IRandomProvider;

import java.util.Objects;

/**
 * A single kinetochore: a stochastic finite state machine that attaches to the spindle,
 * senses the tension produced together with its sister and emits the inhibitory
 * checkpoint signal while it is not satisfied.
 * <p>
 * Behavioural variants are attached as an {@link IKinetochoreVariant}; the base transition
 * table below is shared by all of them.
 * </p>
 */
public class Kinetochore {

    private static final double BASE_TENSION = 1.0;
    private static final double FALSE_TENSION_MEAN = 0.5;

    private final int uid;
    private final int pairId;
    private final double tensionThreshold;
    private final double noiseSigma;
    private final IKinetochoreVariant variant;

    private KinetochoreState state = KinetochoreState.DETACHED;
    private double currentTension = 0.0;
    private int tensionStabilityCounter = 0;
    private int misattachmentCounter = 0;

    /**
     * Creates a kinetochore with the standard behaviour.
     * @param uid Unique id of this kinetochore.
     * @param pairId Id shared with the sister kinetochore (the chromosome id).
     * @param tensionThreshold Minimum tension that counts towards stable bi-orientation.
     * @param noiseSigma Standard deviation of the tension measurement noise.
     */
    public Kinetochore(int uid, int pairId, double tensionThreshold, double noiseSigma) {
        this(uid, pairId, tensionThreshold, noiseSigma, IKinetochoreVariant.NONE);
    }

    /**
     * Creates a kinetochore with a behavioural variant.
     * @param uid Unique id of this kinetochore.
     * @param pairId Id shared with the sister kinetochore (the chromosome id).
     * @param tensionThreshold Minimum tension that counts towards stable bi-orientation.
     * @param noiseSigma Standard deviation of the tension measurement noise.
     * @param variant The variant overlay, {@link IKinetochoreVariant#NONE} for none.
     */
    public Kinetochore(int uid, int pairId, double tensionThreshold, double noiseSigma, IKinetochoreVariant variant) {
        this.uid = uid;
        this.pairId = pairId;
        this.tensionThreshold = tensionThreshold;
        this.noiseSigma = noiseSigma;
        this.variant = Objects.requireNonNull(variant, "variant");
    }

    /**
     * Advances this kinetochore by one tick.
     *
     * @param siblingState The sister's state as observed for this tick.
     * @param physics The shared physics parameters. Never modified.
     * @param random The random stream of this kinetochore.
     */
    public void update(KinetochoreState siblingState, PhysicsParameters physics, IRandomProvider random) {
        PhysicsParameters effective = variant.derivePhysics(physics);
        applyBaseTransition(siblingState, effective, random);
        variant.afterUpdate(this, effective, random);
    }

    private void applyBaseTransition(KinetochoreState siblingState, PhysicsParameters physics, IRandomProvider random) {
        // 1. attachment / detachment
        if (state == KinetochoreState.DETACHED) {
            if (random.nextDouble() < physics.getAttachProbability()) {
                if (random.nextDouble() < physics.getMisattachProbability()) {
                    state = KinetochoreState.MISATTACHED;
                    misattachmentCounter = 0;
                } else {
                    state = KinetochoreState.ATTACHED_RELAXED;
                }
            }
        } else {
            double detachProbability = physics.getDetachProbability();
            if (state == KinetochoreState.MISATTACHED) {
                detachProbability *= physics.getMisattachDetachMultiplier();
            }
            if (random.nextDouble() < detachProbability) {
                detach();
            }
        }

        // 2. a merotelic attachment only produces false tension and can never become tensioned
        if (state == KinetochoreState.MISATTACHED) {
            misattachmentCounter++;
            double falseTension = random.nextGaussian(FALSE_TENSION_MEAN, noiseSigma * 2);
            currentTension = Math.max(0.0, falseTension);
            return;
        }

        // 3. tension only builds up when both sisters are properly attached
        if (state.isProperlyAttached() && siblingState.isProperlyAttached()) {
            double measured = Math.max(0.0, random.nextGaussian(BASE_TENSION, noiseSigma));
            currentTension = measured;

            if (measured >= tensionThreshold) {
                tensionStabilityCounter++;
                state = tensionStabilityCounter >= physics.getTensionStabilityWindow()
                        ? KinetochoreState.ATTACHED_TENSIONED
                        : KinetochoreState.ATTACHED_RELAXED;
            } else {
                tensionStabilityCounter = 0;
                state = KinetochoreState.ATTACHED_RELAXED;

                double relaxedThreshold = physics.getWaplRelaxedThreshold();
                if (measured < relaxedThreshold) {
                    double unloadChance = physics.getWaplUnloadProbability() * (1.0 - measured / relaxedThreshold);
                    if (random.nextDouble() < unloadChance) {
                        detach();
                    }
                }
            }
        } else {
            // 4.
            currentTension = 0.0;
            tensionStabilityCounter = 0;
        }
    }

    private void detach() {
        state = KinetochoreState.DETACHED;
        currentTension = 0.0;
        tensionStabilityCounter = 0;
        misattachmentCounter = 0;
    }

    /**
     * Drops a tensioned attachment back to relaxed and restarts the stability filter.
     * Has no effect in any other state.
     */
    public void relaxTension() {
        if (state == KinetochoreState.ATTACHED_TENSIONED) {
            state = KinetochoreState.ATTACHED_RELAXED;
            tensionStabilityCounter = 0;
        }
    }

    /**
     * Returns the inhibitory signal of this kinetochore for the current tick.
     * @return 0.0 when satisfied, 1.0 (full inhibition) otherwise
     */
    public double emitSignal() {
        double base = state == KinetochoreState.ATTACHED_TENSIONED ? 0.0 : 1.0;
        return variant.emitSignal(this, base);
    }

    /**
     * Reports whether this kinetochore considers itself ready for anaphase.
     * @return true when tensioned, or whatever the variant reports instead
     */
    public boolean isReady() {
        return variant.isReady(this, state == KinetochoreState.ATTACHED_TENSIONED);
    }

    /**
     * Reports whether this kinetochore is in a merotelic attachment. Variants cannot override this.
     * @return true when misattached
     */
    public boolean isMisattached() {
        return state == KinetochoreState.MISATTACHED;
    }

    public int getUid() { return uid; }
    public int getPairId() { return pairId; }
    public double getTensionThreshold() { return tensionThreshold; }
    public double getNoiseSigma() { return noiseSigma; }
    public IKinetochoreVariant getVariant() { return variant; }
    public KinetochoreState getState() { return state; }
    public double getCurrentTension() { return currentTension; }
    public int getTensionStabilityCounter() { return tensionStabilityCounter; }
    public int getMisattachmentCounter() { return misattachmentCounter; }

    @Override
    public String toString() {
        return "Kinetochore{uid=" + uid + ", pair=" + pairId + ", state=" + state
                + ", tension=" + currentTension + ", variant=" + variant.name() + "}";
    }
}
