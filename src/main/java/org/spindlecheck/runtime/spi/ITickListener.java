package org.spindlecheck.runtime.spi;

import org.spindlecheck.runtime.TickReport;

/**
 * Receives the report of every completed tick, in tick order.
 * <p>
 * Listeners are called synchronously at the end of the tick, after the bus, the controller,
 * the safety monitor and the outcome policy have run. They must not block.
 * </p>
 */
@FunctionalInterface
public interface ITickListener {

    /**
     * @param report the report of the tick that just completed
     */
    void onTick(TickReport report);
}
