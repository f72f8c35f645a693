package org.spindlecheck.runtime;

/**
 * Observable state of the system at the end of one tick.
 *
 * @param tick the tick index, starting at 0
 * @param busConcentration the bus concentration after this tick's update
 * @param readyCount number of kinetochores reporting readiness
 * @param totalCount number of kinetochores
 * @param misattachedCount number of misattached kinetochores
 * @param arrested whether mitotic arrest has been entered on or before this tick
 * @param committed whether the commit latch is set
 */
public record TickReport(long tick,
                         double busConcentration,
                         int readyCount,
                         int totalCount,
                         int misattachedCount,
                         boolean arrested,
                         boolean committed) {
}
