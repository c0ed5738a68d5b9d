package org.topomap.routing.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Summary of one {@link LinkRouter#routeLinks()} run.
 *
 * <p>Every link of the topology appears in exactly one of the three id lists, each in
 * ascending id order.</p>
 */
@Value
@Builder
public class RoutingReport {
    /** Links that received a route in this run. */
    @Singular("routedLink")
    List<String> routedLinkIds;

    /** Links left without a route: unknown or unpositioned endpoints, or no path found. */
    @Singular("unroutedLink")
    List<String> unroutedLinkIds;

    /** Links that already carried a route and were left untouched. */
    @Singular("keptLink")
    List<String> keptLinkIds;

    /** Fix-point rounds executed. */
    int fixPointRounds;

    /** Whether the fix-point pass ended on a round without improvement. */
    boolean converged;

    /** Total states expanded over all searches of the run. */
    long expandedStates;

    public boolean isComplete() {
        return unroutedLinkIds.isEmpty();
    }
}
