package org.topomap.routing.core;

import org.topomap.geometry.Polyline;

/**
 * Outcome of one single-link search.
 *
 * @param reachable whether a route was found.
 * @param path route in grid coordinates from source to target (empty when unreachable).
 * @param weight accumulated search cost of the route ({@code +INF} when unreachable).
 * @param expandedStates number of states taken from the open set.
 */
public record RoutePlan(boolean reachable, Polyline path, float weight, int expandedStates) {

    /**
     * Creates a canonical unreachable result.
     */
    static RoutePlan unreachable(int expandedStates) {
        return new RoutePlan(false, Polyline.empty(), Float.POSITIVE_INFINITY, expandedStates);
    }
}
