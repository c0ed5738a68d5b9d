package org.topomap.routing.core;

import org.topomap.geometry.Polyline;

/**
 * A route held by the router between passes, with the weight used to rank it.
 *
 * @param linkId topology link id.
 * @param path routed polyline.
 * @param weight search cost of {@code path}.
 */
record LinkRoute(String linkId, Polyline path, float weight) {

    /**
     * Route length divided by weight; the fix-point pass improves low ratios first.
     */
    float lengthToWeight() {
        return path.length() / weight;
    }
}
