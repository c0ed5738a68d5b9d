package org.topomap.routing.core;

import org.topomap.core.grid.GridPos;

/**
 * Inclusive rectangular bound of the routing search space.
 *
 * @param min smallest in-bounds cell.
 * @param max largest in-bounds cell.
 */
public record GridExtents(GridPos min, GridPos max) {

    /**
     * Normalizes two arbitrary corners into a bound.
     */
    public static GridExtents spanning(GridPos a, GridPos b) {
        return new GridExtents(a.min(b), a.max(b));
    }

    public boolean contains(GridPos pos) {
        return pos.x() >= min.x() && pos.x() <= max.x()
                && pos.y() >= min.y() && pos.y() <= max.y();
    }

    /**
     * Returns the smallest bound holding this one and {@code pos}.
     */
    public GridExtents include(GridPos pos) {
        return new GridExtents(min.min(pos), max.max(pos));
    }

    /**
     * Returns this bound grown by {@code margin} cells on every side.
     */
    public GridExtents grow(int margin) {
        return new GridExtents(min.translate(-margin, -margin), max.translate(margin, margin));
    }
}
