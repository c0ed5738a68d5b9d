package org.topomap.routing.core;

import org.topomap.core.grid.GridPos;

/**
 * Vertex of the implicit search graph.
 *
 * <p>The same cell and heading with a different number of pending vias is a different
 * state, which layers the grid once per via without copying it.</p>
 *
 * @param pos cell.
 * @param dirX horizontal heading in {@code {-1, 0, 1}}.
 * @param dirY vertical heading in {@code {-1, 0, 1}}.
 * @param via number of vias still to visit; the next one is {@code vias[size - via]}.
 */
record GridState(GridPos pos, int dirX, int dirY, int via) {

    /**
     * Undirected start state.
     */
    static GridState start(GridPos pos, int pendingVias) {
        return new GridState(pos, 0, 0, pendingVias);
    }

    boolean hasDirection() {
        return dirX != 0 || dirY != 0;
    }

    boolean isDiagonal() {
        return dirX != 0 && dirY != 0;
    }

    boolean isCardinal() {
        return dirX == 0 || dirY == 0;
    }

    /**
     * One cell further along the current heading.
     */
    GridState advance() {
        return new GridState(pos.translate(dirX, dirY), dirX, dirY, via);
    }

    /**
     * Same cell with a new heading.
     */
    GridState heading(int newDirX, int newDirY) {
        return new GridState(pos, newDirX, newDirY, via);
    }

    /**
     * One cell in direction {@code (dx, dy)}, now heading that way.
     */
    GridState step(int dx, int dy) {
        return new GridState(pos.translate(dx, dy), dx, dy, via);
    }

    GridState withVia(int newVia) {
        return new GridState(pos, dirX, dirY, newVia);
    }
}
