package org.topomap.routing.core;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;
import org.topomap.core.grid.GridPos;
import org.topomap.core.grid.SparseGrid;

import java.util.List;

/**
 * Per-cell lists of the links occupying each grid cell.
 *
 * <p>Links are held as dense internal ids. A cell appears in the grid only while at least
 * one link occupies it; each link is listed at most once per cell, in insertion order.</p>
 */
final class LinkOccupancy {
    private final SparseGrid<IntArrayList> cells = new SparseGrid<>();

    /**
     * Records {@code linkId} at {@code pos}; a no-op when already present.
     *
     * @return whether the cell changed.
     */
    boolean add(GridPos pos, int linkId) {
        IntArrayList links = cells.computeIfAbsent(pos, p -> new IntArrayList(2));
        if (links.contains(linkId)) {
            return false;
        }
        links.add(linkId);
        return true;
    }

    /**
     * Removes {@code linkId} from {@code pos}, dropping the cell once it is empty.
     *
     * @return whether the cell changed.
     */
    boolean remove(GridPos pos, int linkId) {
        IntArrayList links = cells.getOrDefault(pos, null);
        if (links == null) {
            return false;
        }
        boolean removed = links.rem(linkId);
        if (links.isEmpty()) {
            cells.remove(pos);
        }
        return removed;
    }

    /**
     * Links at {@code pos}; empty when the cell is free. The returned list is live and must
     * not be modified by callers.
     */
    IntList linksAt(GridPos pos) {
        IntArrayList links = cells.getOrDefault(pos, null);
        return links == null ? IntLists.emptyList() : links;
    }

    boolean isOccupied(GridPos pos) {
        return cells.contains(pos);
    }

    /**
     * Occupied cells in ascending position order.
     */
    List<GridPos> occupiedCells() {
        return cells.positions();
    }

    int occupiedCellCount() {
        return cells.size();
    }
}
