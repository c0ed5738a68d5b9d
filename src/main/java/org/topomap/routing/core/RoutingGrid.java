package org.topomap.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;
import org.topomap.core.grid.CellRange;
import org.topomap.core.grid.Direction;
import org.topomap.core.grid.GridPos;
import org.topomap.core.grid.SparseGrid;
import org.topomap.topology.Node;

/**
 * Occupancy state shared by all searches of one {@link LinkRouter}.
 *
 * <p>Three layers: node cells (including multi-cell footprints), fixed node-label cells, and
 * per-cell link lists. The extents grow to cover every registered cell unless overridden.</p>
 *
 * <p>Searches only read this class; {@link LinkRouter} is the single writer.</p>
 */
final class RoutingGrid {
    private final SparseGrid<String> nodes = new SparseGrid<>();
    private final SparseGrid<Boolean> nodeLabels = new SparseGrid<>();
    private final LinkOccupancy links = new LinkOccupancy();
    private GridExtents extents;

    /**
     * Registers a positioned node: its cells, its label cell and the extents they span.
     */
    void addNode(Node node) {
        GridPos pos = node.getPos();
        include(pos);
        nodes.set(pos, node.getId());

        if (node.isMultiCell()) {
            CellRange range = node.cellRange();
            for (GridPos cell : range.cells()) {
                nodes.set(cell, node.getId());
            }
            include(range.min());
            include(range.maxExclusive());
        }

        Direction labelDirection = node.labelDirection();
        if (labelDirection != Direction.NONE) {
            GridPos labelAt = labelDirection.move(pos);
            nodeLabels.set(labelAt, Boolean.TRUE);
            include(labelAt);
        }
    }

    /**
     * Records a link at a cell and grows the extents to cover it.
     */
    void addLink(GridPos pos, int linkId) {
        links.add(pos, linkId);
        include(pos);
    }

    void removeLink(GridPos pos, int linkId) {
        links.remove(pos, linkId);
    }

    /**
     * Id of the node covering {@code pos}, or null.
     */
    String nodeAt(GridPos pos) {
        return nodes.getOrDefault(pos, null);
    }

    boolean isNode(GridPos pos) {
        return nodes.contains(pos);
    }

    boolean isNodeLabel(GridPos pos) {
        return nodeLabels.contains(pos);
    }

    /**
     * Links occupying {@code pos}; must not be modified.
     */
    IntList linksAt(GridPos pos) {
        return links.linksAt(pos);
    }

    LinkOccupancy links() {
        return links;
    }

    boolean inBounds(GridPos pos) {
        return extents != null && extents.contains(pos);
    }

    /**
     * Current search bound; {@code (0,0)..(0,0)} before anything was registered.
     */
    GridExtents extents() {
        if (extents == null) {
            return new GridExtents(GridPos.of(0, 0), GridPos.of(0, 0));
        }
        return extents;
    }

    void setExtents(GridExtents extents) {
        this.extents = extents;
    }

    private void include(GridPos pos) {
        extents = extents == null ? new GridExtents(pos, pos) : extents.include(pos);
    }
}
