package org.topomap.topology;

import lombok.Builder;
import lombok.Getter;
import org.topomap.core.grid.CellRange;
import org.topomap.core.grid.Direction;
import org.topomap.core.grid.GridPos;
import org.topomap.geometry.Vec2;

import java.util.List;
import java.util.Objects;

/**
 * A node of the map.
 *
 * <p>Position, label text, extents and class are fixed at construction. The label direction
 * is the one field written back by label placement.</p>
 */
@Getter
public final class Node {
    /** Unique node id. */
    private final String id;
    /** Grid position; null for nodes that are not drawn. */
    private final GridPos pos;
    /** Display label; null means the id is shown. */
    private final String label;
    /** Rectangle size for multi-cell nodes; null for point nodes. */
    private final NodeExtents extents;
    /** Style class handed to the renderer. */
    private final String styleClass;
    /** Label direction code ({@code n}, {@code ne}, ... or {@code c}); null when unplaced. */
    private String labelAt;

    @Builder(toBuilder = true)
    private Node(String id, GridPos pos, String label, NodeExtents extents, String styleClass, String labelAt) {
        this.id = Objects.requireNonNull(id, "id");
        this.pos = pos;
        this.label = label;
        this.extents = extents;
        this.styleClass = styleClass;
        this.labelAt = labelAt;
    }

    public void setLabelAt(String labelAt) {
        this.labelAt = labelAt;
    }

    public boolean hasPosition() {
        return pos != null;
    }

    /**
     * Returns whether a label direction has already been chosen.
     */
    public boolean hasLabelAt() {
        return labelAt != null && !labelAt.isEmpty();
    }

    /**
     * Parsed label direction; {@link Direction#NONE} when unset or centered.
     */
    public Direction labelDirection() {
        return Direction.fromString(labelAt);
    }

    /**
     * A node is multi-cell when it is positioned and its extents cover more than one cell.
     */
    public boolean isMultiCell() {
        return pos != null
                && extents != null
                && extents.width() > 0.0f
                && extents.height() > 0.0f
                && (extents.width() > 1.0f || extents.height() > 1.0f);
    }

    /**
     * Continuous top-left corner of the node rectangle.
     *
     * @throws IllegalStateException if the node has no position.
     */
    public Vec2 boundsMin() {
        Vec2 center = requirePos().toVec();
        if (!isMultiCell()) {
            return center;
        }
        return center.sub(new Vec2(extents.width() / 2.0f, extents.height() / 2.0f));
    }

    /**
     * Continuous bottom-right corner of the node rectangle.
     *
     * @throws IllegalStateException if the node has no position.
     */
    public Vec2 boundsMax() {
        Vec2 center = requirePos().toVec();
        if (!isMultiCell()) {
            return center;
        }
        return center.add(new Vec2(extents.width() / 2.0f, extents.height() / 2.0f));
    }

    /**
     * Cells covered by the node: the rounded-up rectangle for multi-cell nodes, the single
     * position cell otherwise.
     *
     * @throws IllegalStateException if the node has no position.
     */
    public CellRange cellRange() {
        GridPos anchor = requirePos();
        if (!isMultiCell()) {
            return new CellRange(anchor, anchor.translate(1, 1));
        }
        Vec2 min = boundsMin();
        Vec2 max = boundsMax();
        return new CellRange(
                new GridPos((int) Math.ceil(min.x()), (int) Math.ceil(min.y())),
                new GridPos((int) Math.ceil(max.x()), (int) Math.ceil(max.y()))
        );
    }

    /**
     * Cells a route leaving this node may start from.
     */
    public List<GridPos> startCells() {
        if (!isMultiCell()) {
            return List.of(requirePos());
        }
        return cellRange().boundary();
    }

    private GridPos requirePos() {
        if (pos == null) {
            throw new IllegalStateException("node " + id + " has no position");
        }
        return pos;
    }

    @Override
    public String toString() {
        return "Node{" + id + " @ " + pos + (labelAt == null ? "" : ", label " + labelAt) + '}';
    }
}
