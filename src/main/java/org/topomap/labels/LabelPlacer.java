package org.topomap.labels;

import lombok.extern.log4j.Log4j2;
import org.topomap.core.grid.Direction;
import org.topomap.core.grid.GridPos;
import org.topomap.core.grid.SparseGrid;
import org.topomap.geometry.Vec2;
import org.topomap.topology.Link;
import org.topomap.topology.Node;
import org.topomap.topology.Topology;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Chooses a label direction for every positioned node that has none.
 *
 * <p>Run after routing: routed links occupy cells a label must not cover. Each candidate cell
 * around a node is scored as</p>
 * <pre>
 *   dirCost + sum(dirCost / d^2 over other positioned nodes) + adjacency penalties
 * </pre>
 * <p>where {@code dirCost} is {@value #CARDINAL_COST} for N/E/S/W and {@value #DIAGONAL_COST}
 * for diagonals, and each occupied neighbour of the candidate adds {@value #SIDE_PENALTY} when it
 * lies east or west of it (where label text runs) and {@value #OTHER_PENALTY} otherwise. The
 * neighbour pointing back at the node itself is not counted. The lowest score wins; ties keep
 * the earlier direction in clockwise order from north.</p>
 *
 * <p>Nodes are processed in id order and each chosen cell is marked occupied before the next
 * node is placed.</p>
 */
@Log4j2
public final class LabelPlacer {
    static final float CARDINAL_COST = 50.0f;
    static final float DIAGONAL_COST = 100.0f;
    static final float SIDE_PENALTY = 50.0f;
    static final float OTHER_PENALTY = 5.0f;

    private final SparseGrid<Boolean> occupied = new SparseGrid<>();
    private final List<Node> positioned = new ArrayList<>();

    /**
     * Captures the occupancy of the topology as it is now.
     */
    public LabelPlacer(Topology topology) {
        Objects.requireNonNull(topology, "topology");

        for (Node node : topology.nodes()) {
            if (!node.hasPosition()) {
                continue;
            }
            positioned.add(node);
            GridPos pos = node.getPos();
            // only the anchor: labels of multi-cell nodes are drawn relative to the footprint
            occupied.set(pos, Boolean.TRUE);
            Direction labelDirection = node.labelDirection();
            if (labelDirection != Direction.NONE) {
                occupied.set(labelDirection.move(pos), Boolean.TRUE);
            }
        }

        for (Link link : topology.links()) {
            for (Vec2 point : link.getRoute().points()) {
                occupied.set(GridPos.truncate(point), Boolean.TRUE);
            }
        }
    }

    /**
     * Places labels and writes the chosen direction codes onto the nodes.
     *
     * @return which nodes were labelled.
     */
    public LabelPlacement placeLabels() {
        LabelPlacement.LabelPlacementBuilder result = LabelPlacement.builder();
        int kept = 0;

        for (Node node : positioned) {
            if (node.hasLabelAt()) {
                kept++;
                continue;
            }

            Direction best = bestDirection(node);
            if (best == Direction.NONE) {
                log.debug("no free cell around node {}", node.getId());
                result.unplaced(node.getId());
                continue;
            }
            node.setLabelAt(best.code());
            occupied.set(best.move(node.getPos()), Boolean.TRUE);
            result.placed(node.getId());
        }

        LabelPlacement placement = result.keptCount(kept).build();
        log.info("placed {} labels, {} without room, {} kept",
                placement.getPlacedNodeIds().size(),
                placement.getUnplacedNodeIds().size(),
                kept);
        return placement;
    }

    /**
     * Lowest-scoring free direction around {@code node}, or {@link Direction#NONE} when every
     * surrounding cell is taken.
     */
    Direction bestDirection(Node node) {
        GridPos pos = node.getPos();
        Direction best = Direction.NONE;
        float bestScore = 0.0f;
        for (Direction direction : Direction.compass()) {
            GridPos candidate = direction.move(pos);
            if (occupied.contains(candidate)) {
                continue;
            }
            float score = score(candidate, direction, node.getId());
            if (best == Direction.NONE || score < bestScore) {
                best = direction;
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * Score of putting the label of node {@code nodeId} at {@code candidate}; lower is better.
     */
    float score(GridPos candidate, Direction direction, String nodeId) {
        float dirCost = direction.isCardinal() ? CARDINAL_COST : DIAGONAL_COST;
        float score = dirCost;

        Vec2 at = candidate.toVec();
        for (Node other : positioned) {
            if (other.getId().equals(nodeId)) {
                continue;
            }
            float distance = at.sub(other.getPos().toVec()).length();
            score += dirCost / (distance * distance);
        }

        Direction back = direction.opposite();
        for (Direction around : Direction.compass()) {
            if (around == back || !occupied.contains(around.move(candidate))) {
                continue;
            }
            score += (around == Direction.E || around == Direction.W) ? SIDE_PENALTY : OTHER_PENALTY;
        }
        return score;
    }

    boolean isOccupied(GridPos pos) {
        return occupied.contains(pos);
    }
}
