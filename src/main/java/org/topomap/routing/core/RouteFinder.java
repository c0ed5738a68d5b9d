package org.topomap.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.objects.Object2FloatOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;
import org.topomap.core.grid.CellRange;
import org.topomap.core.grid.GridPos;
import org.topomap.geometry.Polyline;
import org.topomap.geometry.Vec2;
import org.topomap.routing.search.SearchQueue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-link A* search over the implicit grid graph.
 *
 * <p>States are {@link GridState}s. A moving state has exactly one forward neighbour (the next
 * cell along its heading) plus same-cell turn neighbours; only undirected start states branch
 * into all 4 or 8 directions, cardinal directions first. Vias are visited in order by
 * counting the pending-via index down to zero before the goal test can succeed.</p>
 *
 * <p>Edge costs:</p>
 * <ul>
 * <li>step: 1;</li>
 * <li>turn: 2, or 4 when the previous edge was also a turn, so two spaced 45&deg; turns (4)
 * beat one in-place 90&deg; turn (6);</li>
 * <li>outside the goal: diminishing penalties ({@code 1, 1/2, 1/4, ...}) for other links in the
 * target cell and for links crossed diagonally, plus (when spreading) smaller penalties
 * starting at {@code 1/16} for links beside the target cell, all scaled by the link penalty
 * weight.</li>
 * </ul>
 *
 * <p>The heuristic is the Chebyshev distance to the goal plus the number of pending vias. The
 * via term is not admissible; it steers the search into clearing vias early.</p>
 *
 * <p>One instance serves one search and is not thread-safe. It never writes to the grid.</p>
 */
final class RouteFinder {
    private static final float TURN_COST = 2.0f;
    private static final float REPEATED_TURN_COST = 4.0f;
    private static final float SPREAD_PENALTY_START = 16.0f;
    private static final int PRIORITY_SCALE = 100;

    private final RoutingGrid grid;
    private final LinkRouterConfig config;
    private final SearchBudget budget;
    private final int linkId;
    private final String goalNodeId;
    private final CellRange goalCells;

    private final Object2ObjectOpenHashMap<GridState, GridState> cameFrom = new Object2ObjectOpenHashMap<>();
    private List<GridPos> vias = List.of();
    private GridPos goal;

    /**
     * @param grid shared occupancy, read only.
     * @param config router switches.
     * @param budget expansion cap.
     * @param linkId internal id of the link being routed; its own occupancy is never penalized.
     * @param goalNodeId id of the target node.
     * @param goalCells footprint of a multi-cell target node, or null for a single-cell target.
     */
    RouteFinder(
            RoutingGrid grid,
            LinkRouterConfig config,
            SearchBudget budget,
            int linkId,
            String goalNodeId,
            CellRange goalCells
    ) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.config = Objects.requireNonNull(config, "config");
        this.budget = Objects.requireNonNull(budget, "budget");
        this.linkId = linkId;
        this.goalNodeId = Objects.requireNonNull(goalNodeId, "goalNodeId");
        this.goalCells = goalCells;
    }

    /**
     * Searches for a route.
     *
     * @param startPositions candidate start cells, all at zero cost.
     * @param goal anchor cell of the target node.
     * @param vias cells to pass through, in order.
     * @return the found route, or an unreachable plan when the open set or the budget runs out.
     * @throws RoutingInvariantException if path reconstruction detects a broken parent chain.
     */
    RoutePlan run(List<GridPos> startPositions, GridPos goal, List<GridPos> vias) {
        this.goal = Objects.requireNonNull(goal, "goal");
        this.vias = List.copyOf(vias);
        cameFrom.clear();

        if (startPositions.isEmpty()) {
            return RoutePlan.unreachable(0);
        }

        int expectedSize = (int) startPositions.get(0).chebyshevDistance(goal) * 2;
        Object2FloatOpenHashMap<GridState> weights = new Object2FloatOpenHashMap<>(Math.max(expectedSize, 16));
        SearchQueue<GridState> openSet = new SearchQueue<>(Math.max(expectedSize, 16));

        // every start cell is a zero-cost neighbour of a virtual source
        for (GridPos pos : startPositions) {
            GridState start = GridState.start(pos, this.vias.size());
            openSet.push(start, 0);
            weights.put(start, 0.0f);
        }

        int expanded = 0;
        List<GridState> neighbours = new ArrayList<>(8);
        while (!openSet.isEmpty() && budget.allowsExpansion(expanded)) {
            GridState current = openSet.extractMin();
            float currentWeight = weights.getFloat(current);

            if (isGoal(current)) {
                return buildRoute(current, currentWeight, expanded);
            }

            neighbours.clear();
            collectNeighbours(current, neighbours);
            for (GridState next : neighbours) {
                float newWeight = currentWeight + weight(current, next);
                if (!weights.containsKey(next) || newWeight < weights.getFloat(next)) {
                    cameFrom.put(next, current);
                    weights.put(next, newWeight);

                    float estimate = goalDistance(next.pos()) + next.via();
                    openSet.push(next, (int) ((newWeight + estimate) * PRIORITY_SCALE));
                }
            }
            expanded++;
        }
        return RoutePlan.unreachable(expanded);
    }

    /**
     * A state is terminal once no vias are pending and it stands on the goal cell or any cell
     * of the goal node. Direction is ignored, so up to eight goal states exist per cell.
     */
    private boolean isGoal(GridState state) {
        return state.via() == 0
                && (state.pos().equals(goal) || goalNodeId.equals(grid.nodeAt(state.pos())));
    }

    private boolean isGoalCell(GridPos pos) {
        return pos.equals(goal) || goalNodeId.equals(grid.nodeAt(pos));
    }

    /**
     * Collects the admissible neighbours of {@code state} into {@code out}.
     */
    void collectNeighbours(GridState state, List<GridState> out) {
        if (state.hasDirection()) {
            offer(state, state.advance(), out);
            collectTurns(state, out);
            return;
        }

        // Cardinal departures first: among equal priorities they are pushed earlier,
        // which favours leaving a node along an axis.
        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                if ((dx == 0) == (dy == 0)) {
                    continue;
                }
                offer(state, state.step(dx, dy), out);
            }
        }
        if (!config.isOrthogonal()) {
            for (int dx = -1; dx <= 1; dx += 2) {
                for (int dy = -1; dy <= 1; dy += 2) {
                    offer(state, state.step(dx, dy), out);
                }
            }
        }
    }

    private void collectTurns(GridState state, List<GridState> out) {
        int dirX = state.dirX();
        int dirY = state.dirY();
        if (config.isOrthogonal()) {
            // the two 90 degree turns
            if (dirX == 0) {
                offer(state, state.heading(dirY, 0), out);
                offer(state, state.heading(-dirY, 0), out);
            } else {
                offer(state, state.heading(0, dirX), out);
                offer(state, state.heading(0, -dirX), out);
            }
            return;
        }

        // the two 45 degree turns either side of the heading
        if (dirX == 0) {
            offer(state, state.heading(1, dirY), out);
            offer(state, state.heading(-1, dirY), out);
        } else if (dirY != 0) {
            offer(state, state.heading(0, dirY), out);
        }
        if (dirY == 0) {
            offer(state, state.heading(dirX, 1), out);
            offer(state, state.heading(dirX, -1), out);
        } else if (dirX != 0) {
            offer(state, state.heading(dirX, 0), out);
        }
    }

    /**
     * Applies pruning and via bookkeeping to a raw neighbour.
     */
    private void offer(GridState from, GridState candidate, List<GridState> out) {
        if (candidate.equals(from)) {
            return;
        }
        GridState previous = cameFrom.get(from);
        if (candidate.equals(previous)) {
            return;
        }

        GridPos nextVia = pendingVia(from.via());
        if (nextVia != null && candidate.pos().equals(nextVia)) {
            candidate = candidate.withVia(candidate.via() - 1);
        }

        GridPos pos = candidate.pos();
        if (isGoalCell(pos)) {
            if (goalCells != null && config.isAttachMultiCellsCardinal() && !candidate.isCardinal()) {
                return;
            }
            out.add(candidate);
            return;
        }

        boolean blockedByNode = config.isAvoidNodes() && grid.isNode(pos);
        if (grid.inBounds(pos) && !blockedByNode && !grid.isNodeLabel(pos)) {
            out.add(candidate);
        }
    }

    /**
     * Via cell still to be reached when {@code pending} vias remain, or null when none.
     */
    private GridPos pendingVia(int pending) {
        if (pending == 0 || pending > vias.size()) {
            return null;
        }
        return vias.get(vias.size() - pending);
    }

    /**
     * Cost of the edge from {@code fromState} to {@code toState}.
     */
    float weight(GridState fromState, GridState toState) {
        GridPos from = fromState.pos();
        GridPos to = toState.pos();

        float distance = from.chebyshevDistance(to);
        float linkPenalty = 0.0f;

        if (from.equals(to)) {
            distance = TURN_COST;
            GridState previous = cameFrom.get(fromState);
            if (previous != null && previous.pos().equals(from)) {
                distance = REPEATED_TURN_COST;
            }
        } else if (!isGoalCell(to)) {
            // diminishing penalty for links already in the target cell
            float n = 1.0f;
            IntList links = grid.linksAt(to);
            for (int i = 0; i < links.size(); i++) {
                if (links.getInt(i) != linkId) {
                    linkPenalty += 1.0f / n;
                    n *= 2.0f;
                }
            }

            // A diagonal step crosses any link present in both cells beside the step,
            // even when neither endpoint cell is occupied.
            if (fromState.isDiagonal()) {
                IntList side1 = grid.linksAt(from.translate(fromState.dirX(), 0));
                IntList side2 = grid.linksAt(from.translate(0, fromState.dirY()));
                for (int i = 0; i < side1.size(); i++) {
                    int other = side1.getInt(i);
                    if (other != linkId && side2.contains(other)) {
                        linkPenalty += 1.0f / n;
                        n *= 2.0f;
                    }
                }
            }

            if (config.isSpreadLinks()) {
                linkPenalty += spreadPenalty(toState);
            }
        }

        return distance + linkPenalty * config.getLinkPenaltyWeight();
    }

    /**
     * Penalty for links in the cells ahead-left and ahead-right of the target cell, relative
     * to the heading, so links leaving or entering a node spread out radially.
     */
    private float spreadPenalty(GridState toState) {
        GridPos to = toState.pos();
        int dirX = toState.dirX();
        int dirY = toState.dirY();
        float penalty = 0.0f;

        if (dirX == 0) {
            penalty += adjacentPenalty(to.translate(1, dirY));
            penalty += adjacentPenalty(to.translate(-1, dirY));
        } else if (dirY != 0) {
            penalty += adjacentPenalty(to.translate(0, dirY));
        }
        if (dirY == 0) {
            penalty += adjacentPenalty(to.translate(dirX, 1));
            penalty += adjacentPenalty(to.translate(dirX, -1));
        } else if (dirX != 0) {
            penalty += adjacentPenalty(to.translate(dirX, 0));
        }
        return penalty;
    }

    private float adjacentPenalty(GridPos pos) {
        float penalty = 0.0f;
        float n = SPREAD_PENALTY_START;
        IntList links = grid.linksAt(pos);
        for (int i = 0; i < links.size(); i++) {
            if (links.getInt(i) != linkId) {
                penalty += 1.0f / n;
                n *= 2.0f;
            }
        }
        return penalty;
    }

    /**
     * Chebyshev distance to the goal cell, or to the nearest cell of a multi-cell goal.
     */
    float goalDistance(GridPos from) {
        if (goalCells != null) {
            return goalCells.chebyshevDistance(from);
        }
        return from.chebyshevDistance(goal);
    }

    /**
     * Follows parent links back from {@code terminal} and returns the start-to-goal route.
     */
    private RoutePlan buildRoute(GridState terminal, float weight, int expanded) {
        List<GridPos> reversed = new ArrayList<>();
        reversed.add(terminal.pos());

        GridState cursor = cameFrom.get(terminal);
        if (cursor == null) {
            // goal reached without moving, e.g. a link from a node to itself
            return RoutePlan.unreachable(expanded);
        }

        int maxSteps = cameFrom.size() + 1;
        int steps = 0;
        while (steps < maxSteps && cursor != null) {
            reversed.add(cursor.pos());
            GridState parent = cameFrom.get(cursor);
            if (cursor.equals(parent)) {
                throw new RoutingInvariantException(
                        RoutingInvariantException.REASON_PARENT_CYCLE,
                        "state at " + cursor.pos() + " is its own parent"
                );
            }
            cursor = parent;
            steps++;
        }
        if (cursor != null) {
            throw new RoutingInvariantException(
                    RoutingInvariantException.REASON_UNTERMINATED_PATH,
                    "parent chain longer than " + maxSteps + " states"
            );
        }

        List<Vec2> points = new ArrayList<>(reversed.size());
        for (int i = reversed.size() - 1; i >= 0; i--) {
            points.add(reversed.get(i).toVec());
        }
        return new RoutePlan(true, Polyline.of(points).fix(), weight, expanded);
    }
}
