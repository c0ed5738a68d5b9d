package org.topomap.routing.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.extern.log4j.Log4j2;
import org.topomap.core.grid.CellRange;
import org.topomap.core.grid.GridPos;
import org.topomap.core.id.IDMapper;
import org.topomap.geometry.Polyline;
import org.topomap.geometry.Vec2;
import org.topomap.topology.Link;
import org.topomap.topology.Node;
import org.topomap.topology.Topology;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Routes every link of a topology through a shared grid.
 *
 * <p>The router owns the occupancy grid built from the topology at construction and is the
 * only component that mutates it. Routing runs in three passes:</p>
 * <ol>
 * <li><strong>Independent:</strong> each unrouted link, in id order, is routed against the
 * occupancy present so far and registered immediately.</li>
 * <li><strong>Aware:</strong> links are re-routed cheapest-first, each new route replacing the
 * old one in the grid before the next link is searched.</li>
 * <li><strong>Fix-point:</strong> links are re-routed in ascending length/weight order and a new
 * route is accepted only when strictly cheaper, until a round changes nothing or the round
 * cap is hit.</li>
 * </ol>
 *
 * <p>Links whose endpoints are unknown or unpositioned, and links no route can be found for,
 * keep an empty route. Links that arrive with a route are never re-routed.</p>
 *
 * <p>This class is NOT thread-safe.</p>
 */
@Log4j2
public final class LinkRouter {
    private final Topology topology;
    private final LinkRouterConfig config;
    private final SearchBudget budget;
    private final IDMapper linkIds;
    private final RoutingGrid grid = new RoutingGrid();

    private long expandedStates;

    /**
     * Creates a router with the default configuration.
     */
    public LinkRouter(Topology topology) {
        this(topology, LinkRouterConfig.defaults());
    }

    /**
     * Creates a router and builds its occupancy grid from the current topology.
     *
     * <p>Links added to the topology afterwards are not routed by this instance; they are
     * reported as unrouted.</p>
     *
     * @param topology topology to route; routes are written back onto its links.
     * @param config routing switches.
     */
    public LinkRouter(Topology topology, LinkRouterConfig config) {
        this.topology = Objects.requireNonNull(topology, "topology");
        this.config = Objects.requireNonNull(config, "config");
        this.budget = config.budget();
        this.linkIds = IDMapper.sorted(topology.linkMap().keySet());

        for (Node node : topology.nodes()) {
            if (node.hasPosition()) {
                grid.addNode(node);
            }
        }

        for (Link link : topology.links()) {
            int id = linkIds.toInternal(link.getId());
            if (link.isRouted()) {
                registerPath(id, link.getRoute());
                continue;
            }
            // Occupying the via and endpoint cells up front nudges other links away from them
            // during the first pass.
            for (GridPos via : link.getVias()) {
                grid.addLink(via, id);
            }
            Node from = topology.getNode(link.getFrom());
            if (from != null && from.hasPosition()) {
                grid.addLink(from.getPos(), id);
            }
            Node to = topology.getNode(link.getTo());
            if (to != null && to.hasPosition()) {
                grid.addLink(to.getPos(), id);
            }
        }
    }

    public LinkRouterConfig getConfig() {
        return config;
    }

    /**
     * Overrides the search bounds. Corners may be given in any order.
     *
     * <p>Bounds that exclude a node or via make links touching it unroutable.</p>
     */
    public void setExtents(int minX, int minY, int maxX, int maxY) {
        grid.setExtents(GridExtents.spanning(GridPos.of(minX, minY), GridPos.of(maxX, maxY)));
    }

    /**
     * Current search bounds, derived from nodes, labels and occupied cells unless overridden.
     */
    public GridExtents getExtents() {
        return grid.extents();
    }

    /**
     * Routes all links that do not have a route yet and writes the routes onto the topology.
     *
     * @return summary of the run.
     * @throws RoutingInvariantException if the search breaks an internal invariant.
     */
    public RoutingReport routeLinks() {
        expandedStates = 0L;
        RoutingReport.RoutingReportBuilder report = RoutingReport.builder();
        Set<String> kept = new HashSet<>();

        // Pass 1: independent routes, registered as soon as they are found.
        List<LinkRoute> initial = new ArrayList<>();
        for (Link link : topology.links()) {
            if (link.isRouted()) {
                kept.add(link.getId());
                report.keptLink(link.getId());
                continue;
            }
            LinkRoute route = routeLink(link.getId());
            if (route == null) {
                continue;
            }
            registerPath(linkIds.toInternal(route.linkId()), route.path());
            link.setRoute(route.path());
            initial.add(route);
        }
        log.debug("independent pass routed {} of {} links", initial.size(), topology.linkCount());

        // Pass 2: cheapest links claim cells first.
        initial.sort(Comparator.comparingDouble(LinkRoute::weight));
        List<LinkRoute> current = new ArrayList<>(initial.size());
        for (LinkRoute previous : initial) {
            LinkRoute route = routeLink(previous.linkId());
            if (route == null) {
                continue;
            }
            moveRoute(route.linkId(), previous.path(), route.path());
            topology.getLink(route.linkId()).setRoute(route.path());
            current.add(route);
        }
        log.debug("aware pass re-routed {} links", current.size());

        // Pass 3: short links have the fewest alternatives, so they improve first.
        current.sort(Comparator.comparingDouble(LinkRoute::lengthToWeight));
        int rounds = 0;
        boolean converged = current.isEmpty();
        while (!converged && rounds < budget.fixPointRounds()) {
            rounds++;
            boolean updated = false;
            for (int i = 0; i < current.size(); i++) {
                LinkRoute recorded = current.get(i);
                LinkRoute route = routeLink(recorded.linkId());
                if (route != null && route.weight() < recorded.weight()) {
                    moveRoute(route.linkId(), recorded.path(), route.path());
                    topology.getLink(route.linkId()).setRoute(route.path());
                    current.set(i, route);
                    updated = true;
                }
            }
            converged = !updated;
        }
        if (!converged) {
            log.warn("fix-point pass stopped after {} rounds without converging", rounds);
        }

        for (Link link : topology.links()) {
            if (kept.contains(link.getId())) {
                continue;
            }
            if (link.isRouted()) {
                report.routedLink(link.getId());
            } else {
                report.unroutedLink(link.getId());
                log.warn("no route for link {} ({} -> {})", link.getId(), link.getFrom(), link.getTo());
            }
        }

        RoutingReport result = report
                .fixPointRounds(rounds)
                .converged(converged)
                .expandedStates(expandedStates)
                .build();
        log.info("routed {} links, {} unrouted, {} kept, {} fix-point rounds, {} states expanded",
                result.getRoutedLinkIds().size(),
                result.getUnroutedLinkIds().size(),
                result.getKeptLinkIds().size(),
                rounds,
                expandedStates);
        return result;
    }

    /**
     * Searches a route for one link against the current occupancy without changing anything.
     *
     * @return the search outcome; unreachable when the link or its endpoints are unusable.
     */
    public RoutePlan findRoute(String linkId) {
        Link link = topology.getLink(linkId);
        if (link == null) {
            return RoutePlan.unreachable(0);
        }
        if (!linkIds.containsExternal(linkId)) {
            log.debug("skipping link {}: added after the router was built", linkId);
            return RoutePlan.unreachable(0);
        }
        Node start = topology.getNode(link.getFrom());
        Node goal = topology.getNode(link.getTo());
        if (start == null || !start.hasPosition() || goal == null || !goal.hasPosition()) {
            log.debug("skipping link {}: endpoint missing or unpositioned", linkId);
            return RoutePlan.unreachable(0);
        }

        CellRange goalCells = goal.isMultiCell() ? goal.cellRange() : null;
        RouteFinder finder = new RouteFinder(
                grid,
                config,
                budget,
                linkIds.toInternal(linkId),
                goal.getId(),
                goalCells
        );
        RoutePlan plan = finder.run(start.startCells(), goal.getPos(), link.getVias());
        expandedStates += plan.expandedStates();
        if (log.isDebugEnabled()) {
            log.debug("link {}: reachable={} weight={} expanded={}",
                    linkId, plan.reachable(), plan.weight(), plan.expandedStates());
        }
        return plan;
    }

    /**
     * Marks every cell of {@code path} as occupied by the link.
     */
    public void addRoute(String linkId, Polyline path) {
        registerPath(linkIds.toInternal(linkId), path);
    }

    /**
     * Releases every cell of {@code path} held by the link.
     */
    public void removeRoute(String linkId, Polyline path) {
        int id = linkIds.toInternal(linkId);
        for (Vec2 point : path.points()) {
            grid.removeLink(GridPos.truncate(point), id);
        }
    }

    /**
     * Replaces the link's occupancy along {@code oldPath} with {@code newPath}.
     */
    public void moveRoute(String linkId, Polyline oldPath, Polyline newPath) {
        removeRoute(linkId, oldPath);
        addRoute(linkId, newPath);
    }

    /**
     * Ids of the links occupying a cell, in registration order.
     */
    public List<String> linksAt(GridPos pos) {
        IntList links = grid.linksAt(pos);
        List<String> ids = new ArrayList<>(links.size());
        for (int i = 0; i < links.size(); i++) {
            ids.add(linkIds.toExternal(links.getInt(i)));
        }
        return ids;
    }

    /**
     * Cells occupied by at least one link, in ascending order.
     */
    public List<GridPos> occupiedCells() {
        return grid.links().occupiedCells();
    }

    private LinkRoute routeLink(String linkId) {
        RoutePlan plan = findRoute(linkId);
        if (!plan.reachable()) {
            return null;
        }
        return new LinkRoute(linkId, plan.path(), plan.weight());
    }

    private void registerPath(int id, Polyline path) {
        for (Vec2 point : path.points()) {
            grid.addLink(GridPos.truncate(point), id);
        }
    }
}
