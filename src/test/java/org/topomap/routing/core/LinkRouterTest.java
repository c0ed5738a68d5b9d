package org.topomap.routing.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.topomap.core.grid.CellRange;
import org.topomap.core.grid.GridPos;
import org.topomap.geometry.Polyline;
import org.topomap.geometry.Vec2;
import org.topomap.topology.Link;
import org.topomap.topology.Node;
import org.topomap.topology.Topology;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.topomap.testutil.TopologyFixtures.line;
import static org.topomap.testutil.TopologyFixtures.link;
import static org.topomap.testutil.TopologyFixtures.mesh;
import static org.topomap.testutil.TopologyFixtures.node;
import static org.topomap.testutil.TopologyFixtures.parallelBlocks;

@DisplayName("LinkRouter")
class LinkRouterTest {

    private static Map<String, Polyline> routes(Topology topology) {
        Map<String, Polyline> routes = new TreeMap<>();
        for (Link link : topology.links()) {
            routes.put(link.getId(), link.getRoute());
        }
        return routes;
    }

    @Nested
    @DisplayName("1. Routing Passes")
    class PassTests {

        @Test
        @DisplayName("Every link of a mesh is routed between its endpoints")
        void testMesh() {
            Topology topology = mesh();
            RoutingReport report = new LinkRouter(topology).routeLinks();

            assertTrue(report.isComplete(), "Unrouted: " + report.getUnroutedLinkIds());
            assertEquals(List.of("A-B", "A-D", "B-C", "B-D", "C-D", "D-E"), report.getRoutedLinkIds());
            assertTrue(report.getFixPointRounds() >= 1);
            assertTrue(report.getExpandedStates() > 0);

            for (Link link : topology.links()) {
                Polyline route = link.getRoute();
                assertTrue(route.size() >= 2, "Route for " + link.getId() + " is too short: " + route);
                assertEquals(topology.getNode(link.getFrom()).getPos().toVec(), route.first(), link.getId());
                assertEquals(topology.getNode(link.getTo()).getPos().toVec(), route.last(), link.getId());
            }
        }

        @Test
        @DisplayName("A triangle of links routes completely")
        void testTriangle() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 6, 0))
                    .putNode(node("C", 3, 5))
                    .putLink(link("A-B", "A", "B"))
                    .putLink(link("B-C", "B", "C"))
                    .putLink(link("C-A", "C", "A"));
            RoutingReport report = new LinkRouter(topology).routeLinks();

            assertEquals(List.of("A-B", "B-C", "C-A"), report.getRoutedLinkIds());
            for (Link link : topology.links()) {
                List<Vec2> points = link.getRoute().points();
                assertTrue(points.size() >= 2, link.getId());
                for (int i = 1; i < points.size(); i++) {
                    assertNotEquals(points.get(i - 1), points.get(i), link.getId() + " repeats a point");
                }
            }
        }

        @Test
        @DisplayName("Routes never cross another node or a label cell")
        void testRoutesAvoidNodesAndLabels() {
            Topology topology = mesh();
            new LinkRouter(topology).routeLinks();

            for (Link link : topology.links()) {
                List<Vec2> points = link.getRoute().points();
                for (Vec2 point : points.subList(1, points.size() - 1)) {
                    GridPos cell = GridPos.truncate(point);
                    for (Node node : topology.nodes()) {
                        assertNotEquals(node.getPos(), cell, link.getId() + " passes through " + node.getId());
                        assertNotEquals(node.labelDirection().move(node.getPos()), cell,
                                link.getId() + " passes over the label of " + node.getId());
                    }
                }
            }
        }

        @Test
        @DisplayName("Parallel links between multi-cell nodes all connect the footprints")
        void testParallelBlocks() {
            Topology topology = parallelBlocks();
            RoutingReport report = new LinkRouter(topology).routeLinks();

            assertTrue(report.isComplete(), "Unrouted: " + report.getUnroutedLinkIds());
            CellRange from = topology.getNode("A").cellRange();
            CellRange to = topology.getNode("B").cellRange();
            for (Link link : topology.links()) {
                Polyline route = link.getRoute();
                assertTrue(route.size() >= 2, "Route for " + link.getId() + " is too short");
                assertTrue(from.contains(GridPos.truncate(route.first())), link.getId() + " starts outside A");
                assertTrue(to.contains(GridPos.truncate(route.last())), link.getId() + " ends outside B");
            }
        }

        @Test
        @DisplayName("Vias are visited in order")
        void testViaOrder() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 10, 10))
                    .putLink(Link.builder().id("A-B").from("A").to("B")
                            .via(GridPos.of(0, 2))
                            .via(GridPos.of(2, 2))
                            .build());
            new LinkRouter(topology).routeLinks();

            List<Vec2> points = topology.getLink("A-B").getRoute().points();
            int first = points.indexOf(new Vec2(0, 2));
            assertTrue(first >= 0, "First via missing: " + points);
            assertTrue(points.subList(first, points.size()).contains(new Vec2(2, 2)), "Second via must follow the first: " + points);
            assertEquals(new Vec2(10, 10), points.get(points.size() - 1));
        }

        @Test
        @DisplayName("Routing the same topology twice gives identical routes")
        void testDeterminism() {
            Topology first = mesh();
            Topology second = mesh();
            new LinkRouter(first).routeLinks();
            new LinkRouter(second).routeLinks();
            assertEquals(routes(first), routes(second));

            Topology blocksA = parallelBlocks();
            Topology blocksB = parallelBlocks();
            new LinkRouter(blocksA).routeLinks();
            new LinkRouter(blocksB).routeLinks();
            assertEquals(routes(blocksA), routes(blocksB));
        }

        @Test
        @DisplayName("Fix-point pass respects its round cap")
        void testFixPointCap() {
            LinkRouterConfig config = LinkRouterConfig.builder().fixPointRounds(1).build();
            RoutingReport report = new LinkRouter(mesh(), config).routeLinks();
            assertEquals(1, report.getFixPointRounds());
        }
    }

    @Nested
    @DisplayName("2. Skipped Links")
    class SkippedLinkTests {

        @Test
        @DisplayName("Pre-routed links are kept untouched")
        void testPreRoutedKept() {
            Polyline fixed = line(0, 0, 0, 1, 1, 2, 2, 2);
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 2, 2))
                    .putLink(Link.builder().id("fixed").from("A").to("B").route(fixed).build())
                    .putLink(link("free", "A", "B"));

            RoutingReport report = new LinkRouter(topology).routeLinks();

            assertEquals(fixed, topology.getLink("fixed").getRoute());
            assertEquals(List.of("fixed"), report.getKeptLinkIds());
            assertEquals(List.of("free"), report.getRoutedLinkIds());
        }

        @Test
        @DisplayName("Links with missing or unpositioned endpoints stay unrouted")
        void testMissingEndpoint() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 3, 0))
                    .putNode(Node.builder().id("hidden").build())
                    .putLink(link("ok", "A", "B"))
                    .putLink(link("dangling", "A", "Z"))
                    .putLink(link("ghost", "hidden", "B"));

            LinkRouter router = new LinkRouter(topology);
            RoutingReport report = router.routeLinks();

            assertEquals(List.of("ok"), report.getRoutedLinkIds());
            assertEquals(List.of("dangling", "ghost"), report.getUnroutedLinkIds());
            assertFalse(topology.getLink("dangling").isRouted());
            assertFalse(router.findRoute("ghost").reachable());
            assertFalse(router.findRoute("no-such-link").reachable());
        }

        @Test
        @DisplayName("Links added after the router was built stay unrouted")
        void testLinkAddedLater() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 3, 0))
                    .putLink(link("ok", "A", "B"));
            LinkRouter router = new LinkRouter(topology);
            topology.putLink(link("late", "B", "A"));

            RoutingReport report = assertDoesNotThrow(router::routeLinks);

            assertEquals(List.of("ok"), report.getRoutedLinkIds());
            assertEquals(List.of("late"), report.getUnroutedLinkIds());
            assertFalse(topology.getLink("late").isRouted());
            assertFalse(router.findRoute("late").reachable());
        }

        @Test
        @DisplayName("A via outside the extents leaves the link unrouted")
        void testViaOutsideExtents() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 4, 0))
                    .putLink(Link.builder().id("far").from("A").to("B").via(GridPos.of(40, 40)).build());

            LinkRouter router = new LinkRouter(topology);
            assertEquals(GridPos.of(40, 40), router.getExtents().max(), "Via cells grow the automatic extents");

            router.setExtents(5, 2, -1, -2);
            assertEquals(new GridExtents(GridPos.of(-1, -2), GridPos.of(5, 2)), router.getExtents());

            RoutingReport report = router.routeLinks();
            assertEquals(List.of("far"), report.getUnroutedLinkIds());
            assertTrue(report.isConverged());
            assertEquals(0, report.getFixPointRounds());
        }
    }

    @Nested
    @DisplayName("3. Occupancy")
    class OccupancyTests {

        private LinkRouter router() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 3, 0))
                    .putLink(link("L", "A", "B"))
                    .putLink(link("M", "B", "A"));
            return new LinkRouter(topology);
        }

        @Test
        @DisplayName("Endpoint anchors are occupied before routing")
        void testInitialOccupancy() {
            LinkRouter router = router();
            assertEquals(List.of("L", "M"), router.linksAt(GridPos.of(0, 0)));
            assertEquals(List.of(GridPos.of(0, 0), GridPos.of(3, 0)), router.occupiedCells());
        }

        @Test
        @DisplayName("Add is idempotent and remove clears truncated cells")
        void testAddRemove() {
            LinkRouter router = router();
            Polyline path = Polyline.of(new Vec2(5.5f, 5.0f), new Vec2(6.0f, 5.9f));

            router.addRoute("L", path);
            router.addRoute("L", path);
            assertEquals(List.of("L"), router.linksAt(GridPos.of(5, 5)));
            assertEquals(List.of("L"), router.linksAt(GridPos.of(6, 5)));

            router.removeRoute("L", path);
            assertTrue(router.linksAt(GridPos.of(5, 5)).isEmpty());
            assertFalse(router.occupiedCells().contains(GridPos.of(6, 5)));
        }

        @Test
        @DisplayName("Move swaps the cells a link holds")
        void testMove() {
            LinkRouter router = router();
            Polyline before = line(1, 1, 2, 1);
            Polyline after = line(1, -1, 2, -1);

            router.addRoute("M", before);
            router.moveRoute("M", before, after);

            assertTrue(router.linksAt(GridPos.of(1, 1)).isEmpty());
            assertEquals(List.of("M"), router.linksAt(GridPos.of(2, -1)));
        }

        @Test
        @DisplayName("Unknown link ids are rejected")
        void testUnknownLink() {
            LinkRouter router = router();
            assertThrows(RuntimeException.class, () -> router.addRoute("nope", line(0, 0)));
        }

        @Test
        @DisplayName("Routed paths stay registered after routing")
        void testRoutesRegistered() {
            Topology topology = new Topology()
                    .putNode(node("A", 0, 0))
                    .putNode(node("B", 3, 0))
                    .putLink(link("L", "A", "B"));
            LinkRouter router = new LinkRouter(topology);
            router.routeLinks();

            for (Vec2 point : topology.getLink("L").getRoute().points()) {
                assertTrue(router.linksAt(GridPos.truncate(point)).contains("L"), "Cell " + point + " not registered");
            }
        }
    }
}
