package org.topomap.testutil;

import org.topomap.core.grid.GridPos;
import org.topomap.geometry.Polyline;
import org.topomap.geometry.Vec2;
import org.topomap.topology.Link;
import org.topomap.topology.Node;
import org.topomap.topology.NodeExtents;
import org.topomap.topology.Topology;

import java.util.ArrayList;
import java.util.List;

/**
 * Small topologies shared by routing and label tests.
 */
public final class TopologyFixtures {

    private TopologyFixtures() {
    }

    public static Node node(String id, int x, int y) {
        return Node.builder().id(id).pos(GridPos.of(x, y)).label(id).build();
    }

    public static Node node(String id, int x, int y, String labelAt) {
        return Node.builder().id(id).pos(GridPos.of(x, y)).label(id).labelAt(labelAt).build();
    }

    public static Node block(String id, int x, int y, float width, float height) {
        return Node.builder()
                .id(id)
                .pos(GridPos.of(x, y))
                .label(id)
                .labelAt("c")
                .extents(new NodeExtents(width, height))
                .build();
    }

    public static Link link(String id, String from, String to) {
        return Link.builder().id(id).from(from).to(to).build();
    }

    public static Polyline line(int... xy) {
        List<Vec2> points = new ArrayList<>(xy.length / 2);
        for (int i = 0; i + 1 < xy.length; i += 2) {
            points.add(new Vec2(xy[i], xy[i + 1]));
        }
        return Polyline.of(points);
    }

    /**
     * Five labelled nodes with six links between them.
     */
    public static Topology mesh() {
        return new Topology()
                .putNode(node("A", 0, 0, "n"))
                .putNode(node("B", 0, 5, "w"))
                .putNode(node("C", 0, 10, "s"))
                .putNode(node("D", 8, 5, "s"))
                .putNode(node("E", 10, 10, "e"))
                .putLink(link("A-B", "A", "B"))
                .putLink(link("B-C", "B", "C"))
                .putLink(link("A-D", "A", "D"))
                .putLink(link("B-D", "B", "D"))
                .putLink(link("C-D", "C", "D"))
                .putLink(link("D-E", "D", "E"));
    }

    /**
     * Two stacked 3x10 nodes joined by five parallel links.
     */
    public static Topology parallelBlocks() {
        Topology topology = new Topology()
                .putNode(block("A", 0, 0, 3, 10))
                .putNode(block("B", 0, 10, 3, 10));
        for (int i = 1; i <= 5; i++) {
            topology.putLink(link("A-B-" + i, "A", "B"));
        }
        return topology;
    }
}
