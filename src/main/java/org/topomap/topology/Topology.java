package org.topomap.topology;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Nodes and links of a map keyed by id.
 *
 * <p>Both maps are sorted by id, so every iteration over the topology is in a stable,
 * data-derived order.</p>
 */
public final class Topology {
    private final TreeMap<String, Node> nodes = new TreeMap<>();
    private final TreeMap<String, Link> links = new TreeMap<>();

    /**
     * Adds or replaces a node.
     *
     * @return this topology.
     */
    public Topology putNode(Node node) {
        nodes.put(node.getId(), node);
        return this;
    }

    /**
     * Adds or replaces a link.
     *
     * @return this topology.
     */
    public Topology putLink(Link link) {
        links.put(link.getId(), link);
        return this;
    }

    /**
     * @return the node, or null when unknown.
     */
    public Node getNode(String id) {
        return id == null ? null : nodes.get(id);
    }

    /**
     * @return the link, or null when unknown.
     */
    public Link getLink(String id) {
        return id == null ? null : links.get(id);
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public boolean containsLink(String id) {
        return links.containsKey(id);
    }

    /**
     * Nodes in ascending id order.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(new ArrayList<>(nodes.values()));
    }

    /**
     * Links in ascending id order.
     */
    public List<Link> links() {
        return Collections.unmodifiableList(new ArrayList<>(links.values()));
    }

    /**
     * Read-only id-sorted view of the nodes.
     */
    public Map<String, Node> nodeMap() {
        return Collections.unmodifiableSortedMap(nodes);
    }

    /**
     * Read-only id-sorted view of the links.
     */
    public Map<String, Link> linkMap() {
        return Collections.unmodifiableSortedMap(links);
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int linkCount() {
        return links.size();
    }
}
