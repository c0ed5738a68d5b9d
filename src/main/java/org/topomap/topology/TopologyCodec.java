package org.topomap.topology;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import lombok.experimental.UtilityClass;
import org.topomap.core.grid.GridPos;
import org.topomap.geometry.Polyline;
import org.topomap.geometry.Vec2;

import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * JSON reader and writer for {@link Topology}.
 *
 * <p>A document is an object with {@code "nodes"} and {@code "links"} members. Each member is
 * either an array of objects carrying an {@code "id"}, or an object keyed by id. Array-form
 * links without an id are named {@code from-to}, then {@code from-to-2}, {@code from-to-3}, ...</p>
 *
 * <p>Output always uses the keyed-object form.</p>
 */
@UtilityClass
public class TopologyCodec {
    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    /**
     * Decodes a topology document.
     *
     * @throws TopologyFormatException when the document is malformed.
     */
    public static Topology decode(Reader reader) {
        JsonElement root;
        try {
            root = JsonParser.parseReader(reader);
        } catch (JsonParseException ex) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_MALFORMED_JSON,
                    "cannot parse topology: " + ex.getMessage(),
                    ex
            );
        }
        if (!root.isJsonObject()) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_MALFORMED_JSON,
                    "topology must be a JSON object"
            );
        }
        JsonObject object = root.getAsJsonObject();
        Topology topology = new Topology();
        decodeNodes(object.get("nodes"), topology);
        decodeLinks(object.get("links"), topology);
        return topology;
    }

    /**
     * Decodes a topology document held in a string.
     */
    public static Topology decode(String json) {
        return decode(new StringReader(json));
    }

    /**
     * Encodes a topology, including routes and label directions.
     */
    public static String encode(Topology topology) {
        return GSON.toJson(toJson(topology));
    }

    /**
     * Writes the encoded topology to {@code out}.
     */
    public static void encode(Topology topology, Appendable out) {
        GSON.toJson(toJson(topology), out);
    }

    private static void decodeNodes(JsonElement section, Topology topology) {
        if (section == null || section.isJsonNull()) {
            return;
        }
        if (section.isJsonArray()) {
            for (JsonElement element : section.getAsJsonArray()) {
                JsonObject object = requireObject(element, "node");
                String id = optString(object, "id");
                if (id == null || id.isEmpty()) {
                    throw new TopologyFormatException(
                            TopologyFormatException.REASON_NODE_ID_REQUIRED,
                            "node must have an id"
                    );
                }
                if (topology.containsNode(id)) {
                    throw new TopologyFormatException(
                            TopologyFormatException.REASON_DUPLICATE_NODE,
                            "duplicate node id '" + id + "'"
                    );
                }
                topology.putNode(decodeNode(id, object));
            }
        } else if (section.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : section.getAsJsonObject().entrySet()) {
                topology.putNode(decodeNode(entry.getKey(), requireObject(entry.getValue(), "node")));
            }
        } else {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_SECTION,
                    "\"nodes\" must be an array or object"
            );
        }
    }

    private static void decodeLinks(JsonElement section, Topology topology) {
        if (section == null || section.isJsonNull()) {
            return;
        }
        if (section.isJsonArray()) {
            for (JsonElement element : section.getAsJsonArray()) {
                JsonObject object = requireObject(element, "link");
                String id = optString(object, "id");
                if (id == null || id.isEmpty()) {
                    id = generateLinkId(object, topology);
                } else if (topology.containsLink(id)) {
                    throw new TopologyFormatException(
                            TopologyFormatException.REASON_DUPLICATE_LINK,
                            "duplicate link id '" + id + "'"
                    );
                }
                topology.putLink(decodeLink(id, object));
            }
        } else if (section.isJsonObject()) {
            for (Map.Entry<String, JsonElement> entry : section.getAsJsonObject().entrySet()) {
                topology.putLink(decodeLink(entry.getKey(), requireObject(entry.getValue(), "link")));
            }
        } else {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_SECTION,
                    "\"links\" must be an array or object"
            );
        }
    }

    private static String generateLinkId(JsonObject object, Topology topology) {
        String base = requireEndpoint(object, "from", "?") + "-" + requireEndpoint(object, "to", "?");
        String id = base;
        int n = 2;
        while (topology.containsLink(id)) {
            id = base + "-" + n;
            n++;
        }
        return id;
    }

    private static Node decodeNode(String id, JsonObject object) {
        Node.NodeBuilder builder = Node.builder()
                .id(id)
                .label(optString(object, "label"))
                .labelAt(optString(object, "label_at"))
                .styleClass(optString(object, "class"));

        JsonElement pos = object.get("pos");
        if (pos != null && !pos.isJsonNull()) {
            builder.pos(decodeGridPos(pos, "node " + id + " pos"));
        }
        JsonElement extents = object.get("extents");
        if (extents != null && !extents.isJsonNull()) {
            JsonObject ext = requireObject(extents, "node " + id + " extents");
            builder.extents(new NodeExtents(optFloat(ext, "width"), optFloat(ext, "height")));
        }
        return builder.build();
    }

    private static Link decodeLink(String id, JsonObject object) {
        Link.LinkBuilder builder = Link.builder()
                .id(id)
                .from(requireEndpoint(object, "from", id))
                .to(requireEndpoint(object, "to", id))
                .styleClass(optString(object, "class"));

        JsonElement via = object.get("via");
        if (via != null && !via.isJsonNull()) {
            for (JsonElement element : requireArray(via, "link " + id + " via")) {
                builder.via(decodeGridPos(element, "link " + id + " via"));
            }
        }
        JsonElement route = object.get("route");
        if (route != null && !route.isJsonNull()) {
            List<Vec2> points = new ArrayList<>();
            for (JsonElement element : requireArray(route, "link " + id + " route")) {
                points.add(decodeVec(element, "link " + id + " route"));
            }
            builder.route(Polyline.of(points));
        }
        return builder.build();
    }

    private static JsonObject toJson(Topology topology) {
        JsonObject nodes = new JsonObject();
        for (Node node : topology.nodes()) {
            JsonObject object = new JsonObject();
            if (node.getPos() != null) {
                JsonArray pos = new JsonArray();
                pos.add(node.getPos().x());
                pos.add(node.getPos().y());
                object.add("pos", pos);
            }
            addIfPresent(object, "label", node.getLabel());
            addIfPresent(object, "label_at", node.getLabelAt());
            addIfPresent(object, "class", node.getStyleClass());
            if (node.getExtents() != null) {
                JsonObject extents = new JsonObject();
                extents.addProperty("width", node.getExtents().width());
                extents.addProperty("height", node.getExtents().height());
                object.add("extents", extents);
            }
            nodes.add(node.getId(), object);
        }

        JsonObject links = new JsonObject();
        for (Link link : topology.links()) {
            JsonObject object = new JsonObject();
            object.addProperty("from", link.getFrom());
            object.addProperty("to", link.getTo());
            if (!link.getVias().isEmpty()) {
                JsonArray vias = new JsonArray();
                for (GridPos via : link.getVias()) {
                    JsonArray pair = new JsonArray();
                    pair.add(via.x());
                    pair.add(via.y());
                    vias.add(pair);
                }
                object.add("via", vias);
            }
            addIfPresent(object, "class", link.getStyleClass());
            if (link.isRouted()) {
                JsonArray route = new JsonArray();
                for (Vec2 point : link.getRoute().points()) {
                    JsonArray pair = new JsonArray();
                    pair.add(point.x());
                    pair.add(point.y());
                    route.add(pair);
                }
                object.add("route", route);
            }
            links.add(link.getId(), object);
        }

        JsonObject root = new JsonObject();
        root.add("nodes", nodes);
        root.add("links", links);
        return root;
    }

    private static void addIfPresent(JsonObject object, String key, String value) {
        if (value != null && !value.isEmpty()) {
            object.addProperty(key, value);
        }
    }

    private static GridPos decodeGridPos(JsonElement element, String what) {
        JsonArray pair = requirePair(element, what);
        try {
            return new GridPos(integral(pair.get(0)), integral(pair.get(1)));
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_COORDINATE,
                    what + " must hold two integers",
                    ex
            );
        }
    }

    private static int integral(JsonElement element) {
        double value = element.getAsDouble();
        int truncated = (int) value;
        if (truncated != value) {
            // getAsInt() would silently drop the fraction
            throw new NumberFormatException("not an integer: " + element);
        }
        return truncated;
    }

    private static Vec2 decodeVec(JsonElement element, String what) {
        JsonArray pair = requirePair(element, what);
        try {
            return new Vec2(pair.get(0).getAsFloat(), pair.get(1).getAsFloat());
        } catch (NumberFormatException | UnsupportedOperationException | IllegalStateException ex) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_COORDINATE,
                    what + " must hold two numbers",
                    ex
            );
        }
    }

    private static JsonArray requirePair(JsonElement element, String what) {
        if (!element.isJsonArray() || element.getAsJsonArray().size() != 2) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_COORDINATE,
                    what + " must be a two-element array"
            );
        }
        return element.getAsJsonArray();
    }

    private static JsonArray requireArray(JsonElement element, String what) {
        if (!element.isJsonArray()) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_COORDINATE,
                    what + " must be an array"
            );
        }
        return element.getAsJsonArray();
    }

    private static JsonObject requireObject(JsonElement element, String what) {
        if (element == null || !element.isJsonObject()) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_SECTION,
                    what + " must be a JSON object"
            );
        }
        return element.getAsJsonObject();
    }

    private static String requireEndpoint(JsonObject object, String key, String linkId) {
        String value = optString(object, key);
        if (value == null || value.isEmpty()) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_LINK_ENDPOINT_REQUIRED,
                    "link " + linkId + " must have a \"" + key + "\" node"
            );
        }
        return value;
    }

    private static String optString(JsonObject object, String key) {
        JsonElement element = object.get(key);
        if (element == null || element.isJsonNull()) {
            return null;
        }
        if (!element.isJsonPrimitive()) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_SECTION,
                    "\"" + key + "\" must be a string"
            );
        }
        return element.getAsString();
    }

    private static float optFloat(JsonObject object, String key) {
        JsonElement element = object.get(key);
        if (element == null || element.isJsonNull()) {
            return 0.0f;
        }
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isNumber()) {
            throw new TopologyFormatException(
                    TopologyFormatException.REASON_BAD_COORDINATE,
                    "\"" + key + "\" must be a number"
            );
        }
        return element.getAsFloat();
    }
}
