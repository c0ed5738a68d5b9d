package org.topomap.topology;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import org.topomap.core.grid.GridPos;
import org.topomap.geometry.Polyline;

import java.util.List;
import java.util.Objects;

/**
 * A link between two nodes.
 *
 * <p>The route is the only mutable field. An empty route means "not routed"; a non-empty
 * route supplied up front is kept as is by the router.</p>
 */
@Getter
public final class Link {
    /** Unique link id. */
    private final String id;
    /** Source node id. */
    private final String from;
    /** Target node id. */
    private final String to;
    /** Cells the route must pass through, in order. */
    private final List<GridPos> vias;
    /** Style class handed to the renderer. */
    private final String styleClass;
    /** Routed path in grid coordinates; never null. */
    private Polyline route;

    @Builder(toBuilder = true)
    private Link(String id, String from, String to, @Singular("via") List<GridPos> vias, String styleClass, Polyline route) {
        this.id = Objects.requireNonNull(id, "id");
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.vias = vias == null ? List.of() : List.copyOf(vias);
        this.styleClass = styleClass;
        this.route = route == null ? Polyline.empty() : route;
    }

    public void setRoute(Polyline route) {
        this.route = route == null ? Polyline.empty() : route;
    }

    public boolean isRouted() {
        return !route.isEmpty();
    }

    @Override
    public String toString() {
        return "Link{" + id + ": " + from + " -> " + to + ", " + route.size() + " points}";
    }
}
