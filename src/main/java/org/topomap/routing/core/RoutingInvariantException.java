package org.topomap.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Raised when the route search breaks one of its own invariants.
 *
 * <p>This signals a defect in the search, never bad input: unreachable links are reported
 * as unrouted instead. Callers are not expected to recover.</p>
 */
@Getter
@Accessors(fluent = true)
public final class RoutingInvariantException extends IllegalStateException {
    public static final String REASON_PARENT_CYCLE = "ROUTE_PARENT_CYCLE";
    public static final String REASON_UNTERMINATED_PATH = "ROUTE_UNTERMINATED_PATH";

    private final String reasonCode;

    public RoutingInvariantException(String reasonCode, String message) {
        super("[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] "
                + Objects.requireNonNull(message, "message"));
        this.reasonCode = reasonCode;
    }
}
