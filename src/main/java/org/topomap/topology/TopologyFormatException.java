package org.topomap.topology;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when a topology document cannot be decoded.
 *
 * <p>Messages are prefixed with the reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public final class TopologyFormatException extends RuntimeException {
    public static final String REASON_MALFORMED_JSON = "TOPOLOGY_MALFORMED_JSON";
    public static final String REASON_BAD_SECTION = "TOPOLOGY_BAD_SECTION";
    public static final String REASON_NODE_ID_REQUIRED = "TOPOLOGY_NODE_ID_REQUIRED";
    public static final String REASON_DUPLICATE_NODE = "TOPOLOGY_DUPLICATE_NODE";
    public static final String REASON_DUPLICATE_LINK = "TOPOLOGY_DUPLICATE_LINK";
    public static final String REASON_LINK_ENDPOINT_REQUIRED = "TOPOLOGY_LINK_ENDPOINT_REQUIRED";
    public static final String REASON_BAD_COORDINATE = "TOPOLOGY_BAD_COORDINATE";

    private final String reasonCode;

    public TopologyFormatException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = reasonCode;
    }

    public TopologyFormatException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = reasonCode;
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + Objects.requireNonNull(reasonCode, "reasonCode") + "] "
                + Objects.requireNonNull(message, "message");
    }
}
