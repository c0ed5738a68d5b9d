package org.topomap.labels;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of one {@link LabelPlacer#placeLabels()} run.
 */
@Value
@Builder
public class LabelPlacement {
    /** Nodes that received a label direction, in id order. */
    @Singular("placed")
    List<String> placedNodeIds;

    /** Positioned, unlabelled nodes whose eight surrounding cells were all occupied. */
    @Singular("unplaced")
    List<String> unplacedNodeIds;

    /** Nodes skipped because they already had a label direction. */
    int keptCount;
}
