package org.topomap.routing.core;

import lombok.Builder;
import lombok.Value;

/**
 * Tuning switches for {@link LinkRouter}.
 */
@Value
@Builder(toBuilder = true)
public class LinkRouterConfig {
    /** Default multiplier applied to occupancy, crossing and spread penalties. */
    public static final float DEFAULT_LINK_PENALTY_WEIGHT = 10.0f;

    /**
     * Treat cells of nodes other than the goal as impassable.
     */
    @Builder.Default
    boolean avoidNodes = true;

    /**
     * Only accept axis-aligned arrivals at multi-cell goal nodes.
     */
    @Builder.Default
    boolean attachMultiCellsCardinal = true;

    /**
     * Penalize cells beside other links so parallel links fan out.
     */
    @Builder.Default
    boolean spreadLinks = true;

    /**
     * Disable diagonal moves.
     */
    @Builder.Default
    boolean orthogonal = false;

    /**
     * Multiplier for link penalties; higher values make routes detour further to avoid other links.
     */
    @Builder.Default
    float linkPenaltyWeight = DEFAULT_LINK_PENALTY_WEIGHT;

    /**
     * Maximum states one search may expand; non-positive means the system-property default.
     */
    @Builder.Default
    int searchLimit = 0;

    /**
     * Maximum fix-point rounds; non-positive means the system-property default.
     */
    @Builder.Default
    int fixPointRounds = 0;

    /**
     * Returns the default configuration.
     */
    public static LinkRouterConfig defaults() {
        return LinkRouterConfig.builder().build();
    }

    /**
     * Resolves the effective work caps.
     */
    SearchBudget budget() {
        SearchBudget defaults = SearchBudget.defaults();
        return SearchBudget.of(
                searchLimit > 0 ? searchLimit : defaults.searchLimit(),
                fixPointRounds > 0 ? fixPointRounds : defaults.fixPointRounds()
        );
    }
}
