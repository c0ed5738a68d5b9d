package org.topomap.routing.core;

/**
 * Deterministic work caps for routing.
 *
 * <p>Both caps are safety valves: a search that reaches {@code searchLimit} expansions gives
 * up on the link, and the fix-point pass stops after {@code fixPointRounds} rounds.</p>
 */
final class SearchBudget {
    static final int DEFAULT_SEARCH_LIMIT = 8192;
    static final int DEFAULT_FIX_POINT_ROUNDS = 32;

    static final String PROP_SEARCH_LIMIT = "topomap.routing.searchLimit";
    static final String PROP_FIX_POINT_ROUNDS = "topomap.routing.fixPointRounds";

    private final int searchLimit;
    private final int fixPointRounds;

    private SearchBudget(int searchLimit, int fixPointRounds) {
        this.searchLimit = normalize(searchLimit, DEFAULT_SEARCH_LIMIT);
        this.fixPointRounds = normalize(fixPointRounds, DEFAULT_FIX_POINT_ROUNDS);
    }

    /**
     * Creates a budget with explicit caps; non-positive values fall back to the defaults.
     */
    static SearchBudget of(int searchLimit, int fixPointRounds) {
        return new SearchBudget(searchLimit, fixPointRounds);
    }

    /**
     * Loads caps from system properties, falling back to the built-in defaults.
     */
    static SearchBudget defaults() {
        return of(
                readBound(PROP_SEARCH_LIMIT, DEFAULT_SEARCH_LIMIT),
                readBound(PROP_FIX_POINT_ROUNDS, DEFAULT_FIX_POINT_ROUNDS)
        );
    }

    int searchLimit() {
        return searchLimit;
    }

    int fixPointRounds() {
        return fixPointRounds;
    }

    /**
     * Returns whether a search that has expanded {@code expanded} states may continue.
     */
    boolean allowsExpansion(int expanded) {
        return expanded < searchLimit;
    }

    private static int normalize(int bound, int fallback) {
        if (bound <= 0) {
            return fallback;
        }
        return bound;
    }

    private static int readBound(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
