package org.topomap.core.grid;

import java.util.Locale;

/**
 * Compass directions on the grid. Y grows southwards, so {@link #N} is {@code (0, -1)}.
 *
 * <p>Declaration order of the eight real directions is clockwise from north and is the
 * enumeration order used by label placement.</p>
 */
public enum Direction {
    NONE(0, 0, ""),
    N(0, -1, "n"),
    NE(1, -1, "ne"),
    E(1, 0, "e"),
    SE(1, 1, "se"),
    S(0, 1, "s"),
    SW(-1, 1, "sw"),
    W(-1, 0, "w"),
    NW(-1, -1, "nw");

    private static final Direction[] COMPASS = {N, NE, E, SE, S, SW, W, NW};

    private final int dx;
    private final int dy;
    private final String code;

    Direction(int dx, int dy, String code) {
        this.dx = dx;
        this.dy = dy;
        this.code = code;
    }

    /**
     * Parses a label direction string.
     *
     * <p>Accepts short codes ({@code "ne"}), names ({@code "northeast"}) and hyphenated names
     * ({@code "north-east"}) in any case. Null, blank and unknown values (including {@code "c"})
     * map to {@link #NONE}.</p>
     */
    public static Direction fromString(String value) {
        if (value == null) {
            return NONE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "n", "north" -> N;
            case "ne", "northeast", "north-east" -> NE;
            case "e", "east" -> E;
            case "se", "southeast", "south-east" -> SE;
            case "s", "south" -> S;
            case "sw", "southwest", "south-west" -> SW;
            case "w", "west" -> W;
            case "nw", "northwest", "north-west" -> NW;
            default -> NONE;
        };
    }

    /**
     * Returns the eight real directions, clockwise from north.
     */
    public static Direction[] compass() {
        return COMPASS.clone();
    }

    public int dx() {
        return dx;
    }

    public int dy() {
        return dy;
    }

    /**
     * Short lowercase code, empty for {@link #NONE}.
     */
    public String code() {
        return code;
    }

    public boolean isCardinal() {
        return this != NONE && (dx == 0 || dy == 0);
    }

    public boolean isDiagonal() {
        return dx != 0 && dy != 0;
    }

    public Direction opposite() {
        return switch (this) {
            case N -> S;
            case NE -> SW;
            case E -> W;
            case SE -> NW;
            case S -> N;
            case SW -> NE;
            case W -> E;
            case NW -> SE;
            case NONE -> NONE;
        };
    }

    /**
     * Returns {@code pos} moved one cell in this direction.
     */
    public GridPos move(GridPos pos) {
        return pos.translate(dx, dy);
    }
}
