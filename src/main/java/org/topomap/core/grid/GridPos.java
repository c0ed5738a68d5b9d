package org.topomap.core.grid;

import org.topomap.geometry.Vec2;

/**
 * Integer cell coordinate of the routing grid.
 *
 * <p>Y grows southwards. Positions order by {@code x} first, then {@code y}.</p>
 *
 * @param x column.
 * @param y row.
 */
public record GridPos(int x, int y) implements Comparable<GridPos> {

    /**
     * Creates a grid position.
     */
    public static GridPos of(int x, int y) {
        return new GridPos(x, y);
    }

    /**
     * Returns the cell containing a continuous point, truncating each component toward zero.
     */
    public static GridPos truncate(Vec2 point) {
        return new GridPos((int) point.x(), (int) point.y());
    }

    /**
     * Decodes a position previously encoded with {@link #pack()}.
     */
    public static GridPos unpack(long key) {
        return new GridPos((int) (key >> 32), (int) key);
    }

    /**
     * Encodes the position into one primitive key for packed hash maps.
     */
    public long pack() {
        return ((long) x << 32) | (y & 0xFFFF_FFFFL);
    }

    /**
     * Returns the position moved by {@code (dx, dy)}.
     */
    public GridPos translate(int dx, int dy) {
        return new GridPos(x + dx, y + dy);
    }

    /**
     * Component-wise minimum.
     */
    public GridPos min(GridPos other) {
        return new GridPos(Math.min(x, other.x), Math.min(y, other.y));
    }

    /**
     * Component-wise maximum.
     */
    public GridPos max(GridPos other) {
        return new GridPos(Math.max(x, other.x), Math.max(y, other.y));
    }

    /**
     * Returns the Chebyshev distance {@code max(|dx|, |dy|)} to another position.
     */
    public float chebyshevDistance(GridPos other) {
        int dx = Math.abs(x - other.x);
        int dy = Math.abs(y - other.y);
        return Math.max(dx, dy);
    }

    /**
     * Returns the continuous point at this cell.
     */
    public Vec2 toVec() {
        return new Vec2(x, y);
    }

    @Override
    public int compareTo(GridPos other) {
        int byX = Integer.compare(x, other.x);
        if (byX != 0) {
            return byX;
        }
        return Integer.compare(y, other.y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
