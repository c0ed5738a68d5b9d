package org.topomap.core.grid;

import java.util.ArrayList;
import java.util.List;

/**
 * Rectangle of grid cells, {@code min} inclusive and {@code maxExclusive} exclusive.
 *
 * @param min first cell corner.
 * @param maxExclusive one past the last cell on both axes.
 */
public record CellRange(GridPos min, GridPos maxExclusive) {

    public CellRange {
        if (maxExclusive.x() <= min.x() || maxExclusive.y() <= min.y()) {
            throw new IllegalArgumentException("empty cell range " + min + ".." + maxExclusive);
        }
    }

    public int width() {
        return maxExclusive.x() - min.x();
    }

    public int height() {
        return maxExclusive.y() - min.y();
    }

    public boolean contains(GridPos pos) {
        return pos.x() >= min.x() && pos.x() < maxExclusive.x()
                && pos.y() >= min.y() && pos.y() < maxExclusive.y();
    }

    /**
     * Every cell, column by column ({@code x} outer, {@code y} inner).
     */
    public List<GridPos> cells() {
        List<GridPos> cells = new ArrayList<>(width() * height());
        for (int x = min.x(); x < maxExclusive.x(); x++) {
            for (int y = min.y(); y < maxExclusive.y(); y++) {
                cells.add(new GridPos(x, y));
            }
        }
        return cells;
    }

    /**
     * Border cells: for each column the top then bottom cell, then for each inner row the
     * left then right cell. Cells shared by both sides of a one-cell-wide range appear twice.
     */
    public List<GridPos> boundary() {
        int maxX = maxExclusive.x() - 1;
        int maxY = maxExclusive.y() - 1;
        List<GridPos> border = new ArrayList<>(2 * (width() + height()));
        for (int x = min.x(); x <= maxX; x++) {
            border.add(new GridPos(x, min.y()));
            border.add(new GridPos(x, maxY));
        }
        for (int y = min.y() + 1; y < maxY; y++) {
            border.add(new GridPos(min.x(), y));
            border.add(new GridPos(maxX, y));
        }
        return border;
    }

    /**
     * Smallest Chebyshev distance from {@code pos} to any cell of the range.
     */
    public float chebyshevDistance(GridPos pos) {
        int dx = axisGap(pos.x(), min.x(), maxExclusive.x() - 1);
        int dy = axisGap(pos.y(), min.y(), maxExclusive.y() - 1);
        return Math.max(dx, dy);
    }

    private static int axisGap(int value, int lo, int hi) {
        if (value < lo) {
            return lo - value;
        }
        if (value > hi) {
            return value - hi;
        }
        return 0;
    }
}
