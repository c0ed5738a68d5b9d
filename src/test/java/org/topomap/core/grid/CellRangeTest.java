package org.topomap.core.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CellRange")
class CellRangeTest {

    @Test
    @DisplayName("Empty ranges are rejected")
    void testRejectsEmpty() {
        assertThrows(IllegalArgumentException.class, () -> new CellRange(GridPos.of(0, 0), GridPos.of(0, 3)));
        assertThrows(IllegalArgumentException.class, () -> new CellRange(GridPos.of(0, 0), GridPos.of(2, -1)));
    }

    @Test
    @DisplayName("Cells enumerate column by column")
    void testCells() {
        CellRange range = new CellRange(GridPos.of(1, 1), GridPos.of(3, 3));
        assertEquals(
                List.of(GridPos.of(1, 1), GridPos.of(1, 2), GridPos.of(2, 1), GridPos.of(2, 2)),
                range.cells()
        );
        assertEquals(2, range.width());
        assertEquals(2, range.height());
    }

    @Test
    @DisplayName("Boundary lists top/bottom rows, then inner left/right columns")
    void testBoundaryOrder() {
        CellRange range = new CellRange(GridPos.of(0, 0), GridPos.of(3, 3));
        assertEquals(
                List.of(
                        GridPos.of(0, 0), GridPos.of(0, 2),
                        GridPos.of(1, 0), GridPos.of(1, 2),
                        GridPos.of(2, 0), GridPos.of(2, 2),
                        GridPos.of(0, 1), GridPos.of(2, 1)
                ),
                range.boundary()
        );
    }

    @Test
    @DisplayName("Boundary of a 3x10 block has 22 distinct cells")
    void testBoundaryOfTallBlock() {
        CellRange range = new CellRange(GridPos.of(-1, -5), GridPos.of(2, 5));
        List<GridPos> border = range.boundary();
        assertEquals(22, border.size());
        assertEquals(22, new HashSet<>(border).size(), "No cell should repeat");
        assertFalse(border.contains(GridPos.of(0, 0)), "Interior cell must not be on the boundary");
    }

    @Test
    @DisplayName("Chebyshev distance to the nearest cell")
    void testChebyshevDistance() {
        CellRange range = new CellRange(GridPos.of(0, 0), GridPos.of(3, 10));
        assertEquals(0.0f, range.chebyshevDistance(GridPos.of(1, 5)));
        assertEquals(1.0f, range.chebyshevDistance(GridPos.of(1, 10)));
        assertEquals(3.0f, range.chebyshevDistance(GridPos.of(-3, -1)));
        assertEquals(4.0f, range.chebyshevDistance(GridPos.of(6, 13)));
    }
}
