package org.topomap.core.grid;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.topomap.geometry.Vec2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GridPos")
class GridPosTest {

    @Test
    @DisplayName("Packed keys survive negative coordinates")
    void testPackUnpack() {
        GridPos[] samples = {
                GridPos.of(0, 0),
                GridPos.of(-1, -1),
                GridPos.of(Integer.MIN_VALUE, Integer.MAX_VALUE),
                GridPos.of(12, -7)
        };
        for (GridPos pos : samples) {
            assertEquals(pos, GridPos.unpack(pos.pack()), "pack/unpack mismatch for " + pos);
        }
        assertNotEquals(GridPos.of(1, 0).pack(), GridPos.of(0, 1).pack());
    }

    @Test
    @DisplayName("Ordering is by x, then y")
    void testOrdering() {
        List<GridPos> positions = new ArrayList<>(List.of(
                GridPos.of(1, 0), GridPos.of(0, 5), GridPos.of(0, -2), GridPos.of(-3, 9)
        ));
        Collections.sort(positions);
        assertEquals(List.of(GridPos.of(-3, 9), GridPos.of(0, -2), GridPos.of(0, 5), GridPos.of(1, 0)), positions);
    }

    @Test
    @DisplayName("Chebyshev distance is the larger axis delta")
    void testChebyshevDistance() {
        assertEquals(4.0f, GridPos.of(0, 0).chebyshevDistance(GridPos.of(3, -4)));
        assertEquals(0.0f, GridPos.of(2, 2).chebyshevDistance(GridPos.of(2, 2)));
    }

    @Test
    @DisplayName("Truncation rounds toward zero")
    void testTruncate() {
        assertEquals(GridPos.of(1, 2), GridPos.truncate(new Vec2(1.9f, 2.2f)));
        assertEquals(GridPos.of(0, -1), GridPos.truncate(new Vec2(-0.5f, -1.5f)));
    }

    @Test
    @DisplayName("Min and max are component-wise")
    void testMinMax() {
        GridPos a = GridPos.of(1, 8);
        GridPos b = GridPos.of(4, -2);
        assertEquals(GridPos.of(1, -2), a.min(b));
        assertEquals(GridPos.of(4, 8), a.max(b));
    }
}
