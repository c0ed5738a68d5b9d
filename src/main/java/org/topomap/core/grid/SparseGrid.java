package org.topomap.core.grid;

import it.unimi.dsi.fastutil.longs.Long2ObjectMap;
import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Unbounded grid storing values only for occupied cells.
 *
 * <p>A missing key means the cell is empty. Positions are packed into primitive
 * {@code long} keys (see {@link GridPos#pack()}) so lookups avoid allocating key objects.</p>
 *
 * <p>This class is NOT thread-safe.</p>
 *
 * @param <V> cell value type.
 */
public class SparseGrid<V> {
    private final Long2ObjectOpenHashMap<V> cells;

    /**
     * Creates an empty grid.
     */
    public SparseGrid() {
        this.cells = new Long2ObjectOpenHashMap<>();
    }

    /**
     * Returns the value stored at a cell, if any.
     */
    public Optional<V> get(GridPos pos) {
        return Optional.ofNullable(cells.get(pos.pack()));
    }

    /**
     * Returns the value stored at a cell, or {@code fallback} when the cell is empty.
     */
    public V getOrDefault(GridPos pos, V fallback) {
        V value = cells.get(pos.pack());
        return value == null ? fallback : value;
    }

    /**
     * Stores a value at a cell, replacing any previous value.
     *
     * @throws NullPointerException if {@code value} is null; use {@link #remove(GridPos)} to clear.
     */
    public void set(GridPos pos, V value) {
        cells.put(pos.pack(), Objects.requireNonNull(value, "value"));
    }

    /**
     * Clears a cell.
     *
     * @return the previous value, or null when the cell was empty.
     */
    public V remove(GridPos pos) {
        return cells.remove(pos.pack());
    }

    /**
     * Returns whether a cell holds a value.
     */
    public boolean contains(GridPos pos) {
        return cells.containsKey(pos.pack());
    }

    /**
     * Returns the value at a cell, creating it with {@code factory} when absent.
     * Intended for grids whose values are small mutable collections.
     */
    public V computeIfAbsent(GridPos pos, Function<GridPos, V> factory) {
        long key = pos.pack();
        V value = cells.get(key);
        if (value == null) {
            value = Objects.requireNonNull(factory.apply(pos), "factory result");
            cells.put(key, value);
        }
        return value;
    }

    /**
     * Number of occupied cells.
     */
    public int size() {
        return cells.size();
    }

    public boolean isEmpty() {
        return cells.isEmpty();
    }

    public void clear() {
        cells.clear();
    }

    /**
     * Returns occupied positions in ascending {@link GridPos} order.
     */
    public List<GridPos> positions() {
        List<GridPos> positions = new ArrayList<>(cells.size());
        for (long key : cells.keySet()) {
            positions.add(GridPos.unpack(key));
        }
        Collections.sort(positions);
        return positions;
    }

    /**
     * Visits every occupied cell in ascending position order.
     */
    public void forEach(BiConsumer<GridPos, V> visitor) {
        for (GridPos pos : positions()) {
            visitor.accept(pos, cells.get(pos.pack()));
        }
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SparseGrid{");
        boolean first = true;
        for (Long2ObjectMap.Entry<V> entry : cells.long2ObjectEntrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(GridPos.unpack(entry.getLongKey())).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append('}').toString();
    }
}
