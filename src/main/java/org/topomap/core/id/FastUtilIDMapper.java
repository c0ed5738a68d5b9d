package org.topomap.core.id;

import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.List;

/**
 * Immutable {@link IDMapper} backed by a fastutil open hash map.
 *
 * <p>Internal ids are the positions of the external ids in the list given to the constructor.</p>
 */
public class FastUtilIDMapper implements IDMapper {
    private static final int MISSING = -1;

    private final Object2IntOpenHashMap<String> forward;
    private final String[] reverse;

    /**
     * Creates a mapper where {@code externalIds.get(i)} maps to {@code i}.
     *
     * @throws IllegalArgumentException if the list is null, holds a null or a duplicate id.
     */
    public FastUtilIDMapper(List<String> externalIds) {
        if (externalIds == null) {
            throw new IllegalArgumentException("externalIds cannot be null");
        }
        int size = externalIds.size();
        this.forward = new Object2IntOpenHashMap<>(size);
        this.forward.defaultReturnValue(MISSING);
        this.reverse = new String[size];

        for (int i = 0; i < size; i++) {
            String id = externalIds.get(i);
            if (id == null) {
                throw new IllegalArgumentException("null id at index " + i);
            }
            if (forward.put(id, i) != MISSING) {
                throw new IllegalArgumentException("Duplicate id: " + id);
            }
            reverse[i] = id;
        }
        this.forward.trim();
    }

    @Override
    public int toInternal(String externalId) throws UnknownIDException {
        int id = forward.getInt(externalId);
        if (id == MISSING) {
            throw new UnknownIDException("External ID not found: " + externalId);
        }
        return id;
    }

    @Override
    public String toExternal(int internalId) {
        if (!containsInternal(internalId)) {
            throw new IndexOutOfBoundsException("Internal ID out of bounds: " + internalId);
        }
        return reverse[internalId];
    }

    @Override
    public boolean containsExternal(String externalId) {
        return forward.containsKey(externalId);
    }

    @Override
    public boolean containsInternal(int internalId) {
        return internalId >= 0 && internalId < reverse.length;
    }

    @Override
    public int size() {
        return reverse.length;
    }
}
