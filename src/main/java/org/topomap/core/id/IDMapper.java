package org.topomap.core.id;

import lombok.experimental.StandardException;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Bidirectional mapping between external string ids and dense internal integer ids.
 *
 * <p>Routing keeps link ids as small integers inside per-cell occupancy lists; this
 * mapper translates between those and topology link ids.</p>
 */
public interface IDMapper {

    /**
     * Converts an external id to its internal index.
     *
     * @param externalId topology id.
     * @return internal index in {@code [0, size())}.
     * @throws UnknownIDException if the id is not mapped.
     */
    int toInternal(String externalId) throws UnknownIDException;

    /**
     * Converts an internal index back to its external id.
     *
     * @throws IndexOutOfBoundsException if the index is invalid.
     */
    String toExternal(int internalId);

    boolean containsExternal(String externalId);

    boolean containsInternal(int internalId);

    int size();

    /**
     * Thrown when an external id has no mapping.
     */
    @StandardException
    class UnknownIDException extends RuntimeException {
    }

    /**
     * Builds an immutable mapper that numbers ids in ascending lexical order.
     *
     * <p>Sorting first makes internal ids independent of the iteration order of
     * {@code externalIds}.</p>
     *
     * @param externalIds ids to map; duplicates are collapsed.
     */
    static IDMapper sorted(Collection<String> externalIds) {
        return new FastUtilIDMapper(List.copyOf(new TreeSet<>(externalIds)));
    }
}
