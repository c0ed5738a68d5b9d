package org.topomap.topology;

/**
 * Size of a node drawn as a rectangle centered on its position, in grid units.
 *
 * @param width horizontal size.
 * @param height vertical size.
 */
public record NodeExtents(float width, float height) {
}
