package org.topomap.geometry;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Immutable sequence of points describing the segments {@code (p0, p1), (p1, p2), ...}.
 *
 * <p>A polyline with fewer than two points is degenerate: its length is zero.</p>
 */
public final class Polyline {
    /** Minimum cosine between consecutive segments for the shared point to be kept by {@link #simplify()}. */
    public static final float COLINEAR_THRESHOLD = 0.99f;

    private static final Polyline EMPTY = new Polyline(List.of());
    private static final int PAIRWISE_LEAF = 8;

    private final List<Vec2> points;

    private Polyline(List<Vec2> points) {
        this.points = points;
    }

    public static Polyline empty() {
        return EMPTY;
    }

    public static Polyline of(Vec2... points) {
        return of(Arrays.asList(points));
    }

    /**
     * Copies {@code points} into a new polyline.
     *
     * @throws NullPointerException if the list or any point is null.
     */
    public static Polyline of(List<Vec2> points) {
        if (points.isEmpty()) {
            return EMPTY;
        }
        return new Polyline(List.copyOf(points));
    }

    /**
     * Unmodifiable view of the points.
     */
    public List<Vec2> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public boolean isEmpty() {
        return points.isEmpty();
    }

    public Vec2 get(int index) {
        return points.get(index);
    }

    /**
     * @throws IndexOutOfBoundsException if the polyline is empty.
     */
    public Vec2 first() {
        return points.get(0);
    }

    /**
     * @throws IndexOutOfBoundsException if the polyline is empty.
     */
    public Vec2 last() {
        return points.get(points.size() - 1);
    }

    /**
     * Returns every point translated by {@code offset}.
     */
    public Polyline add(Vec2 offset) {
        List<Vec2> moved = new ArrayList<>(points.size());
        for (Vec2 p : points) {
            moved.add(p.add(offset));
        }
        return of(moved);
    }

    /**
     * Returns every point scaled by {@code factor}.
     */
    public Polyline mul(float factor) {
        List<Vec2> scaled = new ArrayList<>(points.size());
        for (Vec2 p : points) {
            scaled.add(p.mul(factor));
        }
        return of(scaled);
    }

    /**
     * Total Euclidean length, summed pairwise to limit round-off.
     */
    public float length() {
        if (points.size() <= 1) {
            return 0.0f;
        }
        float[] lengths = new float[points.size() - 1];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = points.get(i + 1).sub(points.get(i)).length();
        }
        return pairwiseSum(lengths, 0, lengths.length);
    }

    /**
     * Drops points with a NaN component and consecutive repeats.
     */
    public Polyline fix() {
        if (points.isEmpty()) {
            return this;
        }
        List<Vec2> fixed = new ArrayList<>(points.size());
        Vec2 previous = null;
        for (Vec2 p : points) {
            if (p.isNaN() || p.equals(previous)) {
                continue;
            }
            fixed.add(p);
            previous = p;
        }
        return of(fixed);
    }

    /**
     * Removes interior points whose adjacent segments are colinear within {@link #COLINEAR_THRESHOLD}.
     */
    public Polyline simplify() {
        return simplify(COLINEAR_THRESHOLD);
    }

    /**
     * Removes interior points where the cosine between the incoming and outgoing segment
     * directions is at least {@code threshold}.
     */
    public Polyline simplify(float threshold) {
        if (points.size() <= 2) {
            return this;
        }
        List<Vec2> simplified = new ArrayList<>();
        simplified.add(first());
        for (int i = 1; i < points.size() - 1; i++) {
            Vec2 prev = points.get(i - 1);
            Vec2 cur = points.get(i);
            Vec2 next = points.get(i + 1);

            float similarity = cur.sub(prev).normalized().dot(next.sub(cur).normalized());
            if (similarity < threshold) {
                simplified.add(cur);
            }
        }
        simplified.add(last());
        return of(simplified);
    }

    /**
     * Divides each segment into {@code count} equal parts.
     */
    public Polyline subdivide(int count) {
        if (count <= 1 || points.size() < 2) {
            return this;
        }
        List<Vec2> divided = new ArrayList<>((points.size() - 1) * count + 1);
        for (int i = 0; i < points.size() - 1; i++) {
            Vec2 start = points.get(i);
            Vec2 end = points.get(i + 1);
            for (int j = 0; j < count; j++) {
                divided.add(start.lerp(end, (float) j / count));
            }
        }
        divided.add(last());
        return of(divided);
    }

    /**
     * Returns the point {@code t * length()} along the line; {@code t} is clamped to {@code [0, 1]}.
     *
     * @return the point, or {@link Vec2#ZERO} for an empty polyline.
     */
    public Vec2 interpolate(float t) {
        Cursor cursor = locate(t);
        if (cursor == null) {
            return Vec2.ZERO;
        }
        if (cursor.from() == cursor.to()) {
            return points.get(cursor.from());
        }
        return points.get(cursor.from()).lerp(points.get(cursor.to()), cursor.t());
    }

    /**
     * Splits the line at {@code t * length()}; {@code t} is clamped to {@code [0, 1]}.
     *
     * <p>Both halves hold at least one point and {@code head.last().equals(tail.first())}.
     * An empty polyline splits into two empty halves.</p>
     */
    public Split splitAt(float t) {
        Cursor cursor = locate(t);
        if (cursor == null) {
            return new Split(EMPTY, EMPTY);
        }
        List<Vec2> head = new ArrayList<>(points.subList(0, cursor.from() + 1));
        List<Vec2> tail = new ArrayList<>(points.size() - cursor.to() + 1);
        if (cursor.from() != cursor.to()) {
            Vec2 split = points.get(cursor.from()).lerp(points.get(cursor.to()), cursor.t());
            head.add(split);
            tail.add(split);
        }
        tail.addAll(points.subList(cursor.to(), points.size()));
        return new Split(of(head), of(tail));
    }

    /**
     * Result of {@link #splitAt(float)}.
     */
    public record Split(Polyline head, Polyline tail) {
    }

    private Cursor locate(float t) {
        if (points.isEmpty()) {
            return null;
        }
        if (points.size() == 1 || t <= 0.0f) {
            return new Cursor(0, 0, 0.0f);
        }
        int lastIndex = points.size() - 1;
        if (t >= 1.0f) {
            return new Cursor(lastIndex, lastIndex, 1.0f);
        }
        if (points.size() == 2) {
            return new Cursor(0, 1, t);
        }

        float target = length() * t;
        float travelled = 0.0f;
        for (int i = 0; i < lastIndex; i++) {
            float segment = points.get(i + 1).sub(points.get(i)).length();
            if (segment == 0.0f) {
                continue;
            }
            float next = travelled + segment;
            if (next == target) {
                return new Cursor(i + 1, i + 1, 0.0f);
            }
            if (next > target) {
                return new Cursor(i, i + 1, (target - travelled) / segment);
            }
            travelled = next;
        }
        // round-off left the target just past the final point
        return new Cursor(lastIndex, lastIndex, 1.0f);
    }

    private static float pairwiseSum(float[] values, int from, int to) {
        int count = to - from;
        if (count <= PAIRWISE_LEAF) {
            float sum = 0.0f;
            for (int i = from; i < to; i++) {
                sum += values[i];
            }
            return sum;
        }
        int mid = from + count / 2;
        return pairwiseSum(values, from, mid) + pairwiseSum(values, mid, to);
    }

    private record Cursor(int from, int to, float t) {
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Polyline)) {
            return false;
        }
        Polyline other = (Polyline) o;
        return points.equals(other.points);
    }

    @Override
    public int hashCode() {
        return Objects.hash(points);
    }

    @Override
    public String toString() {
        return points.toString();
    }
}
