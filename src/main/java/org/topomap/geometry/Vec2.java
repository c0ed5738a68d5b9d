package org.topomap.geometry;

/**
 * Immutable 2D vector, used both as a point and as a direction.
 *
 * @param x horizontal component.
 * @param y vertical component (grows southwards in grid space).
 */
public record Vec2(float x, float y) {
    public static final Vec2 ZERO = new Vec2(0.0f, 0.0f);

    /**
     * Euclidean length.
     */
    public float length() {
        return (float) Math.hypot(x, y);
    }

    /**
     * Returns the unit vector with the same direction, or {@link #ZERO} for the zero vector.
     */
    public Vec2 normalized() {
        float len = length();
        if (len == 0.0f) {
            return ZERO;
        }
        return div(len);
    }

    public Vec2 add(Vec2 other) {
        return new Vec2(x + other.x, y + other.y);
    }

    public Vec2 sub(Vec2 other) {
        return new Vec2(x - other.x, y - other.y);
    }

    public Vec2 mul(float factor) {
        return new Vec2(x * factor, y * factor);
    }

    public Vec2 div(float divisor) {
        return new Vec2(x / divisor, y / divisor);
    }

    public float dot(Vec2 other) {
        return x * other.x + y * other.y;
    }

    /**
     * Linear interpolation {@code this + (other - this) * t}.
     */
    public Vec2 lerp(Vec2 other, float t) {
        return mul(1.0f - t).add(other.mul(t));
    }

    public boolean isNaN() {
        return Float.isNaN(x) || Float.isNaN(y);
    }

    /**
     * Returns whether both components differ by less than {@code eps}.
     */
    public boolean approxEquals(Vec2 other, float eps) {
        if (equals(other)) {
            return true;
        }
        return Math.abs(x - other.x) < eps && Math.abs(y - other.y) < eps;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
