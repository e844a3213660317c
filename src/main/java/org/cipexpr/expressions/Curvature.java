package org.cipexpr.expressions;

/**
 * 曲率，按位编码：LINEAR = CONVEX | CONCAVE。
 */
public enum Curvature {
    UNKNOWN(0),
    CONVEX(1),
    CONCAVE(2),
    LINEAR(3);

    private final int bits;

    Curvature(int bits) {
        this.bits = bits;
    }

    public int getBits() {
        return bits;
    }

    public static Curvature fromBits(int bits) {
        return switch (bits & 3) {
            case 1 -> CONVEX;
            case 2 -> CONCAVE;
            case 3 -> LINEAR;
            default -> UNKNOWN;
        };
    }

    public boolean isConvex() {
        return (bits & 1) != 0;
    }

    public boolean isConcave() {
        return (bits & 2) != 0;
    }

    /**
     * 同时满足两者的曲率（按位与）。
     */
    public Curvature and(Curvature other) {
        return fromBits(bits & other.bits);
    }

    /**
     * 乘以 -1 后的曲率。
     */
    public Curvature negate() {
        return switch (this) {
            case CONVEX -> CONCAVE;
            case CONCAVE -> CONVEX;
            default -> this;
        };
    }

    /**
     * 乘以标量 factor 后的曲率。
     */
    public Curvature multiply(double factor) {
        if (factor == 0.0) {
            return LINEAR;
        }
        return factor > 0.0 ? this : negate();
    }
}
