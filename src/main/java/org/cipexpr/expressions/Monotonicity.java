package org.cipexpr.expressions;

/**
 * 表达式关于某个子表达式的单调性。
 */
public enum Monotonicity {
    UNKNOWN,
    INCREASING,
    DECREASING,
    CONSTANT;

    public Monotonicity negate() {
        return switch (this) {
            case INCREASING -> DECREASING;
            case DECREASING -> INCREASING;
            default -> this;
        };
    }
}
