package org.cipexpr.expressions; // 放在 expressions 包下

import org.cipexpr.utils.Interval;

/**
 * 约束 root ~ bound 中的关系。
 */
public enum RelationType {

    LE("<="),   // Less Equal
    GE(">="),   // Greater Equal
    EQ("=");    // Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * 把 root ~ bound 转成 root 的取值范围 [lhs, rhs]。
     */
    public Interval toSides(double bound) {
        return switch (this) {
            case LE -> Interval.of(Double.NEGATIVE_INFINITY, bound);
            case GE -> Interval.of(bound, Double.POSITIVE_INFINITY);
            case EQ -> Interval.point(bound);
        };
    }
}
