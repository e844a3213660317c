package org.cipexpr.expressions.handlers;

import lombok.Getter;
import org.cipexpr.expressions.ExprData;

/**
 * 幂 child^exponent 的指数。
 */
@Getter
public final class PowData implements ExprData {

    private final double exponent;

    public PowData(double exponent) {
        if (!Double.isFinite(exponent)) {
            throw new IllegalArgumentException("幂的指数必须有限: " + exponent);
        }
        this.exponent = exponent;
    }

    public boolean isIntegral() {
        return exponent == Math.rint(exponent);
    }

    @Override
    public PowData copy() {
        return new PowData(exponent);
    }
}
