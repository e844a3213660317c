package org.cipexpr.expressions.handlers;

import lombok.Getter;
import org.cipexpr.expressions.ExprData;

/**
 * 常数节点的值。
 */
@Getter
public final class ValueData implements ExprData {

    private final double value;

    public ValueData(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("常数节点的值必须有限: " + value);
        }
        // -0.0 统一成 0.0
        this.value = value == 0.0 ? 0.0 : value;
    }

    @Override
    public ValueData copy() {
        return this;
    }
}
