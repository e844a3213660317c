package org.cipexpr.expressions.handlers;

import lombok.Getter;
import org.cipexpr.expressions.ExprData;

/**
 * 积 coefficient * Π child[i] 的系数。
 */
@Getter
public final class ProductData implements ExprData {

    private final double coefficient;

    public ProductData(double coefficient) {
        this.coefficient = coefficient;
    }

    @Override
    public ProductData copy() {
        return new ProductData(coefficient);
    }
}
