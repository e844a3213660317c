package org.cipexpr.expressions.handlers;

import org.cipexpr.core.PointValuation;
import org.cipexpr.expressions.*;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.expressions.walk.WalkStage;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.utils.HashUtils;
import org.cipexpr.utils.Interval;

import java.util.EnumSet;

/**
 * 常数。
 */
public final class ValueHandler extends ExprHandler {

    public static final String NAME = "val";
    public static final int PRECEDENCE = 10000;

    private static final long NAME_HASH = HashUtils.stringHash(NAME);

    public ValueHandler() {
        super(NAME, "constant value", PRECEDENCE, EnumSet.of(
                ExprCapability.COMPARE,
                ExprCapability.PRINT,
                ExprCapability.HASH,
                ExprCapability.INTERVAL_EVAL,
                ExprCapability.CURVATURE,
                ExprCapability.MONOTONICITY,
                ExprCapability.INTEGRALITY));
    }

    private static double valueOf(Expression expr) {
        return ((ValueData) expr.getData()).getValue();
    }

    @Override
    public double evaluate(Expression expr, double[] childValues, PointValuation point) {
        return valueOf(expr);
    }

    @Override
    public int compare(Expression expr1, Expression expr2, ExpressionComparator comparator) {
        double v1 = valueOf(expr1);
        double v2 = valueOf(expr2);
        if (v1 < v2) {
            return -1;
        }
        return v1 > v2 ? 1 : 0;
    }

    @Override
    public void print(ExprWalkFrame frame, StringBuilder out) {
        if (frame.getStage() != WalkStage.ENTER_EXPR) {
            return;
        }
        double value = valueOf(frame.getExpr());
        if (value < 0.0 && !frame.isRoot()) {
            out.append('(').append(ExpressionPrinter.formatNumber(value)).append(')');
        } else {
            out.append(ExpressionPrinter.formatNumber(value));
        }
    }

    @Override
    public long hash(Expression expr, long[] childHashes) {
        return NAME_HASH ^ HashUtils.fibHash(valueOf(expr));
    }

    @Override
    public Interval intervalEval(Expression expr, LeafIntervalSource leafSource) {
        return Interval.point(valueOf(expr));
    }

    @Override
    public Curvature curvature(Expression expr) {
        return Curvature.LINEAR;
    }

    @Override
    public Monotonicity monotonicity(Expression expr, int childIndex) {
        return Monotonicity.CONSTANT;
    }

    @Override
    public boolean integrality(Expression expr) {
        double value = valueOf(expr);
        return value == Math.rint(value);
    }
}
