package org.cipexpr.expressions.handlers;

import org.cipexpr.core.PointValuation;
import org.cipexpr.core.Variable;
import org.cipexpr.expressions.*;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.expressions.walk.WalkStage;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.utils.HashUtils;
import org.cipexpr.utils.Interval;

import java.util.EnumSet;

/**
 * 问题变量。叶子区间由 {@link LeafIntervalSource} 提供。
 */
public final class VariableHandler extends ExprHandler {

    public static final String NAME = "var";
    public static final int PRECEDENCE = 0;

    private static final long NAME_HASH = HashUtils.stringHash(NAME);

    public VariableHandler() {
        super(NAME, "variable", PRECEDENCE, EnumSet.of(
                ExprCapability.COMPARE,
                ExprCapability.PRINT,
                ExprCapability.HASH,
                ExprCapability.INTERVAL_EVAL,
                ExprCapability.CURVATURE,
                ExprCapability.INTEGRALITY));
    }

    private static Variable variableOf(Expression expr) {
        return ((VariableData) expr.getData()).getVariable();
    }

    @Override
    public double evaluate(Expression expr, double[] childValues, PointValuation point) {
        return point.getValue(variableOf(expr));
    }

    @Override
    public int compare(Expression expr1, Expression expr2, ExpressionComparator comparator) {
        return Integer.signum(variableOf(expr1).compareTo(variableOf(expr2)));
    }

    @Override
    public void print(ExprWalkFrame frame, StringBuilder out) {
        if (frame.getStage() == WalkStage.ENTER_EXPR) {
            out.append('<').append(variableOf(frame.getExpr()).getName()).append('>');
        }
    }

    @Override
    public long hash(Expression expr, long[] childHashes) {
        return NAME_HASH ^ HashUtils.fibHash((long) variableOf(expr).getId());
    }

    @Override
    public Interval intervalEval(Expression expr, LeafIntervalSource leafSource) {
        return leafSource.getInterval(variableOf(expr));
    }

    @Override
    public Curvature curvature(Expression expr) {
        return Curvature.LINEAR;
    }

    @Override
    public boolean integrality(Expression expr) {
        return variableOf(expr).isIntegral();
    }
}
