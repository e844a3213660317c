package org.cipexpr.expressions.handlers;

import org.cipexpr.core.PointValuation;
import org.cipexpr.expressions.*;
import org.cipexpr.expressions.simplify.ExpressionComparator;
import org.cipexpr.expressions.walk.ExprWalkFrame;
import org.cipexpr.propagation.LeafIntervalSource;
import org.cipexpr.propagation.ReversePropagationContext;
import org.cipexpr.utils.HashUtils;
import org.cipexpr.utils.Interval;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * 积 coefficient * Π e_i。
 * <p>
 * 规范形式：系数为 1，至少两个因子，没有常数、积或"常数为 0 的单项和"因子，
 * 同底的因子已合并为幂，因子按比较器严格递减排列。
 * 非 1 的系数被提到外层的单项和上。
 *
 * @author Ayalyt
 */
public final class ProductHandler extends ExprHandler {

    public static final String NAME = "prod";
    public static final int PRECEDENCE = 50000;

    private static final long NAME_HASH = HashUtils.stringHash(NAME);

    public ProductHandler() {
        super(NAME, "product of expressions", PRECEDENCE, EnumSet.of(
                ExprCapability.SIMPLIFY,
                ExprCapability.COMPARE,
                ExprCapability.PRINT,
                ExprCapability.HASH,
                ExprCapability.INTERVAL_EVAL,
                ExprCapability.REVERSE_PROP,
                ExprCapability.BACKWARD_DIFF,
                ExprCapability.CURVATURE,
                ExprCapability.MONOTONICITY,
                ExprCapability.INTEGRALITY));
    }

    private static double coefficientOf(Expression expr) {
        return ((ProductData) expr.getData()).getCoefficient();
    }

    @Override
    public double evaluate(Expression expr, double[] childValues, PointValuation point) {
        double result = coefficientOf(expr);
        for (double v : childValues) {
            result *= v;
        }
        return Double.isFinite(result) ? result : Expression.INVALID_VALUE;
    }

    // ========== 化简 ==========

    /**
     * 因子 base^exponent。
     */
    private static final class Factor {
        private final Expression base;
        private double exponent;

        private Factor(Expression base, double exponent) {
            this.base = base;
            this.exponent = exponent;
        }
    }

    @Override
    public Expression simplify(Expression expr, ExprEngine engine) {
        double coefficient = coefficientOf(expr);
        List<Factor> factors = new ArrayList<>();
        for (Expression child : expr.getChildren()) {
            coefficient *= collectFactor(engine, child, factors);
        }
        Expression result = buildCanonical(expr, engine, coefficient, factors);
        recordSimplifyCall(result != expr);
        return result;
    }

    /**
     * 把 factor 拆成系数与因子：常数并入系数，子积与"常数为 0 的单项和"被展开，幂拆成底与指数。
     * @return 需要乘到系数上的值。
     */
    private static double collectFactor(ExprEngine engine, Expression factor, List<Factor> factors) {
        if (engine.isValue(factor)) {
            return engine.getValue(factor);
        }
        if (engine.isProduct(factor)) {
            double c = coefficientOf(factor);
            for (Expression child : factor.getChildren()) {
                c *= collectFactor(engine, child, factors);
            }
            return c;
        }
        if (engine.isSum(factor) && factor.getNChildren() == 1) {
            SumData data = (SumData) factor.getData();
            if (data.getConstant() == 0.0) {
                return data.getCoefficient(0) * collectFactor(engine, factor.getChild(0), factors);
            }
        }
        if (engine.isPow(factor)) {
            insertFactor(engine, factors, factor.getChild(0), ((PowData) factor.getData()).getExponent());
        } else {
            insertFactor(engine, factors, factor, 1.0);
        }
        return 1.0;
    }

    /**
     * 同底的因子合并指数，否则按递减顺序插入。
     */
    private static void insertFactor(ExprEngine engine, List<Factor> factors, Expression base, double exponent) {
        ExpressionComparator comparator = engine.getComparator();
        for (int i = 0; i < factors.size(); i++) {
            int cmp = comparator.compare(factors.get(i).base, base);
            if (cmp == 0) {
                factors.get(i).exponent += exponent;
                return;
            }
            if (cmp < 0) {
                factors.add(i, new Factor(base, exponent));
                return;
            }
        }
        factors.add(new Factor(base, exponent));
    }

    private Expression buildCanonical(Expression original, ExprEngine engine, double coefficient, List<Factor> factors) {
        if (coefficient == 0.0) {
            return engine.createValue(0.0);
        }
        PowHandler powHandler = engine.getRegistry().getPowHandler();
        List<Expression> finals = new ArrayList<>(factors.size());
        boolean recollect = false;
        for (Factor factor : factors) {
            if (factor.exponent == 0.0) {
                continue;
            }
            Expression built;
            if (factor.exponent == 1.0) {
                built = factor.base;
                engine.capture(built);
            } else {
                Expression pow = engine.createPow(factor.base, factor.exponent);
                built = powHandler.simplify(pow, engine);
                engine.release(pow);
            }
            if (engine.isValue(built) || engine.isProduct(built) || isSingleTermSum(engine, built)) {
                recollect = true;
            }
            finals.add(built);
        }

        if (recollect) {
            // 某个幂化简成了常数、积或单项和，重新收集一遍
            List<Factor> again = new ArrayList<>();
            double c = coefficient;
            for (Expression built : finals) {
                c *= collectFactor(engine, built, again);
            }
            Expression result = buildCanonical(original, engine, c, again);
            releaseAll(engine, finals);
            return result;
        }

        finals.sort((a, b) -> engine.getComparator().compare(b, a));

        if (finals.isEmpty()) {
            return engine.createValue(coefficient);
        }
        if (finals.size() == 1) {
            Expression only = finals.get(0);
            if (coefficient == 1.0) {
                return only;
            }
            Expression sum = engine.createSum(List.of(only), new double[]{coefficient}, 0.0);
            engine.release(only);
            Expression result = engine.getRegistry().getSumHandler().simplify(sum, engine);
            engine.release(sum);
            return result;
        }
        if (coefficient == 1.0 && sameChildren(original, finals)) {
            releaseAll(engine, finals);
            engine.capture(original);
            return original;
        }
        Expression product = engine.createProduct(finals, 1.0);
        releaseAll(engine, finals);
        if (coefficient == 1.0) {
            return product;
        }
        Expression sum = engine.createSum(List.of(product), new double[]{coefficient}, 0.0);
        engine.release(product);
        return sum;
    }

    private static boolean isSingleTermSum(ExprEngine engine, Expression expr) {
        return engine.isSum(expr) && expr.getNChildren() == 1
                && ((SumData) expr.getData()).getConstant() == 0.0;
    }

    private static boolean sameChildren(Expression original, List<Expression> finals) {
        if (!(original.getData() instanceof ProductData) || original.getNChildren() != finals.size()) {
            return false;
        }
        for (int i = 0; i < finals.size(); i++) {
            if (original.getChild(i) != finals.get(i)) {
                return false;
            }
        }
        return true;
    }

    private static void releaseAll(ExprEngine engine, List<Expression> exprs) {
        for (Expression e : exprs) {
            engine.release(e);
        }
    }

    // ========== 比较、打印、哈希 ==========

    @Override
    public int compare(Expression expr1, Expression expr2, ExpressionComparator comparator) {
        int n = Math.min(expr1.getNChildren(), expr2.getNChildren());
        for (int i = 0; i < n; i++) {
            int cmp = comparator.compare(expr1.getChild(i), expr2.getChild(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        if (expr1.getNChildren() != expr2.getNChildren()) {
            return expr1.getNChildren() < expr2.getNChildren() ? -1 : 1;
        }
        return SumHandler.compareDoubles(coefficientOf(expr1), coefficientOf(expr2));
    }

    @Override
    public void print(ExprWalkFrame frame, StringBuilder out) {
        boolean parenthesize = PRECEDENCE <= frame.getParentPrecedence();
        switch (frame.getStage()) {
            case ENTER_EXPR:
                if (parenthesize) {
                    out.append('(');
                }
                double coefficient = coefficientOf(frame.getExpr());
                if (coefficient == -1.0) {
                    out.append('-');
                } else if (coefficient != 1.0) {
                    out.append(ExpressionPrinter.formatNumber(coefficient)).append('*');
                }
                break;
            case VISITING_CHILD:
                if (frame.getCurrentChild() > 0) {
                    out.append('*');
                }
                break;
            case LEAVE_EXPR:
                if (parenthesize) {
                    out.append(')');
                }
                break;
            default:
                break;
        }
    }

    @Override
    public long hash(Expression expr, long[] childHashes) {
        long h = NAME_HASH ^ HashUtils.fibHash(coefficientOf(expr));
        for (long childHash : childHashes) {
            h = h * 31 + childHash;
        }
        return h;
    }

    // ========== 区间 ==========

    @Override
    public Interval intervalEval(Expression expr, LeafIntervalSource leafSource) {
        Interval result = Interval.point(coefficientOf(expr));
        for (Expression child : expr.getChildren()) {
            result = result.mul(child.getInterval());
        }
        recordIntervalEval();
        return result;
    }

    /**
     * 对每个因子：x_i ∈ 目标 / (系数 * Π_{j≠i} x_j)，其余因子的积含 0 时跳过。
     */
    @Override
    public void reversePropagate(Expression expr, ReversePropagationContext context) {
        Interval target = expr.getInterval();
        recordReversePropCall();
        if (target.isEntire()) {
            return;
        }
        for (int i = 0; i < expr.getNChildren(); i++) {
            Interval others = othersProduct(expr, i);
            if (others.contains(0.0)) {
                continue;
            }
            if (context.tighten(expr.getChild(i), target.div(others))) {
                recordCutoff();
                return;
            }
        }
    }

    private static Interval othersProduct(Expression expr, int skip) {
        Interval others = Interval.point(coefficientOf(expr));
        for (int j = 0; j < expr.getNChildren(); j++) {
            if (j != skip) {
                others = others.mul(expr.getChild(j).getInterval());
            }
        }
        return others;
    }

    // ========== 导数与分析 ==========

    @Override
    public double backwardDiff(Expression expr, int childIndex) {
        double result = coefficientOf(expr);
        for (int j = 0; j < expr.getNChildren(); j++) {
            if (j != childIndex) {
                result *= expr.getChild(j).getValue();
            }
        }
        return Double.isFinite(result) ? result : Expression.INVALID_VALUE;
    }

    @Override
    public Curvature curvature(Expression expr) {
        if (expr.getNChildren() == 1) {
            return expr.getChild(0).getCurvature().multiply(coefficientOf(expr));
        }
        return Curvature.UNKNOWN;
    }

    @Override
    public Monotonicity monotonicity(Expression expr, int childIndex) {
        Interval others = othersProduct(expr, childIndex);
        if (others.isEmpty()) {
            return Monotonicity.UNKNOWN;
        }
        if (others.isPoint() && others.getInf() == 0.0) {
            return Monotonicity.CONSTANT;
        }
        if (others.getInf() >= 0.0) {
            return Monotonicity.INCREASING;
        }
        if (others.getSup() <= 0.0) {
            return Monotonicity.DECREASING;
        }
        return Monotonicity.UNKNOWN;
    }

    @Override
    public boolean integrality(Expression expr) {
        double coefficient = coefficientOf(expr);
        if (coefficient != Math.rint(coefficient)) {
            return false;
        }
        for (Expression child : expr.getChildren()) {
            if (!child.isIntegral()) {
                return false;
            }
        }
        return true;
    }
}
